package org.xspec;

import java.io.PrintStream;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.function.LongSupplier;
import java.util.function.Supplier;
import org.xspec.engine.ExecutionListener;
import org.xspec.engine.ExecutionMode;
import org.xspec.engine.ExecutionOutcome;
import org.xspec.engine.NodeExecutor;
import org.xspec.engine.ScenarioCollector;
import org.xspec.obs.JsonLinesLogger;
import org.xspec.obs.RunContext;
import org.xspec.report.SpecReport;
import org.xspec.report.SpecReportRenderer;
import org.xspec.tree.SpecNode;

/**
 * Executes a spec tree under one execution mode, prints the report and derives the verdict.
 */
public final class SpecRunner {
    private final PrintStream reportSink;
    private final boolean echoReport;
    private final JsonLinesLogger logger;
    private final LongSupplier nanoTicker;
    private final Supplier<String> runIds;
    private final SpecReportRenderer renderer = new SpecReportRenderer();

    public SpecRunner(PrintStream reportSink, boolean echoReport, JsonLinesLogger logger) {
        this(reportSink, echoReport, logger, System::nanoTime, () -> UUID.randomUUID().toString());
    }

    public SpecRunner(
        PrintStream reportSink,
        boolean echoReport,
        JsonLinesLogger logger,
        LongSupplier nanoTicker,
        Supplier<String> runIds
    ) {
        this.reportSink = Objects.requireNonNull(reportSink, "reportSink");
        this.echoReport = echoReport;
        this.logger = Objects.requireNonNull(logger, "logger");
        this.nanoTicker = Objects.requireNonNull(nanoTicker, "nanoTicker");
        this.runIds = Objects.requireNonNull(runIds, "runIds");
    }

    /**
     * Runs the tree containing {@code node} and returns the report without raising on failure.
     */
    public SpecReport run(SpecNode node, ExecutionMode mode) {
        Objects.requireNonNull(node, "node");
        Objects.requireNonNull(mode, "mode");
        SpecNode root = node.root();
        RunContext context = RunContext.of(runIds.get(), mode.key(), root.description());
        logger.info(
            "spec run started",
            context,
            Map.of(
                "scenarios", ScenarioCollector.scenarios(root).size(),
                "nodes", ScenarioCollector.preOrder(root).size()
            )
        );

        NodeExecutor executor = new NodeExecutor(nanoTicker);
        ExecutionOutcome outcome = mode.strategy().execute(root, executor, new LoggingListener(context));
        SpecReport report = renderer.render(root, outcome);

        if (echoReport) {
            reportSink.println(report.text());
            reportSink.flush();
        }
        logger.info(
            "spec run finished",
            context,
            Map.of(
                "passed", report.passed(),
                "scenarios", outcome.scenarioCount(),
                "passes", outcome.passCount(),
                "executions", executor.executionCount()
            )
        );
        return report;
    }

    /**
     * Runs the tree containing {@code node} and raises {@link SpecFailedException} unless every node passed.
     */
    public SpecReport go(SpecNode node, ExecutionMode mode) {
        SpecReport report = run(node, mode);
        if (!report.passed()) {
            throw new SpecFailedException(report);
        }
        return report;
    }

    private final class LoggingListener implements ExecutionListener {
        private final RunContext context;

        private LoggingListener(RunContext context) {
            this.context = context;
        }

        @Override
        public void stopped(int pass, SpecNode node) {
            logger.info(
                "scenario stopped",
                context.withScenario(pass),
                Map.of("node", node.toString(), "state", node.aggregateState().name())
            );
        }

        @Override
        public void replayAborted(int pass, SpecNode node) {
            logger.error(
                "replay aborted",
                context.withScenario(pass),
                Map.of("node", node.toString(), "state", node.aggregateState().name())
            );
        }
    }
}
