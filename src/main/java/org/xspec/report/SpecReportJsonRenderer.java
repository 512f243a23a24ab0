package org.xspec.report;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.bson.Document;
import org.bson.json.JsonMode;
import org.bson.json.JsonWriterSettings;

/**
 * Machine-readable form of a {@link SpecReport}.
 */
public final class SpecReportJsonRenderer {
    private final JsonWriterSettings settings;

    public SpecReportJsonRenderer() {
        this(JsonWriterSettings.builder().outputMode(JsonMode.RELAXED).build());
    }

    public SpecReportJsonRenderer(JsonWriterSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    public Document toDocument(SpecReport report) {
        Objects.requireNonNull(report, "report");
        Document document = new Document()
            .append("mode", report.mode().key())
            .append("passed", report.passed());
        report.abortReason().ifPresent(reason -> document.append("abortReason", reason));
        document.append("root", toDocument(report.root()));
        return document;
    }

    public String toJson(SpecReport report) {
        return toDocument(report).toJson(settings);
    }

    private static Document toDocument(NodeReport node) {
        Document document = new Document()
            .append("kind", node.kind().name())
            .append("description", node.description())
            .append("state", node.state().name())
            .append("executions", node.executionCount())
            .append("averageMillis", node.averageMillis())
            .append("multipleMessages", node.multipleMessages());
        node.firstMessage().ifPresent(message -> document.append("message", message));

        List<Document> children = new ArrayList<>(node.children().size());
        for (NodeReport child : node.children()) {
            children.add(toDocument(child));
        }
        document.append("children", children);
        return document;
    }
}
