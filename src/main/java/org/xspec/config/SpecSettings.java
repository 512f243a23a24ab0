package org.xspec.config;

import java.util.Locale;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.UnaryOperator;
import org.xspec.engine.ExecutionMode;

/**
 * Run settings resolved from system properties, then environment variables.
 */
public final class SpecSettings {
    static final String MODE_PROPERTY = "xspec.mode";
    static final String MODE_ENV = "XSPEC_MODE";
    static final String ECHO_PROPERTY = "xspec.report.echo";
    static final String ECHO_ENV = "XSPEC_REPORT_ECHO";
    static final String LOG_PROPERTY = "xspec.log";
    static final String LOG_ENV = "XSPEC_LOG";

    private final ExecutionMode defaultMode;
    private final boolean echoReport;
    private final LogTarget logTarget;

    private SpecSettings(Builder builder) {
        this.defaultMode = Objects.requireNonNull(builder.defaultMode, "defaultMode");
        this.echoReport = builder.echoReport;
        this.logTarget = Objects.requireNonNull(builder.logTarget, "logTarget");
    }

    public static SpecSettings defaults() {
        return builder().build();
    }

    public static SpecSettings fromEnvironment() {
        return resolve(System::getProperty, System::getenv);
    }

    static SpecSettings resolve(UnaryOperator<String> properties, UnaryOperator<String> environment) {
        Objects.requireNonNull(properties, "properties");
        Objects.requireNonNull(environment, "environment");
        Builder builder = builder();

        String mode = firstNonBlank(properties.apply(MODE_PROPERTY), environment.apply(MODE_ENV));
        if (mode != null) {
            builder.defaultMode(parseSetting(mode, MODE_PROPERTY, ExecutionMode::parse));
        }
        String echo = firstNonBlank(properties.apply(ECHO_PROPERTY), environment.apply(ECHO_ENV));
        if (echo != null) {
            builder.echoReport(parseBooleanSwitch(echo, true));
        }
        String log = firstNonBlank(properties.apply(LOG_PROPERTY), environment.apply(LOG_ENV));
        if (log != null) {
            builder.logTarget(parseSetting(log, LOG_PROPERTY, LogTarget::parse));
        }
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public ExecutionMode defaultMode() {
        return defaultMode;
    }

    public boolean echoReport() {
        return echoReport;
    }

    public LogTarget logTarget() {
        return logTarget;
    }

    private static <T> T parseSetting(String value, String setting, Function<String, T> parser) {
        try {
            return parser.apply(value);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("invalid value for " + setting + ": " + value, e);
        }
    }

    private static String firstNonBlank(String first, String second) {
        if (first != null && !first.isBlank()) {
            return first.trim();
        }
        if (second != null && !second.isBlank()) {
            return second.trim();
        }
        return null;
    }

    private static boolean parseBooleanSwitch(String value, boolean defaultValue) {
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "true", "1", "yes", "y", "on", "enabled" -> true;
            case "false", "0", "no", "n", "off", "disabled" -> false;
            default -> defaultValue;
        };
    }

    public static final class Builder {
        private ExecutionMode defaultMode = ExecutionMode.QUICK;
        private boolean echoReport = true;
        private LogTarget logTarget = LogTarget.NONE;

        private Builder() {
        }

        public Builder defaultMode(ExecutionMode defaultMode) {
            this.defaultMode = defaultMode;
            return this;
        }

        public Builder echoReport(boolean echoReport) {
            this.echoReport = echoReport;
            return this;
        }

        public Builder logTarget(LogTarget logTarget) {
            this.logTarget = logTarget;
            return this;
        }

        public SpecSettings build() {
            return new SpecSettings(this);
        }
    }
}
