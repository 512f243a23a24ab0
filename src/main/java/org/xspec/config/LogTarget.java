package org.xspec.config;

import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Locale;
import org.xspec.obs.JsonLinesLogger;
import org.xspec.obs.StructuredJsonLinesLogger;

/**
 * Destination of structured run logs.
 */
public enum LogTarget {
    NONE,
    STDOUT,
    STDERR;

    public JsonLinesLogger open(Clock clock) {
        return switch (this) {
            case NONE -> JsonLinesLogger.noop();
            case STDOUT -> shared(System.out, clock);
            case STDERR -> shared(System.err, clock);
        };
    }

    public static LogTarget parse(String value) {
        String normalized = value == null ? "" : value.trim().toUpperCase(Locale.ROOT);
        for (LogTarget target : values()) {
            if (target.name().equals(normalized)) {
                return target;
            }
        }
        throw new IllegalArgumentException("unsupported log target: " + value);
    }

    private static JsonLinesLogger shared(PrintStream stream, Clock clock) {
        return new StructuredJsonLinesLogger(new OutputStreamWriter(stream, StandardCharsets.UTF_8), clock, true, false);
    }
}
