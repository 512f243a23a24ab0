package org.xspec;

import java.util.Objects;
import org.opentest4j.AssertionFailedError;
import org.xspec.report.SpecReport;

/**
 * Raised when a spec run does not pass; the message carries the full rendered report.
 */
public final class SpecFailedException extends AssertionFailedError {
    private static final long serialVersionUID = 1L;

    private final transient SpecReport report;

    public SpecFailedException(SpecReport report) {
        super(System.lineSeparator() + Objects.requireNonNull(report, "report").text());
        this.report = report;
    }

    public SpecReport report() {
        return report;
    }
}
