package io.github.reugn.bind4j.expander;

import javax.tools.Diagnostic;
import java.io.PrintStream;
import java.util.Locale;

/**
 * Interface for reporting non-fatal expansion diagnostics.
 */
@FunctionalInterface
public interface DiagnosticReporter {
    /**
     * Reports a diagnostic.
     *
     * @param kind    the severity, {@link Diagnostic.Kind#WARNING} or {@link Diagnostic.Kind#NOTE}
     * @param message the message
     */
    void report(Diagnostic.Kind kind, String message);

    /**
     * Returns a reporter printing {@code warning: message} style lines to the stream.
     */
    static DiagnosticReporter printingTo(PrintStream out) {
        return (kind, message) -> out.println(kind.name().toLowerCase(Locale.ROOT).replace('_', ' ') + ": " + message);
    }

    /**
     * Returns the default reporter, printing to standard error.
     */
    static DiagnosticReporter standardError() {
        return printingTo(System.err);
    }
}
