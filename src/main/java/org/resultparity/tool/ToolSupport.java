package org.resultparity.tool;

import java.io.PrintStream;
import org.resultparity.compare.ParityReport;
import org.resultparity.obs.JsonLinesLogger;
import org.resultparity.obs.StructuredJsonLinesLogger;

/**
 * Argument and output helpers shared by the command-line tools.
 */
final class ToolSupport {
    private ToolSupport() {}

    static String valueAfterPrefix(final String arg, final String prefix) {
        final String value = arg.substring(prefix.length()).trim();
        if (value.isEmpty()) {
            throw new IllegalArgumentException(prefix + " must have a value");
        }
        return value;
    }

    /**
     * JSON-lines logger on the tool's error stream; DEBUG events only when verbose.
     */
    static JsonLinesLogger stderrLogger(final PrintStream err, final boolean verbose) {
        return StructuredJsonLinesLogger.shared(err, verbose ? "DEBUG" : "INFO");
    }

    static void printSummary(final ParityReport report, final PrintStream out) {
        out.println("Parity " + (report.passed() ? "PASSED" : "FAILED"));
        out.println("- reference: " + report.referenceLabel() + " (" + report.referenceCount() + " records)");
        out.println("- subject: " + report.subjectLabel() + " (" + report.subjectCount() + " records)");
        out.println("- matched: " + report.matchedCount());
        out.println("- dropped: " + report.dropped().size());
        out.println("- hallucinated: " + report.hallucinated().size());
        out.println("- corrupted: " + report.corrupted().size());
        if (report.hasDuplicateKeys()) {
            out.println("- duplicate keys: reference=" + report.referenceDuplicateKeys().size()
                    + " subject=" + report.subjectDuplicateKeys().size());
        }
    }
}
