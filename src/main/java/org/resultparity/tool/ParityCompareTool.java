package org.resultparity.tool;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.resultparity.canonical.CanonicalArrayCodec;
import org.resultparity.canonical.CanonicalRecord;
import org.resultparity.compare.ParityComparator;
import org.resultparity.compare.ParityReport;
import org.resultparity.compare.ParityReportRenderer;
import org.resultparity.config.ParityConfig;
import org.resultparity.config.ParityConfigLoader;
import org.resultparity.obs.JsonLinesLogger;
import org.resultparity.obs.RunContext;

/**
 * CLI utility that compares a reference canonical array against a subject array.
 *
 * <p>Exit codes: 0 parity holds, 1 mismatch detected, 2 usage or I/O error.
 */
public final class ParityCompareTool {
    private ParityCompareTool() {}

    public static void main(final String[] args) {
        final int exitCode = run(args, System.out, System.err);
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    static int run(final String[] args, final PrintStream out, final PrintStream err) {
        Objects.requireNonNull(args, "args");
        Objects.requireNonNull(out, "out");
        Objects.requireNonNull(err, "err");

        final Config config;
        try {
            config = parseArgs(args);
        } catch (final IllegalArgumentException e) {
            err.println(e.getMessage());
            printUsage(err);
            return 2;
        }

        if (config.help()) {
            printUsage(out);
            return 0;
        }

        final RunContext runContext = RunContext.newRun("compare");
        try (JsonLinesLogger logger = ToolSupport.stderrLogger(err, config.verbose())) {
            final ParityConfig parityConfig = ParityConfigLoader.loadOrDefaults(config.configPath());
            final List<CanonicalRecord> reference = CanonicalArrayCodec.read(config.referencePath());
            final List<CanonicalRecord> subject = CanonicalArrayCodec.read(config.subjectPath());

            final ParityReport report = new ParityComparator(parityConfig.duplicateKeyPolicy(), Clock.systemUTC())
                    .compare(
                            config.referencePath().getFileName().toString(),
                            reference,
                            config.subjectPath().getFileName().toString(),
                            subject);
            ToolSupport.printSummary(report, out);
            if (config.outputPath() != null) {
                new ParityReportRenderer().write(report, config.outputPath());
                out.println("- report: " + config.outputPath().toAbsolutePath().normalize());
            }
            logger.info("comparison completed", runContext, Map.of("passed", report.passed()));
            return report.passed() ? 0 : 1;
        } catch (final IOException | RuntimeException e) {
            err.println("parity comparison failed: " + e.getMessage());
            return 2;
        }
    }

    private static Config parseArgs(final String[] args) {
        Path referencePath = null;
        Path subjectPath = null;
        Path outputPath = null;
        Path configPath = null;
        boolean verbose = false;
        boolean help = false;

        for (final String arg : args) {
            if ("--help".equals(arg) || "-h".equals(arg)) {
                help = true;
                continue;
            }
            if ("--verbose".equals(arg)) {
                verbose = true;
                continue;
            }
            if (arg.startsWith("--reference=")) {
                referencePath = Path.of(ToolSupport.valueAfterPrefix(arg, "--reference="));
                continue;
            }
            if (arg.startsWith("--subject=")) {
                subjectPath = Path.of(ToolSupport.valueAfterPrefix(arg, "--subject="));
                continue;
            }
            if (arg.startsWith("--output=")) {
                outputPath = Path.of(ToolSupport.valueAfterPrefix(arg, "--output="));
                continue;
            }
            if (arg.startsWith("--config=")) {
                configPath = Path.of(ToolSupport.valueAfterPrefix(arg, "--config="));
                continue;
            }
            throw new IllegalArgumentException("unknown argument: " + arg);
        }

        if (!help && referencePath == null) {
            throw new IllegalArgumentException("--reference=<path> is required");
        }
        if (!help && subjectPath == null) {
            throw new IllegalArgumentException("--subject=<path> is required");
        }
        return new Config(referencePath, subjectPath, outputPath, configPath, verbose, help);
    }

    private static void printUsage(final PrintStream stream) {
        stream.println("Usage: ParityCompareTool --reference=<path> --subject=<path> [--output=<path>] [--config=<path>]");
        stream.println("  --reference=<path>    Reference canonical array JSON (required)");
        stream.println("  --subject=<path>      Subject canonical array JSON (required)");
        stream.println("  --output=<path>       Diff report destination (.md for markdown, JSON otherwise)");
        stream.println("  --config=<path>       Parity config JSON/YAML");
        stream.println("  --verbose             Include DEBUG log events on stderr");
        stream.println("  --help                Show usage");
    }

    private record Config(
            Path referencePath,
            Path subjectPath,
            Path outputPath,
            Path configPath,
            boolean verbose,
            boolean help) {}
}
