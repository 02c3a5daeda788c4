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
import org.resultparity.extract.EmbeddedCanonicalExtractor;
import org.resultparity.extract.SourceCanonicalExtractor;
import org.resultparity.obs.JsonLinesLogger;
import org.resultparity.obs.RunContext;

/**
 * CLI utility that runs both extractions and the comparison in one process: the source
 * document gives the reference array, the rendered artifact the subject array.
 *
 * <p>Exit codes: 0 parity holds, 1 mismatch detected, 2 usage, I/O or extraction error.
 */
public final class ParityCheckTool {
    private ParityCheckTool() {}

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

        final RunContext runContext = RunContext.newRun("check");
        try (JsonLinesLogger logger = ToolSupport.stderrLogger(err, config.verbose())) {
            final ParityConfig parityConfig = ParityConfigLoader.loadOrDefaults(config.configPath());
            final List<CanonicalRecord> reference = new SourceCanonicalExtractor(
                    parityConfig,
                    logger,
                    runContext.withStage("extract-source").withInput(config.sourcePath().toString()))
                    .extract(config.sourcePath());
            final List<CanonicalRecord> subject = new EmbeddedCanonicalExtractor(
                    parityConfig,
                    logger,
                    runContext.withStage("extract-embedded").withInput(config.artifactPath().toString()))
                    .extract(config.artifactPath())
                    .records();

            if (config.snapshotDir() != null) {
                CanonicalArrayCodec.write(reference, config.snapshotDir().resolve("reference.json"));
                CanonicalArrayCodec.write(subject, config.snapshotDir().resolve("subject.json"));
            }

            final ParityReport report = new ParityComparator(parityConfig.duplicateKeyPolicy(), Clock.systemUTC())
                    .compare(
                            config.sourcePath().getFileName().toString(),
                            reference,
                            config.artifactPath().getFileName().toString(),
                            subject);
            ToolSupport.printSummary(report, out);
            if (config.outputPath() != null) {
                new ParityReportRenderer().write(report, config.outputPath());
                out.println("- report: " + config.outputPath().toAbsolutePath().normalize());
            }
            logger.info("parity check completed", runContext, Map.of("passed", report.passed()));
            return report.passed() ? 0 : 1;
        } catch (final IOException | RuntimeException e) {
            err.println("parity check failed: " + e.getMessage());
            return 2;
        }
    }

    private static Config parseArgs(final String[] args) {
        Path sourcePath = null;
        Path artifactPath = null;
        Path outputPath = null;
        Path snapshotDir = null;
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
            if (arg.startsWith("--source=")) {
                sourcePath = Path.of(ToolSupport.valueAfterPrefix(arg, "--source="));
                continue;
            }
            if (arg.startsWith("--artifact=")) {
                artifactPath = Path.of(ToolSupport.valueAfterPrefix(arg, "--artifact="));
                continue;
            }
            if (arg.startsWith("--output=")) {
                outputPath = Path.of(ToolSupport.valueAfterPrefix(arg, "--output="));
                continue;
            }
            if (arg.startsWith("--snapshot-dir=")) {
                snapshotDir = Path.of(ToolSupport.valueAfterPrefix(arg, "--snapshot-dir="));
                continue;
            }
            if (arg.startsWith("--config=")) {
                configPath = Path.of(ToolSupport.valueAfterPrefix(arg, "--config="));
                continue;
            }
            throw new IllegalArgumentException("unknown argument: " + arg);
        }

        if (!help && sourcePath == null) {
            throw new IllegalArgumentException("--source=<path> is required");
        }
        if (!help && artifactPath == null) {
            throw new IllegalArgumentException("--artifact=<path> is required");
        }
        return new Config(sourcePath, artifactPath, outputPath, snapshotDir, configPath, verbose, help);
    }

    private static void printUsage(final PrintStream stream) {
        stream.println("Usage: ParityCheckTool --source=<path> --artifact=<path> [--output=<path>] [--snapshot-dir=<dir>] [--config=<path>]");
        stream.println("  --source=<path>       Test-results XML document (required)");
        stream.println("  --artifact=<path>     Rendered HTML artifact (required)");
        stream.println("  --output=<path>       Diff report destination (.md for markdown, JSON otherwise)");
        stream.println("  --snapshot-dir=<dir>  Also write reference.json and subject.json");
        stream.println("  --config=<path>       Parity config JSON/YAML");
        stream.println("  --verbose             Include DEBUG log events on stderr");
        stream.println("  --help                Show usage");
    }

    private record Config(
            Path sourcePath,
            Path artifactPath,
            Path outputPath,
            Path snapshotDir,
            Path configPath,
            boolean verbose,
            boolean help) {}
}
