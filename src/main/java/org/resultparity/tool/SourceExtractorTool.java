package org.resultparity.tool;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import org.resultparity.canonical.CanonicalArrayCodec;
import org.resultparity.canonical.CanonicalRecord;
import org.resultparity.config.ParityConfig;
import org.resultparity.config.ParityConfigLoader;
import org.resultparity.extract.ExtractionException;
import org.resultparity.extract.SourceCanonicalExtractor;
import org.resultparity.obs.JsonLinesLogger;
import org.resultparity.obs.RunContext;

/**
 * CLI utility that writes the reference canonical array of a test-results document.
 *
 * <p>Exit codes: 0 success, 1 validation failure (usage, missing, empty or malformed input),
 * 2 structural failure (no records).
 */
public final class SourceExtractorTool {
    private SourceExtractorTool() {}

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
            return 1;
        }

        if (config.help()) {
            printUsage(out);
            return 0;
        }

        final RunContext runContext = RunContext.newRun("extract-source").withInput(config.sourcePath().toString());
        try (JsonLinesLogger logger = ToolSupport.stderrLogger(err, config.verbose())) {
            final ParityConfig parityConfig = ParityConfigLoader.loadOrDefaults(config.configPath());
            final List<CanonicalRecord> records =
                    new SourceCanonicalExtractor(parityConfig, logger, runContext).extract(config.sourcePath());
            if (config.outputPath() == null) {
                out.print(CanonicalArrayCodec.toJson(records));
            } else {
                CanonicalArrayCodec.write(records, config.outputPath());
                out.println("Wrote " + records.size() + " canonical records to "
                        + config.outputPath().toAbsolutePath().normalize());
            }
            return 0;
        } catch (final ExtractionException e) {
            err.println("source extraction failed: " + e.getMessage());
            return e.failure().exitCode();
        } catch (final IOException | RuntimeException e) {
            err.println("source extraction failed: " + e.getMessage());
            return 1;
        }
    }

    private static Config parseArgs(final String[] args) {
        Path sourcePath = null;
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
            if (arg.startsWith("--source=")) {
                sourcePath = Path.of(ToolSupport.valueAfterPrefix(arg, "--source="));
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

        if (!help && sourcePath == null) {
            throw new IllegalArgumentException("--source=<path> is required");
        }
        return new Config(sourcePath, outputPath, configPath, verbose, help);
    }

    private static void printUsage(final PrintStream stream) {
        stream.println("Usage: SourceExtractorTool --source=<path> [--output=<path>] [--config=<path>] [--verbose]");
        stream.println("  --source=<path>       Test-results XML document (required)");
        stream.println("  --output=<path>       Canonical array JSON destination (default: stdout)");
        stream.println("  --config=<path>       Parity config JSON/YAML");
        stream.println("  --verbose             Include DEBUG log events on stderr");
        stream.println("  --help                Show usage");
    }

    private record Config(Path sourcePath, Path outputPath, Path configPath, boolean verbose, boolean help) {}
}
