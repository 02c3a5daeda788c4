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
import org.resultparity.extract.EmbeddedCanonicalExtractor;
import org.resultparity.obs.JsonLinesLogger;
import org.resultparity.obs.RunContext;

/**
 * CLI utility that re-derives a canonical array from the annotations of a rendered artifact.
 *
 * <p>Exit codes match {@link SourceExtractorTool}; an artifact without any usable fragment is a
 * structural failure.
 */
public final class EmbeddedExtractorTool {
    private EmbeddedExtractorTool() {}

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

        final RunContext runContext = RunContext.newRun("extract-embedded").withInput(config.artifactPath().toString());
        try (JsonLinesLogger logger = ToolSupport.stderrLogger(err, config.verbose())) {
            final ParityConfig parityConfig = ParityConfigLoader.loadOrDefaults(config.configPath());
            final EmbeddedCanonicalExtractor.EmbeddedExtraction extraction =
                    new EmbeddedCanonicalExtractor(parityConfig, logger, runContext).extract(config.artifactPath());
            final List<CanonicalRecord> records = extraction.records();
            if (!extraction.skipped().isEmpty()) {
                err.println("skipped " + extraction.skipped().size() + " fragment(s) without usable path/ordinal annotations");
            }
            if (config.outputPath() == null) {
                out.print(CanonicalArrayCodec.toJson(records));
            } else {
                CanonicalArrayCodec.write(records, config.outputPath());
                out.println("Wrote " + records.size() + " canonical records to "
                        + config.outputPath().toAbsolutePath().normalize());
            }
            return 0;
        } catch (final ExtractionException e) {
            err.println("embedded extraction failed: " + e.getMessage());
            return e.failure().exitCode();
        } catch (final IOException | RuntimeException e) {
            err.println("embedded extraction failed: " + e.getMessage());
            return 1;
        }
    }

    private static Config parseArgs(final String[] args) {
        Path artifactPath = null;
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
            if (arg.startsWith("--artifact=")) {
                artifactPath = Path.of(ToolSupport.valueAfterPrefix(arg, "--artifact="));
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

        if (!help && artifactPath == null) {
            throw new IllegalArgumentException("--artifact=<path> is required");
        }
        return new Config(artifactPath, outputPath, configPath, verbose, help);
    }

    private static void printUsage(final PrintStream stream) {
        stream.println("Usage: EmbeddedExtractorTool --artifact=<path> [--output=<path>] [--config=<path>] [--verbose]");
        stream.println("  --artifact=<path>     Rendered HTML artifact (required)");
        stream.println("  --output=<path>       Canonical array JSON destination (default: stdout)");
        stream.println("  --config=<path>       Parity config JSON/YAML");
        stream.println("  --verbose             Include DEBUG log events on stderr");
        stream.println("  --help                Show usage");
    }

    private record Config(Path artifactPath, Path outputPath, Path configPath, boolean verbose, boolean help) {}
}
