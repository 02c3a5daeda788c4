package org.resultparity.tool;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import org.resultparity.canonical.CanonicalArrayCodec;
import org.resultparity.canonical.CanonicalRecord;
import org.resultparity.config.ParityConfig;
import org.resultparity.config.ParityConfigLoader;
import org.resultparity.extract.ParityAnnotationWriter;

/**
 * CLI utility that renders a canonical array as an annotated HTML artifact.
 *
 * <p>Exit codes: 0 success, 2 usage or I/O error.
 */
public final class ParityAnnotateTool {
    private ParityAnnotateTool() {}

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

        try {
            final ParityConfig parityConfig = ParityConfigLoader.loadOrDefaults(config.configPath());
            final List<CanonicalRecord> records = CanonicalArrayCodec.read(config.recordsPath());
            final String html = new ParityAnnotationWriter(parityConfig).render(records, config.title());
            if (config.outputPath() == null) {
                out.println(html);
                return 0;
            }
            final Path parent = config.outputPath().toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(config.outputPath(), html, StandardCharsets.UTF_8);
            out.println("Wrote " + records.size() + " annotated rows to "
                    + config.outputPath().toAbsolutePath().normalize());
            return 0;
        } catch (final IOException | RuntimeException e) {
            err.println("annotation failed: " + e.getMessage());
            return 2;
        }
    }

    private static Config parseArgs(final String[] args) {
        Path recordsPath = null;
        Path outputPath = null;
        Path configPath = null;
        String title = null;
        boolean help = false;

        for (final String arg : args) {
            if ("--help".equals(arg) || "-h".equals(arg)) {
                help = true;
                continue;
            }
            if (arg.startsWith("--records=")) {
                recordsPath = Path.of(ToolSupport.valueAfterPrefix(arg, "--records="));
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
            if (arg.startsWith("--title=")) {
                title = ToolSupport.valueAfterPrefix(arg, "--title=");
                continue;
            }
            throw new IllegalArgumentException("unknown argument: " + arg);
        }

        if (!help && recordsPath == null) {
            throw new IllegalArgumentException("--records=<path> is required");
        }
        return new Config(recordsPath, outputPath, configPath, title, help);
    }

    private static void printUsage(final PrintStream stream) {
        stream.println("Usage: ParityAnnotateTool --records=<path> [--output=<path>] [--title=<text>] [--config=<path>]");
        stream.println("  --records=<path>      Canonical array JSON (required)");
        stream.println("  --output=<path>       HTML destination (default: stdout)");
        stream.println("  --title=<text>        Page title");
        stream.println("  --config=<path>       Parity config JSON/YAML");
        stream.println("  --help                Show usage");
    }

    private record Config(Path recordsPath, Path outputPath, Path configPath, String title, boolean help) {}
}
