package org.resultparity.tool;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.bson.Document;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.resultparity.TestFixtures;
import org.resultparity.canonical.CanonicalArrayCodec;

class ParityCheckToolTest {
    @TempDir
    Path tempDir;

    @Test
    void faithfulArtifactPassesEndToEnd() throws Exception {
        final Path source = TestFixtures.path(TestFixtures.UUT_POWER_TEST);
        final Path artifact = renderArtifact(source);
        final Path snapshots = tempDir.resolve("snapshots");
        final ByteArrayOutputStream outBytes = new ByteArrayOutputStream();

        final int exitCode = ParityCheckTool.run(
                new String[] {"--source=" + source, "--artifact=" + artifact, "--snapshot-dir=" + snapshots},
                new PrintStream(outBytes),
                new PrintStream(new ByteArrayOutputStream()));

        assertEquals(0, exitCode);
        assertTrue(outBytes.toString().contains("Parity PASSED"));
        assertTrue(outBytes.toString().contains("- matched: 10"));
        assertEquals(
                Files.readString(snapshots.resolve("reference.json"), StandardCharsets.UTF_8),
                CanonicalArrayCodec.toJson(CanonicalArrayCodec.read(snapshots.resolve("reference.json"))));
        assertEquals(10, CanonicalArrayCodec.read(snapshots.resolve("subject.json")).size());
    }

    @Test
    void tamperedArtifactReportsCorruptionAndDrop() throws Exception {
        final Path source = TestFixtures.path(TestFixtures.UUT_POWER_TEST);
        final Path artifact = renderArtifact(source);
        final String html = Files.readString(artifact, StandardCharsets.UTF_8)
                .replace("data-parity-value=\"1.75\"", "data-parity-value=\"1.25\"")
                .replace("data-parity-path=\"UUT Power Test/Cleanup\"", "data-parity-gone=\"UUT Power Test/Cleanup\"");
        Files.writeString(artifact, html, StandardCharsets.UTF_8);
        final Path report = tempDir.resolve("parity.json");
        final ByteArrayOutputStream outBytes = new ByteArrayOutputStream();

        final int exitCode = ParityCheckTool.run(
                new String[] {"--source=" + source, "--artifact=" + artifact, "--output=" + report},
                new PrintStream(outBytes),
                new PrintStream(new ByteArrayOutputStream()));

        assertEquals(1, exitCode);
        assertTrue(outBytes.toString().contains("Parity FAILED"));
        final Document parsed = Document.parse(Files.readString(report, StandardCharsets.UTF_8));
        assertFalse(parsed.getBoolean("passed"));
        final Document summary = parsed.get("summary", Document.class);
        assertEquals(1, summary.getInteger("dropped"));
        assertEquals(1, summary.getInteger("corrupted"));
        assertEquals(0, summary.getInteger("hallucinated"));
    }

    @Test
    void extractionFailuresAndUsageErrorsExitWithTwo() throws Exception {
        final Path source = TestFixtures.path(TestFixtures.UUT_POWER_TEST);
        final Path plain = Files.writeString(tempDir.resolve("plain.html"), "<p>nothing annotated</p>");
        final ByteArrayOutputStream errBytes = new ByteArrayOutputStream();
        final PrintStream out = new PrintStream(new ByteArrayOutputStream());
        final PrintStream err = new PrintStream(errBytes);

        assertEquals(2, ParityCheckTool.run(new String[] {"--source=" + source, "--artifact=" + plain}, out, err));
        assertTrue(errBytes.toString().contains("parity check failed: StructuralEmpty: "));
        assertEquals(2, ParityCheckTool.run(new String[] {"--source=" + source}, out, err));
        assertTrue(errBytes.toString().contains("--artifact=<path> is required"));
    }

    private Path renderArtifact(final Path source) {
        final Path records = tempDir.resolve("records.json");
        final Path artifact = tempDir.resolve("report.html");
        final PrintStream sink = new PrintStream(new ByteArrayOutputStream());
        assertEquals(0, SourceExtractorTool.run(
                new String[] {"--source=" + source, "--output=" + records}, sink, sink));
        assertEquals(0, ParityAnnotateTool.run(
                new String[] {"--records=" + records, "--output=" + artifact}, sink, sink));
        return artifact;
    }
}
