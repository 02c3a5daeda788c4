package org.resultparity.tool;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.resultparity.canonical.CanonicalArrayCodec;
import org.resultparity.canonical.CanonicalRecord;

class EmbeddedExtractorToolTest {
    @TempDir
    Path tempDir;

    @Test
    void extractsAnnotatedFragmentsAndReportsSkippedOnes() throws Exception {
        final Path artifact = Files.writeString(
                tempDir.resolve("report.html"),
                "<html><body>"
                        + "<div data-parity-path=\"Root\" data-parity-ordinal=\"1\" data-parity-kind=\"Group\"></div>"
                        + "<div data-parity-status=\"Passed\"></div>"
                        + "</body></html>");
        final Path output = tempDir.resolve("subject.json");
        final ByteArrayOutputStream outBytes = new ByteArrayOutputStream();
        final ByteArrayOutputStream errBytes = new ByteArrayOutputStream();

        final int exitCode = EmbeddedExtractorTool.run(
                new String[] {"--artifact=" + artifact, "--output=" + output},
                new PrintStream(outBytes),
                new PrintStream(errBytes));

        assertEquals(0, exitCode);
        assertTrue(outBytes.toString().contains("Wrote 1 canonical records to "));
        assertTrue(errBytes.toString().contains("skipped 1 fragment(s)"));
        assertTrue(errBytes.toString().contains("AnnotationMissing: fragment skipped"));
        final List<CanonicalRecord> records = CanonicalArrayCodec.read(output);
        assertEquals("Root|1", records.get(0).canonicalKey());
    }

    @Test
    void artifactWithoutAnnotationsIsAStructuralFailure() throws Exception {
        final Path artifact = Files.writeString(tempDir.resolve("plain.html"), "<p>no annotations</p>");
        final ByteArrayOutputStream errBytes = new ByteArrayOutputStream();

        final int exitCode = EmbeddedExtractorTool.run(
                new String[] {"--artifact=" + artifact},
                new PrintStream(new ByteArrayOutputStream()),
                new PrintStream(errBytes));

        assertEquals(2, exitCode);
        assertTrue(errBytes.toString().contains("StructuralEmpty: "));
    }

    @Test
    void missingOrEmptyArtifactIsAValidationFailure() throws Exception {
        final PrintStream out = new PrintStream(new ByteArrayOutputStream());
        final PrintStream err = new PrintStream(new ByteArrayOutputStream());
        final Path blank = Files.writeString(tempDir.resolve("blank.html"), "\n");

        assertEquals(1, EmbeddedExtractorTool.run(new String[] {"--artifact=" + tempDir.resolve("none.html")}, out, err));
        assertEquals(1, EmbeddedExtractorTool.run(new String[] {"--artifact=" + blank}, out, err));
        assertEquals(1, EmbeddedExtractorTool.run(new String[] {"--bogus"}, out, err));
    }
}
