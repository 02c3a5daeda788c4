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
import org.resultparity.TestFixtures;
import org.resultparity.canonical.CanonicalArrayCodec;
import org.resultparity.canonical.CanonicalRecord;

class SourceExtractorToolTest {
    @TempDir
    Path tempDir;

    @Test
    void writesCanonicalArrayForFixture() throws Exception {
        final ByteArrayOutputStream outBytes = new ByteArrayOutputStream();
        final ByteArrayOutputStream errBytes = new ByteArrayOutputStream();
        final Path output = tempDir.resolve("reference.json");

        final int exitCode = SourceExtractorTool.run(
                new String[] {
                    "--source=" + TestFixtures.path(TestFixtures.UUT_POWER_TEST),
                    "--output=" + output
                },
                new PrintStream(outBytes),
                new PrintStream(errBytes));

        assertEquals(0, exitCode);
        assertTrue(outBytes.toString().contains("Wrote 10 canonical records to "));
        final List<CanonicalRecord> records = CanonicalArrayCodec.read(output);
        assertEquals("UUT Power Test|1", records.get(0).canonicalKey());
        assertTrue(errBytes.toString().contains("source extraction completed"));
    }

    @Test
    void printsCanonicalArrayToStdoutWithoutOutputPath() {
        final ByteArrayOutputStream outBytes = new ByteArrayOutputStream();

        final int exitCode = SourceExtractorTool.run(
                new String[] {"--source=" + TestFixtures.path(TestFixtures.UUT_POWER_TEST)},
                new PrintStream(outBytes),
                new PrintStream(new ByteArrayOutputStream()));

        assertEquals(0, exitCode);
        assertEquals(10, CanonicalArrayCodec.parse(outBytes.toString()).size());
    }

    @Test
    void mapsExtractionFailuresToExitCodes() throws Exception {
        final ByteArrayOutputStream errBytes = new ByteArrayOutputStream();
        final PrintStream out = new PrintStream(new ByteArrayOutputStream());
        final PrintStream err = new PrintStream(errBytes);

        assertEquals(1, SourceExtractorTool.run(new String[] {"--source=" + tempDir.resolve("absent.xml")}, out, err));
        assertTrue(errBytes.toString().contains("InputNotFound: "));

        final Path malformed = Files.writeString(tempDir.resolve("malformed.xml"), "<TestResults>");
        assertEquals(1, SourceExtractorTool.run(new String[] {"--source=" + malformed}, out, err));

        final Path empty = Files.writeString(tempDir.resolve("empty.xml"), "<TestResults/>");
        assertEquals(2, SourceExtractorTool.run(new String[] {"--source=" + empty}, out, err));
        assertTrue(errBytes.toString().contains("StructuralEmpty: "));
    }

    @Test
    void failsWithUsageWhenSourceArgIsMissing() {
        final ByteArrayOutputStream outBytes = new ByteArrayOutputStream();
        final ByteArrayOutputStream errBytes = new ByteArrayOutputStream();

        final int exitCode = SourceExtractorTool.run(
                new String[] {"--verbose"},
                new PrintStream(outBytes),
                new PrintStream(errBytes));

        assertEquals(1, exitCode);
        final String errorOutput = errBytes.toString();
        assertTrue(errorOutput.contains("--source=<path> is required"));
        assertTrue(errorOutput.contains("Usage: SourceExtractorTool"));
    }
}
