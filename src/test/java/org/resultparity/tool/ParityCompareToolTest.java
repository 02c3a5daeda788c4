package org.resultparity.tool;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.resultparity.canonical.CanonicalArrayCodec;
import org.resultparity.canonical.CanonicalRecord;
import org.resultparity.canonical.Limits;

class ParityCompareToolTest {
    @TempDir
    Path tempDir;

    @Test
    void droppedRecordFailsWithExitCodeOne() throws Exception {
        final Path reference = tempDir.resolve("reference.json");
        final Path subject = tempDir.resolve("subject.json");
        CanonicalArrayCodec.write(
                List.of(CanonicalRecord.of("X", 1, "Step", "X", "Passed", "", "", Limits.none(), "")),
                reference);
        Files.writeString(subject, "[]\n");
        final Path report = tempDir.resolve("reports/parity.md");
        final ByteArrayOutputStream outBytes = new ByteArrayOutputStream();

        final int exitCode = ParityCompareTool.run(
                new String[] {"--reference=" + reference, "--subject=" + subject, "--output=" + report},
                new PrintStream(outBytes),
                new PrintStream(new ByteArrayOutputStream()));

        assertEquals(1, exitCode);
        final String output = outBytes.toString();
        assertTrue(output.contains("Parity FAILED"));
        assertTrue(output.contains("- dropped: 1"));
        assertTrue(output.contains("- hallucinated: 0"));
        assertTrue(output.contains("- report: "));
        assertTrue(Files.readString(report, StandardCharsets.UTF_8).contains("## Dropped\n- `X|1` Step (Passed)"));
    }

    @Test
    void equalArraysPassWithNumericAndCaseTolerance() throws Exception {
        final Path reference = Files.writeString(
                tempDir.resolve("reference.json"),
                "[{\"CanonicalKey\": \"R/V|1\", \"ExecutionOrdinal\": 1, \"Path\": \"R/V\", \"Kind\": \"Measurement\","
                        + " \"Status\": \"Passed\", \"Value\": \"1\"}]");
        final Path subject = Files.writeString(
                tempDir.resolve("subject.json"),
                "[{\"CanonicalKey\": \"R/V|1\", \"ExecutionOrdinal\": 1, \"Path\": \"R/V\", \"Kind\": \"measurement\","
                        + " \"Status\": \"passed\", \"Value\": \"1.00\"}]");
        final ByteArrayOutputStream outBytes = new ByteArrayOutputStream();

        final int exitCode = ParityCompareTool.run(
                new String[] {"--reference=" + reference, "--subject=" + subject},
                new PrintStream(outBytes),
                new PrintStream(new ByteArrayOutputStream()));

        assertEquals(0, exitCode);
        assertTrue(outBytes.toString().contains("Parity PASSED"));
        assertTrue(outBytes.toString().contains("- matched: 1"));
    }

    @Test
    void duplicateKeysFailUnlessConfiguredLastWins() throws Exception {
        final CanonicalRecord record = CanonicalRecord.of("A", 1, "Step", "A", "Passed", "", "", Limits.none(), "");
        final Path reference = tempDir.resolve("reference.json");
        final Path subject = tempDir.resolve("subject.json");
        CanonicalArrayCodec.write(List.of(record, record), reference);
        CanonicalArrayCodec.write(List.of(record), subject);
        final Path lastWins = Files.writeString(tempDir.resolve("parity.yaml"), "duplicateKeyPolicy: last-wins\n");
        final PrintStream err = new PrintStream(new ByteArrayOutputStream());
        final ByteArrayOutputStream outBytes = new ByteArrayOutputStream();

        assertEquals(1, ParityCompareTool.run(
                new String[] {"--reference=" + reference, "--subject=" + subject},
                new PrintStream(outBytes),
                err));
        assertTrue(outBytes.toString().contains("- duplicate keys: reference=1 subject=0"));

        assertEquals(0, ParityCompareTool.run(
                new String[] {"--reference=" + reference, "--subject=" + subject, "--config=" + lastWins},
                new PrintStream(new ByteArrayOutputStream()),
                err));
    }

    @Test
    void usageAndUnreadableInputsExitWithTwo() throws Exception {
        final ByteArrayOutputStream errBytes = new ByteArrayOutputStream();
        final PrintStream out = new PrintStream(new ByteArrayOutputStream());
        final PrintStream err = new PrintStream(errBytes);

        assertEquals(2, ParityCompareTool.run(new String[] {"--reference=a.json"}, out, err));
        assertTrue(errBytes.toString().contains("--subject=<path> is required"));
        assertTrue(errBytes.toString().contains("Usage: ParityCompareTool"));

        final Path notArray = Files.writeString(tempDir.resolve("object.json"), "{\"Path\": \"x\"}");
        assertEquals(2, ParityCompareTool.run(
                new String[] {"--reference=" + notArray, "--subject=" + notArray},
                out,
                err));
        assertEquals(2, ParityCompareTool.run(
                new String[] {"--reference=" + tempDir.resolve("missing.json"), "--subject=" + notArray},
                out,
                err));
    }
}
