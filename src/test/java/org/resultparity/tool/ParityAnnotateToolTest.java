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
import org.resultparity.canonical.Limits;

class ParityAnnotateToolTest {
    @TempDir
    Path tempDir;

    @Test
    void printsAnnotatedHtmlWithConfiguredPrefix() throws Exception {
        final Path records = tempDir.resolve("records.json");
        CanonicalArrayCodec.write(
                List.of(CanonicalRecord.of("Root", 1, "Group", "Root", "Passed", "", "", Limits.none(), "")),
                records);
        final Path config = Files.writeString(tempDir.resolve("parity.json"), "{\"annotationPrefix\": \"data-rp-\"}");
        final ByteArrayOutputStream outBytes = new ByteArrayOutputStream();

        final int exitCode = ParityAnnotateTool.run(
                new String[] {"--records=" + records, "--title=Board 7", "--config=" + config},
                new PrintStream(outBytes),
                new PrintStream(new ByteArrayOutputStream()));

        assertEquals(0, exitCode);
        final String html = outBytes.toString();
        assertTrue(html.contains("<title>Board 7</title>"));
        assertTrue(html.contains("data-rp-path=\"Root\""));
        assertTrue(html.contains("data-rp-ordinal=\"1\""));
    }

    @Test
    void invalidConfigOrRecordsExitWithTwo() throws Exception {
        final Path records = tempDir.resolve("records.json");
        Files.writeString(records, "[]\n");
        final Path badConfig = Files.writeString(tempDir.resolve("parity.yaml"), "annotationPrefix: UPPER\n");
        final ByteArrayOutputStream errBytes = new ByteArrayOutputStream();
        final PrintStream out = new PrintStream(new ByteArrayOutputStream());
        final PrintStream err = new PrintStream(errBytes);

        assertEquals(2, ParityAnnotateTool.run(new String[] {"--records=" + records, "--config=" + badConfig}, out, err));
        assertTrue(errBytes.toString().contains("parity config validation failed"));
        assertEquals(2, ParityAnnotateTool.run(new String[] {"--records=" + tempDir.resolve("none.json")}, out, err));
        assertEquals(2, ParityAnnotateTool.run(new String[0], out, err));
    }
}
