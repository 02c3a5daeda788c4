package org.resultparity;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

public final class TestFixtures {
    public static final String UUT_POWER_TEST = "uut-power-test.xml";

    private TestFixtures() {
    }

    public static Path path(String name) {
        URL resource = TestFixtures.class.getResource("/fixtures/" + name);
        if (resource == null) {
            throw new IllegalArgumentException("missing test fixture: " + name);
        }
        try {
            return Path.of(resource.toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }

    public static String read(String name) {
        try {
            return Files.readString(path(name), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Minimal test-results document: a result set wrapping the given inner XML.
     */
    public static String resultSet(String name, String innerXml) {
        return "<TestResults xmlns:xsi=\"http://www.w3.org/2001/XMLSchema-instance\">"
            + "<ResultSet name=\"" + name + "\">" + innerXml + "</ResultSet>"
            + "</TestResults>";
    }
}
