package org.resultparity.extract;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

final class InputFiles {
    private InputFiles() {
    }

    /**
     * Reads a whole input file, mapping a missing file and blank content to extraction failures.
     */
    static String readRequired(Path input, String description) throws IOException {
        Objects.requireNonNull(input, "input");
        Path normalized = input.toAbsolutePath().normalize();
        if (!Files.isRegularFile(normalized)) {
            throw new ExtractionException(
                ExtractionFailure.INPUT_NOT_FOUND,
                description + " does not exist: " + normalized
            );
        }
        String content = Files.readString(normalized, StandardCharsets.UTF_8);
        requireContent(content, description + " " + normalized);
        return content;
    }

    static void requireContent(String content, String description) {
        if (content == null || content.isBlank()) {
            throw new ExtractionException(ExtractionFailure.EMPTY_INPUT, description + " is empty");
        }
    }
}
