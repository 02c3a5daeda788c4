package org.resultparity.config;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.bson.Document;
import org.yaml.snakeyaml.Yaml;

/**
 * Loads parity config files (JSON or YAML).
 */
public final class ParityConfigLoader {
    private ParityConfigLoader() {}

    public static ParityConfig load(final Path configPath) throws IOException {
        Objects.requireNonNull(configPath, "configPath");
        final Path normalized = configPath.toAbsolutePath().normalize();
        if (!Files.exists(normalized)) {
            throw new IllegalArgumentException("config path does not exist: " + normalized);
        }
        if (!Files.isRegularFile(normalized)) {
            throw new IllegalArgumentException("config path must be a file: " + normalized);
        }

        final String content = Files.readString(normalized, StandardCharsets.UTF_8);
        return parse(content, normalized.getFileName().toString());
    }

    /**
     * Loads the given config, or the defaults when {@code configPath} is {@code null}.
     */
    public static ParityConfig loadOrDefaults(final Path configPath) throws IOException {
        return configPath == null ? ParityConfig.defaults() : load(configPath);
    }

    static ParityConfig parse(final String content, final String sourceName) {
        Objects.requireNonNull(content, "content");
        final String normalizedName = Objects.requireNonNull(sourceName, "sourceName")
                .trim()
                .toLowerCase(Locale.ROOT);
        if (content.isBlank()) {
            return ParityConfig.defaults();
        }
        if (normalizedName.endsWith(".yaml") || normalizedName.endsWith(".yml")) {
            return parseYaml(content);
        }
        return ParityConfig.fromMap(new LinkedHashMap<>(Document.parse(content)));
    }

    private static ParityConfig parseYaml(final String content) {
        final Object root = new Yaml().load(content);
        if (root == null) {
            return ParityConfig.defaults();
        }
        if (!(root instanceof Map<?, ?> rawMap)) {
            throw new IllegalArgumentException("config root must be an object");
        }
        final Map<String, Object> normalized = new LinkedHashMap<>();
        for (final Map.Entry<?, ?> entry : rawMap.entrySet()) {
            normalized.put(String.valueOf(entry.getKey()), entry.getValue());
        }
        return ParityConfig.fromMap(normalized);
    }
}
