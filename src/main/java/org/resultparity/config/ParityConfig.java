package org.resultparity.config;

import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Tunables shared by the extractors, the comparator and the tools.
 *
 * @param placeholderSegment path segment synthesized for skipped ancestor depths
 * @param annotationPrefix attribute prefix of the embedded annotation contract
 * @param duplicateKeyPolicy comparator behaviour for repeated canonical keys
 * @param timestampPattern {@link DateTimeFormatter} pattern for normalized timestamps
 */
public record ParityConfig(
        String placeholderSegment,
        String annotationPrefix,
        DuplicateKeyPolicy duplicateKeyPolicy,
        String timestampPattern) {
    public static final String DEFAULT_PLACEHOLDER_SEGMENT = "Unknown";
    public static final String DEFAULT_ANNOTATION_PREFIX = "data-parity-";
    public static final String DEFAULT_TIMESTAMP_PATTERN = "HH:mm:ss - ddMMMyyyy";

    private static final Set<String> KNOWN_KEYS = Set.of(
            "placeholderSegment", "annotationPrefix", "duplicateKeyPolicy", "timestampPattern");
    private static final Pattern ANNOTATION_PREFIX_PATTERN = Pattern.compile("^[a-z][a-z0-9-]*$");

    public ParityConfig {
        Objects.requireNonNull(placeholderSegment, "placeholderSegment");
        Objects.requireNonNull(annotationPrefix, "annotationPrefix");
        Objects.requireNonNull(duplicateKeyPolicy, "duplicateKeyPolicy");
        Objects.requireNonNull(timestampPattern, "timestampPattern");
    }

    public static ParityConfig defaults() {
        return new ParityConfig(
                DEFAULT_PLACEHOLDER_SEGMENT,
                DEFAULT_ANNOTATION_PREFIX,
                DuplicateKeyPolicy.REJECT,
                DEFAULT_TIMESTAMP_PATTERN);
    }

    /**
     * Overlays the given map on {@link #defaults()} and validates the result.
     */
    public static ParityConfig fromMap(final Map<String, Object> root) {
        Objects.requireNonNull(root, "root");
        final List<String> errors = new ArrayList<>();
        for (final String key : root.keySet()) {
            if (!KNOWN_KEYS.contains(key)) {
                errors.add("unknown config key: " + key);
            }
        }

        final ParityConfig defaults = defaults();
        final String placeholder = textOrDefault(root, "placeholderSegment", defaults.placeholderSegment(), errors);
        final String prefix = textOrDefault(root, "annotationPrefix", defaults.annotationPrefix(), errors);
        final String pattern = textOrDefault(root, "timestampPattern", defaults.timestampPattern(), errors);
        DuplicateKeyPolicy policy = defaults.duplicateKeyPolicy();
        final String rawPolicy = textOrDefault(root, "duplicateKeyPolicy", policy.value(), errors);
        try {
            policy = DuplicateKeyPolicy.fromText(rawPolicy);
        } catch (final IllegalArgumentException e) {
            errors.add(e.getMessage());
        }

        if (placeholder.contains("/") || placeholder.contains("|")) {
            errors.add("placeholderSegment must not contain '/' or '|'");
        }
        if (!ANNOTATION_PREFIX_PATTERN.matcher(prefix).matches()) {
            errors.add("annotationPrefix may contain only lowercase letters, digits and hyphens");
        }
        try {
            DateTimeFormatter.ofPattern(pattern);
        } catch (final IllegalArgumentException e) {
            errors.add("timestampPattern is invalid: " + e.getMessage());
        }

        if (!errors.isEmpty()) {
            throw new ParityConfigValidationException(errors);
        }
        return new ParityConfig(placeholder, prefix, policy, pattern);
    }

    public Map<String, Object> toMap() {
        final Map<String, Object> root = new LinkedHashMap<>();
        root.put("placeholderSegment", placeholderSegment);
        root.put("annotationPrefix", annotationPrefix);
        root.put("duplicateKeyPolicy", duplicateKeyPolicy.value());
        root.put("timestampPattern", timestampPattern);
        return root;
    }

    private static String textOrDefault(
            final Map<String, Object> root,
            final String key,
            final String fallback,
            final List<String> errors) {
        if (!root.containsKey(key)) {
            return fallback;
        }
        final Object raw = root.get(key);
        if (!(raw instanceof String text) || text.isBlank()) {
            errors.add(key + " must be a non-blank string");
            return fallback;
        }
        return text.trim();
    }
}
