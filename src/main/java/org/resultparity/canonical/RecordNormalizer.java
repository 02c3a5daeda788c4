package org.resultparity.canonical;

import java.time.DateTimeException;
import java.time.LocalDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAccessor;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.resultparity.config.ParityConfig;
import org.resultparity.obs.JsonLinesLogger;
import org.resultparity.obs.RunContext;

/**
 * Converts raw per-node fields into their canonical string forms.
 *
 * <p>None of the operations throw on bad input: unparseable timestamps and unknown comparator
 * tokens are passed through unchanged and reported at {@code DEBUG}.
 */
public final class RecordNormalizer {
    private static final List<DateTimeFormatter> FALLBACK_PARSERS = List.of(
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss[.SSS]", Locale.ROOT),
        DateTimeFormatter.ofPattern("yyyy/MM/dd HH:mm:ss", Locale.ROOT)
    );

    private final DateTimeFormatter timestampFormatter;
    private final JsonLinesLogger logger;
    private final RunContext runContext;

    public RecordNormalizer() {
        this(ParityConfig.DEFAULT_TIMESTAMP_PATTERN, JsonLinesLogger.noop(), RunContext.of("local", "normalize"));
    }

    public RecordNormalizer(String timestampPattern, JsonLinesLogger logger, RunContext runContext) {
        this.timestampFormatter = DateTimeFormatter.ofPattern(
            Objects.requireNonNull(timestampPattern, "timestampPattern"),
            Locale.ENGLISH
        );
        this.logger = Objects.requireNonNull(logger, "logger");
        this.runContext = Objects.requireNonNull(runContext, "runContext");
    }

    /**
     * Verbatim pass-through with {@code null} mapped to the empty string.
     */
    public String text(String raw) {
        return raw == null ? "" : raw;
    }

    public String timestamp(String raw) {
        if (raw == null || raw.isBlank()) {
            return "";
        }
        Optional<LocalDateTime> parsed = parseDateTime(raw.trim());
        if (parsed.isEmpty()) {
            logger.debug("TimestampParseFallback: timestamp left unnormalized", runContext, Map.of("raw", raw));
            return raw;
        }
        return timestampFormatter.format(parsed.get()).toUpperCase(Locale.ROOT);
    }

    public String comparator(String raw) {
        if (raw == null || raw.isBlank()) {
            return ComparisonOperator.NONE.name();
        }
        Optional<ComparisonOperator> operator = ComparisonOperator.parse(raw);
        if (operator.isEmpty()) {
            logger.debug("UnknownComparatorToken: comparator passed through", runContext, Map.of("raw", raw));
            return raw;
        }
        return operator.get().name();
    }

    /**
     * Picks either a limit pair or an expected value. The low bound is the first candidate in the
     * greater family, the high bound the first candidate in the lesser family.
     */
    public Limits limits(RawLimits raw) {
        if (raw == null || raw.isAbsent()) {
            return Limits.none();
        }
        if (!raw.candidates().isEmpty()) {
            LimitEntry low = null;
            LimitEntry high = null;
            for (LimitEntry candidate : raw.candidates()) {
                Optional<ComparisonOperator> operator = ComparisonOperator.parse(candidate.comparator());
                if (operator.isEmpty()) {
                    continue;
                }
                if (low == null && operator.get().isGreaterFamily()) {
                    low = candidate;
                } else if (high == null && operator.get().isLesserFamily()) {
                    high = candidate;
                }
            }
            if (low != null || high != null) {
                return Limits.pair(
                    low == null ? null : low.value(),
                    low == null ? ComparisonOperator.NONE.name() : comparator(low.comparator()),
                    high == null ? null : high.value(),
                    high == null ? ComparisonOperator.NONE.name() : comparator(high.comparator())
                );
            }
        }
        if (raw.expected() != null) {
            return Limits.expectedValue(raw.expected().value(), comparator(raw.expected().comparator()));
        }
        return Limits.none();
    }

    private static Optional<LocalDateTime> parseDateTime(String raw) {
        Optional<LocalDateTime> iso = tryParse(raw, DateTimeFormatter.ISO_DATE_TIME);
        if (iso.isPresent()) {
            return iso;
        }
        for (DateTimeFormatter parser : FALLBACK_PARSERS) {
            Optional<LocalDateTime> parsed = tryParse(raw, parser);
            if (parsed.isPresent()) {
                return parsed;
            }
        }
        return Optional.empty();
    }

    private static Optional<LocalDateTime> tryParse(String raw, DateTimeFormatter parser) {
        try {
            TemporalAccessor parsed = parser.parseBest(raw, ZonedDateTime::from, LocalDateTime::from);
            if (parsed instanceof ZonedDateTime zoned) {
                return Optional.of(zoned.toLocalDateTime());
            }
            return Optional.of((LocalDateTime) parsed);
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }
}
