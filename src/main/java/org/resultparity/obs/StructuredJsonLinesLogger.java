package org.resultparity.obs;

import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.bson.Document;

/**
 * JSON-lines logger intended for deterministic diagnostics.
 *
 * <p>Events below the configured minimum level are dropped. Levels rank as
 * {@code DEBUG < INFO < WARN < ERROR}; unknown levels rank as {@code INFO}.
 */
public final class StructuredJsonLinesLogger implements JsonLinesLogger {
    private static final List<String> LEVEL_ORDER = List.of("DEBUG", "INFO", "WARN", "ERROR");

    private final Writer writer;
    private final Clock clock;
    private final boolean autoFlush;
    private final boolean closeWriter;
    private final int minimumRank;
    private boolean closed;

    public StructuredJsonLinesLogger(OutputStream outputStream) {
        this(new OutputStreamWriter(outputStream, StandardCharsets.UTF_8), Clock.systemUTC(), true, true, "INFO");
    }

    public StructuredJsonLinesLogger(OutputStream outputStream, Clock clock, boolean autoFlush) {
        this(new OutputStreamWriter(outputStream, StandardCharsets.UTF_8), clock, autoFlush, true, "INFO");
    }

    public StructuredJsonLinesLogger(
        Writer writer,
        Clock clock,
        boolean autoFlush,
        boolean closeWriter,
        String minimumLevel
    ) {
        this.writer = Objects.requireNonNull(writer, "writer");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.autoFlush = autoFlush;
        this.closeWriter = closeWriter;
        this.minimumRank = rank(normalizeLevel(minimumLevel));
        this.closed = false;
    }

    /**
     * Logger over a shared stream such as stderr; {@link #close()} flushes but leaves the stream open.
     */
    public static StructuredJsonLinesLogger shared(OutputStream outputStream, String minimumLevel) {
        return new StructuredJsonLinesLogger(
            new OutputStreamWriter(outputStream, StandardCharsets.UTF_8),
            Clock.systemUTC(),
            true,
            false,
            minimumLevel
        );
    }

    @Override
    public synchronized void log(
        String level,
        String message,
        RunContext runContext,
        Map<String, ?> fields
    ) {
        ensureOpen();
        String safeLevel = normalizeLevel(level);
        if (rank(safeLevel) < minimumRank) {
            return;
        }
        String safeMessage = message == null ? "" : message;
        RunContext safeContext = Objects.requireNonNull(runContext, "runContext");
        Map<String, ?> safeFields = fields == null ? Map.of() : fields;

        Document event = new Document();
        event.put("timestamp", Instant.now(clock).toString());
        event.put("level", safeLevel);
        event.put("message", safeMessage);
        event.putAll(safeContext.asFields());
        for (Map.Entry<String, ?> entry : safeFields.entrySet()) {
            String key = entry.getKey();
            if (key == null || key.isBlank() || event.containsKey(key)) {
                continue;
            }
            event.put(key, toEncodable(entry.getValue()));
        }

        writeLine(event.toJson());
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            writer.flush();
            if (closeWriter) {
                writer.close();
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to close logger writer", e);
        }
    }

    private void writeLine(String encoded) {
        try {
            writer.write(encoded);
            writer.write('\n');
            if (autoFlush) {
                writer.flush();
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write log event", e);
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("logger is already closed");
        }
    }

    private static Object toEncodable(Object value) {
        if (value == null
            || value instanceof String
            || value instanceof Boolean
            || value instanceof Integer
            || value instanceof Long
            || value instanceof Double) {
            return value;
        }
        if (value instanceof Map<?, ?> map) {
            Document nested = new Document();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                nested.put(String.valueOf(entry.getKey()), toEncodable(entry.getValue()));
            }
            return nested;
        }
        if (value instanceof Collection<?> collection) {
            List<Object> items = new ArrayList<>(collection.size());
            for (Object item : collection) {
                items.add(toEncodable(item));
            }
            return items;
        }
        return String.valueOf(value);
    }

    private static int rank(String level) {
        int index = LEVEL_ORDER.indexOf(level);
        return index < 0 ? LEVEL_ORDER.indexOf("INFO") : index;
    }

    private static String normalizeLevel(String level) {
        if (level == null || level.isBlank()) {
            return "INFO";
        }
        return level.trim().toUpperCase(Locale.ROOT);
    }
}
