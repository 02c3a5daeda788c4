package org.resultparity.obs;

import java.util.Collections;
import java.util.Map;

/**
 * Minimal structured logger that writes one JSON object per line.
 */
public interface JsonLinesLogger extends AutoCloseable {
    void log(String level, String message, RunContext runContext, Map<String, ?> fields);

    default void log(String level, String message, RunContext runContext) {
        log(level, message, runContext, Collections.emptyMap());
    }

    default void debug(String message, RunContext runContext, Map<String, ?> fields) {
        log("DEBUG", message, runContext, fields);
    }

    default void info(String message, RunContext runContext, Map<String, ?> fields) {
        log("INFO", message, runContext, fields);
    }

    default void info(String message, RunContext runContext) {
        info(message, runContext, Collections.emptyMap());
    }

    default void warn(String message, RunContext runContext, Map<String, ?> fields) {
        log("WARN", message, runContext, fields);
    }

    default void error(String message, RunContext runContext, Map<String, ?> fields) {
        log("ERROR", message, runContext, fields);
    }

    default void error(String message, RunContext runContext) {
        error(message, runContext, Collections.emptyMap());
    }

    @Override
    void close();

    /**
     * Logger that drops every event.
     */
    static JsonLinesLogger noop() {
        return NoopLogger.INSTANCE;
    }

    final class NoopLogger implements JsonLinesLogger {
        private static final NoopLogger INSTANCE = new NoopLogger();

        private NoopLogger() {
        }

        @Override
        public void log(String level, String message, RunContext runContext, Map<String, ?> fields) {
        }

        @Override
        public void close() {
        }
    }
}
