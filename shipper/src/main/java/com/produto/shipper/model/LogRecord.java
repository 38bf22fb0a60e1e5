package com.produto.shipper.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable snapshot of one log event waiting to be shipped to Loki.
 * Labels are copied on construction, so later changes to the caller's map are not visible.
 */
public record LogRecord(String level,
                        String logger,
                        String message,
                        Instant timestamp,
                        Map<String, String> labels) {

    public LogRecord {
        labels = labels == null || labels.isEmpty()
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(labels));
    }

    public static LogRecord of(String level, String logger, String message, Map<String, String> labels) {
        return new LogRecord(level, logger, message, Instant.now(), labels);
    }
}
