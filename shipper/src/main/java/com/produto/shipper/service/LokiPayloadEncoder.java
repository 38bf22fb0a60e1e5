package com.produto.shipper.service;

import com.produto.shipper.model.LogRecord;
import com.produto.shipper.model.LokiPushRequest;
import com.produto.shipper.model.LokiStream;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turns a batch of log records into a Loki push request.
 * Records sharing a label set end up in the same stream; streams keep first-appearance
 * order and values keep batch order. Malformed records are skipped, so the resulting
 * {@link LokiPushRequest#entryCount()} may be lower than the batch size.
 */
@Slf4j
public class LokiPayloadEncoder {

    private static final DateTimeFormatter LINE_TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final long NANOS_PER_SECOND = 1_000_000_000L;

    private final ZoneId zone;

    public LokiPayloadEncoder() {
        this(ZoneId.systemDefault());
    }

    public LokiPayloadEncoder(ZoneId zone) {
        this.zone = zone;
    }

    public LokiPushRequest encode(List<LogRecord> batch) {
        Map<Map<String, String>, LokiStream> streams = new LinkedHashMap<>();

        for (LogRecord record : batch) {
            try {
                Map<String, String> labels = streamLabels(record);
                List<String> value = List.of(epochNanos(record.timestamp()), formatLine(record));
                streams.computeIfAbsent(labels, key -> new LokiStream(key, new ArrayList<>()))
                    .getValues()
                    .add(value);
            } catch (RuntimeException e) {
                log.error("Dropping malformed log record from logger {}: {}", record.logger(), e.getMessage());
            }
        }

        return new LokiPushRequest(new ArrayList<>(streams.values()));
    }

    private Map<String, String> streamLabels(LogRecord record) {
        requireField(record.level(), "level");
        requireField(record.logger(), "logger");

        Map<String, String> labels = new LinkedHashMap<>();
        record.labels().forEach((key, value) -> {
            if (key != null && value != null) {
                labels.put(key, value);
            }
        });
        labels.put("level", record.level().toLowerCase(Locale.ROOT));
        labels.put("logger", record.logger());
        return labels;
    }

    private String formatLine(LogRecord record) {
        requireField(record.message(), "message");
        return LINE_TIME_FORMAT.format(record.timestamp().atZone(zone))
            + " - " + record.logger()
            + " - " + record.level().toUpperCase(Locale.ROOT)
            + " - " + record.message();
    }

    private static String epochNanos(Instant timestamp) {
        requireField(timestamp, "timestamp");
        return Long.toString(Math.addExact(Math.multiplyExact(timestamp.getEpochSecond(), NANOS_PER_SECOND), timestamp.getNano()));
    }

    private static void requireField(Object value, String field) {
        if (value == null) {
            throw new IllegalArgumentException("missing " + field);
        }
    }
}
