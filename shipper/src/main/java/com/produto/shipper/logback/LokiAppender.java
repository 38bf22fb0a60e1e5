package com.produto.shipper.logback;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.IThrowableProxy;
import ch.qos.logback.classic.spi.ThrowableProxyUtil;
import ch.qos.logback.core.CoreConstants;
import ch.qos.logback.core.UnsynchronizedAppenderBase;
import com.produto.shipper.model.LogRecord;
import com.produto.shipper.service.LokiLogShipper;

import java.util.Map;

/**
 * Logback appender that hands every event to a {@link LokiLogShipper}.
 * Events logged by the shipper itself are skipped so its own warnings never loop back into the queue.
 */
public class LokiAppender extends UnsynchronizedAppenderBase<ILoggingEvent> {

    public static final String NAME = "LOKI";

    static final String SHIPPER_LOGGER_PREFIX = "com.produto.shipper";

    private final LokiLogShipper shipper;
    private final Map<String, String> labels;

    public LokiAppender(LokiLogShipper shipper, Map<String, String> labels) {
        this.shipper = shipper;
        this.labels = Map.copyOf(labels);
        setName(NAME);
    }

    @Override
    protected void append(ILoggingEvent event) {
        String loggerName = event.getLoggerName();
        if (loggerName != null && loggerName.startsWith(SHIPPER_LOGGER_PREFIX)) {
            return;
        }
        try {
            shipper.enqueue(toRecord(event));
        } catch (RuntimeException e) {
            addError("Failed to queue log event for Loki", e);
        }
    }

    LogRecord toRecord(ILoggingEvent event) {
        String message = event.getFormattedMessage();
        IThrowableProxy throwable = event.getThrowableProxy();
        if (throwable != null) {
            message = message + CoreConstants.LINE_SEPARATOR + ThrowableProxyUtil.asString(throwable);
        }
        return new LogRecord(
            event.getLevel().toString(),
            loggerName(event),
            message,
            event.getInstant(),
            labels
        );
    }

    private static String loggerName(ILoggingEvent event) {
        return event.getLoggerName() != null ? event.getLoggerName() : "root";
    }
}
