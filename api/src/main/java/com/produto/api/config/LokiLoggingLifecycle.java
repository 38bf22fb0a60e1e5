package com.produto.api.config;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import com.produto.shipper.logback.LokiAppender;
import com.produto.shipper.service.LokiLogShipper;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Starts the Loki shipper at boot and routes every Logback event to it through the root logger.
 * On shutdown the appender is detached first, then the shipper flushes what is left.
 */
@Slf4j
public class LokiLoggingLifecycle {

    private final LokiLogShipper shipper;
    private final Duration shutdownTimeout;
    private LokiAppender appender;

    public LokiLoggingLifecycle(LokiLogShipper shipper, Duration shutdownTimeout) {
        this.shipper = shipper;
        this.shutdownTimeout = shutdownTimeout;
    }

    @PostConstruct
    public void start() {
        ILoggerFactory loggerFactory = LoggerFactory.getILoggerFactory();
        if (!(loggerFactory instanceof LoggerContext)) {
            log.warn("Logback is not the active SLF4J backend, Loki appender not attached");
            return;
        }
        LoggerContext context = (LoggerContext) loggerFactory;

        shipper.start();
        appender = new LokiAppender(shipper, shipper.getSettings().recordLabels());
        appender.setContext(context);
        appender.start();
        rootLogger(context).addAppender(appender);

        log.info("Loki log shipping enabled - endpoint: {}, job: {}, batch: {} logs or {}ms",
            shipper.getSettings().pushEndpoint(),
            shipper.getSettings().getJob(),
            shipper.getSettings().getBatchSize(),
            shipper.getSettings().getFlushInterval().toMillis());
    }

    @PreDestroy
    public void stop() {
        if (appender != null) {
            rootLogger((LoggerContext) appender.getContext()).detachAppender(appender);
            appender.stop();
            appender = null;
        }
        boolean drained = shipper.shutdown(shutdownTimeout);
        if (drained) {
            log.info("Loki handler shut down, queued logs flushed");
        } else {
            log.warn("Loki handler shut down before all queued logs were flushed");
        }
    }

    private static Logger rootLogger(LoggerContext context) {
        return context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
    }
}
