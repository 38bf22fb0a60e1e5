package com.produto.shipper.logback;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.LoggingEvent;
import com.produto.shipper.config.ShipperSettings;
import com.produto.shipper.service.LokiLogShipper;
import com.produto.shipper.service.RecordingSender;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LokiAppenderTest {

    private LoggerContext context;
    private RecordingSender sender;
    private LokiLogShipper shipper;
    private LokiAppender appender;

    @BeforeEach
    void setUp() {
        context = new LoggerContext();
        sender = new RecordingSender();
        shipper = new LokiLogShipper(
            ShipperSettings.builder().batchSize(100).flushInterval(Duration.ofSeconds(60)).build(),
            sender,
            new SimpleMeterRegistry());

        appender = new LokiAppender(shipper, Map.of("job", "MONITORAMENTO_PRODUTO", "environment", "test"));
        appender.setContext(context);
        appender.start();
        context.getLogger(Logger.ROOT_LOGGER_NAME).addAppender(appender);
    }

    @AfterEach
    void tearDown() {
        appender.stop();
        shipper.shutdown(Duration.ofSeconds(1));
        context.stop();
    }

    @Test
    void queuesApplicationEvents() {
        context.getLogger("com.produto.api.service.ProdutoService").info("Produto {} created", 42);

        assertEquals(1, shipper.getQueueDepth());
        shipper.start();
        assertTrue(shipper.shutdown(Duration.ofSeconds(5)));

        var stream = sender.requests().get(0).getStreams().get(0);
        assertEquals("info", stream.getStream().get("level"));
        assertEquals("com.produto.api.service.ProdutoService", stream.getStream().get("logger"));
        assertEquals("test", stream.getStream().get("environment"));
        assertTrue(stream.getValues().get(0).get(1).endsWith(" - Produto 42 created"));
    }

    @Test
    void keepsNanosecondTimestamp() {
        LoggingEvent event = new LoggingEvent();
        event.setLoggerContext(context);
        event.setLoggerName("com.produto.api.service.ProdutoService");
        event.setLevel(Level.INFO);
        event.setMessage("Produto criado: 1");
        event.setInstant(Instant.parse("2025-12-10T10:30:00.123456789Z"));

        appender.doAppend(event);
        shipper.start();
        assertTrue(shipper.shutdown(Duration.ofSeconds(5)));

        assertEquals("1765362600123456789", sender.requests().get(0).getStreams().get(0).getValues().get(0).get(0));
    }

    @Test
    void includesStackTraceInMessage() {
        context.getLogger("com.produto.api").error("Boom", new IllegalStateException("broken"));

        shipper.start();
        assertTrue(shipper.shutdown(Duration.ofSeconds(5)));

        String line = sender.requests().get(0).getStreams().get(0).getValues().get(0).get(1);
        assertTrue(line.contains("Boom"));
        assertTrue(line.contains("java.lang.IllegalStateException: broken"));
    }

    @Test
    void ignoresShipperOwnEvents() {
        context.getLogger("com.produto.shipper.service.LokiLogShipper").warn("Failed to push");
        context.getLogger("com.produto.shipper.fallback").info("fallback line");

        assertEquals(0, shipper.getQueueDepth());
    }

    @Test
    void eventsAfterShutdownDoNotReachSender() {
        shipper.start();
        shipper.shutdown(Duration.ofSeconds(5));

        assertDoesNotThrow(() -> context.getLogger("com.produto.api").info("late event"));
        assertTrue(sender.requests().isEmpty());
    }
}
