package com.produto.shipper.service;

import com.produto.shipper.config.ShipperSettings;
import com.produto.shipper.model.LogRecord;
import com.produto.shipper.model.ShipperState;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

class LokiLogShipperTest {

    private static final Duration LONG_INTERVAL = Duration.ofSeconds(60);

    private SimpleMeterRegistry registry;
    private RecordingSender sender;
    private LokiLogShipper shipper;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        sender = new RecordingSender();
    }

    @AfterEach
    void tearDown() {
        if (shipper != null) {
            shipper.shutdown(Duration.ofSeconds(1));
        }
    }

    @Test
    void sendsFullBatchesAndRemainderInEnqueueOrder() throws Exception {
        shipper = newShipper(10, Duration.ofMillis(300));
        for (int i = 0; i < 25; i++) {
            shipper.enqueue(record(i));
        }
        shipper.start();

        assertTrue(waitUntil(() -> sender.totalRecords() == 25, Duration.ofSeconds(3)));

        List<List<String>> batches = sender.batches();
        assertEquals(3, batches.size());
        assertEquals(10, batches.get(0).size());
        assertEquals(10, batches.get(1).size());
        assertEquals(5, batches.get(2).size());

        List<String> sent = new ArrayList<>();
        batches.forEach(sent::addAll);
        assertEquals(expectedMessages(0, 25), sent);
    }

    @Test
    void partialBatchWaitsForFlushInterval() throws Exception {
        shipper = newShipper(10, Duration.ofMillis(500));
        shipper.start();
        for (int i = 0; i < 9; i++) {
            shipper.enqueue(record(i));
        }

        Thread.sleep(200);
        assertTrue(sender.requests().isEmpty(), "nothing should be sent before the flush interval");

        assertTrue(waitUntil(() -> sender.requests().size() == 1, Duration.ofSeconds(3)));
        assertEquals(expectedMessages(0, 9), sender.batches().get(0));

        Thread.sleep(100);
        assertEquals(1, sender.requests().size());
    }

    @Test
    void concurrentProducersNeverExceedBatchSize() throws Exception {
        shipper = newShipper(7, Duration.ofMillis(100));
        shipper.start();

        int producers = 4;
        int perProducer = 50;
        ExecutorService executor = Executors.newFixedThreadPool(producers);
        CountDownLatch startGate = new CountDownLatch(1);
        for (int p = 0; p < producers; p++) {
            int offset = p * perProducer;
            executor.submit(() -> {
                startGate.await();
                for (int i = 0; i < perProducer; i++) {
                    shipper.enqueue(record(offset + i));
                }
                return null;
            });
        }
        startGate.countDown();
        executor.shutdown();
        assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));

        assertTrue(waitUntil(() -> sender.totalRecords() == producers * perProducer, Duration.ofSeconds(5)));
        for (List<String> batch : sender.batches()) {
            assertTrue(batch.size() <= 7, "batch of " + batch.size() + " exceeds limit");
        }
        assertEquals(producers * perProducer, counter("loki.logs.sent"));
    }

    @Test
    void failedPushIsCountedAndDoesNotReachCaller() throws Exception {
        sender.failWith(500);
        shipper = newShipper(1, LONG_INTERVAL);
        shipper.start();

        assertDoesNotThrow(() -> shipper.enqueue(record(0)));
        assertTrue(waitUntil(() -> counter("loki.batches.failed") == 1.0, Duration.ofSeconds(3)));
        assertEquals(1.0, counter("loki.logs.failed"));
        assertEquals(0.0, counter("loki.batches.sent"));

        sender.failWith(0);
        assertDoesNotThrow(() -> shipper.enqueue(record(1)));
        assertTrue(waitUntil(() -> counter("loki.batches.sent") == 1.0, Duration.ofSeconds(3)));
        assertEquals(1.0, counter("loki.batches.failed"));
        assertEquals(ShipperState.RUNNING, shipper.getState());
    }

    @Test
    void shutdownSendsQueuedRecordsBeforeReturning() {
        shipper = newShipper(10, LONG_INTERVAL);
        shipper.start();
        for (int i = 0; i < 3; i++) {
            shipper.enqueue(record(i));
        }

        assertTrue(shipper.shutdown(Duration.ofSeconds(10)));

        assertEquals(List.of(expectedMessages(0, 3)), sender.batches());
        assertEquals(ShipperState.STOPPED, shipper.getState());
    }

    @Test
    void shutdownFinalDrainRespectsBatchSize() {
        shipper = newShipper(4, LONG_INTERVAL);
        for (int i = 0; i < 10; i++) {
            shipper.enqueue(record(i));
        }
        shipper.start();

        assertTrue(shipper.shutdown(Duration.ofSeconds(10)));

        assertEquals(10, sender.totalRecords());
        for (List<String> batch : sender.batches()) {
            assertTrue(batch.size() <= 4);
        }
    }

    @Test
    void shutdownReturnsWithinTimeoutWhenBackendHangs() {
        sender.delayBy(Duration.ofSeconds(5));
        shipper = newShipper(10, LONG_INTERVAL);
        shipper.start();
        for (int i = 0; i < 50; i++) {
            shipper.enqueue(record(i));
        }

        long started = System.nanoTime();
        boolean drained = shipper.shutdown(Duration.ofMillis(300));
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

        assertFalse(drained);
        assertTrue(elapsedMs < 2000, "shutdown took " + elapsedMs + "ms");
        assertEquals(ShipperState.STOPPED, shipper.getState());
        assertTrue(dropped("shutdown") > 0);
    }

    @Test
    void enqueueAfterStopFallsBackWithoutSending() throws Exception {
        shipper = newShipper(1, LONG_INTERVAL);
        shipper.start();
        shipper.shutdown(Duration.ofSeconds(1));

        for (int i = 0; i < 5; i++) {
            int n = i;
            assertDoesNotThrow(() -> shipper.enqueue(record(n)));
        }
        Thread.sleep(100);

        assertTrue(sender.requests().isEmpty());
        assertEquals(0, shipper.getQueueDepth());
        assertEquals(5.0, dropped("stopped"));
    }

    @Test
    void malformedRecordIsDroppedAndRestOfBatchIsSent() throws Exception {
        shipper = newShipper(3, LONG_INTERVAL);
        shipper.enqueue(record(0));
        shipper.enqueue(new LogRecord("INFO", "com.produto.api.Test", null, Instant.now(), Map.of()));
        shipper.enqueue(record(2));
        shipper.start();

        assertTrue(waitUntil(() -> sender.requests().size() == 1, Duration.ofSeconds(3)));
        assertEquals(List.of("msg-0", "msg-2"), sender.batches().get(0));
        assertEquals(1.0, dropped("serialization"));
    }

    @Test
    void batchOfOnlyMalformedRecordsIsNotPushed() throws Exception {
        shipper = newShipper(1, LONG_INTERVAL);
        shipper.enqueue(new LogRecord(null, "com.produto.api.Test", "no level", Instant.now(), Map.of()));
        shipper.start();

        assertTrue(waitUntil(() -> dropped("serialization") == 1.0, Duration.ofSeconds(3)));
        assertTrue(sender.requests().isEmpty());
    }

    @Test
    void boundedQueueDropsOldestRecords() {
        ShipperSettings settings = ShipperSettings.builder()
            .batchSize(10)
            .flushInterval(LONG_INTERVAL)
            .queueCapacity(5)
            .build();
        shipper = new LokiLogShipper(settings, sender, registry);
        for (int i = 0; i < 8; i++) {
            shipper.enqueue(record(i));
        }

        assertEquals(5, shipper.getQueueDepth());
        assertEquals(3.0, dropped("overflow"));

        shipper.start();
        assertTrue(shipper.shutdown(Duration.ofSeconds(5)));
        assertEquals(List.of(expectedMessages(3, 8)), sender.batches());
    }

    @Test
    void shutdownWithoutStartDropsQueuedRecords() {
        shipper = newShipper(10, LONG_INTERVAL);
        shipper.enqueue(record(0));
        shipper.enqueue(record(1));

        assertFalse(shipper.shutdown(Duration.ofSeconds(1)));
        assertEquals(ShipperState.STOPPED, shipper.getState());
        assertEquals(2.0, dropped("shutdown"));
        assertTrue(sender.requests().isEmpty());
    }

    @Test
    void repeatedShutdownReturnsPreviousOutcome() {
        shipper = newShipper(10, LONG_INTERVAL);
        shipper.start();

        assertTrue(shipper.shutdown(Duration.ofSeconds(5)));
        assertTrue(shipper.shutdown(Duration.ofSeconds(5)));
    }

    @Test
    void cannotRestartAfterShutdown() {
        shipper = newShipper(10, LONG_INTERVAL);
        shipper.start();
        shipper.start();
        shipper.shutdown(Duration.ofSeconds(5));

        assertThrows(IllegalStateException.class, () -> shipper.start());
    }

    @Test
    void rejectsInvalidSettings() {
        ShipperSettings zeroBatch = ShipperSettings.builder().batchSize(0).build();
        assertThrows(IllegalArgumentException.class, () -> new LokiLogShipper(zeroBatch, sender, registry));

        ShipperSettings noInterval = ShipperSettings.builder().flushInterval(Duration.ZERO).build();
        assertThrows(IllegalArgumentException.class, () -> new LokiLogShipper(noInterval, sender, registry));
    }

    private LokiLogShipper newShipper(int batchSize, Duration flushInterval) {
        ShipperSettings settings = ShipperSettings.builder()
            .batchSize(batchSize)
            .flushInterval(flushInterval)
            .build();
        return new LokiLogShipper(settings, sender, registry);
    }

    private double counter(String name) {
        return registry.get(name).counter().count();
    }

    private double dropped(String reason) {
        return registry.get("loki.logs.dropped").tag("reason", reason).counter().count();
    }

    private static LogRecord record(int i) {
        return LogRecord.of("INFO", "com.produto.api.Test", "msg-" + i, Map.of("job", "test"));
    }

    private static List<String> expectedMessages(int fromInclusive, int toExclusive) {
        List<String> messages = new ArrayList<>();
        for (int i = fromInclusive; i < toExclusive; i++) {
            messages.add("msg-" + i);
        }
        return messages;
    }

    private static boolean waitUntil(BooleanSupplier condition, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (System.nanoTime() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            Thread.sleep(10);
        }
        return condition.getAsBoolean();
    }
}
