package com.produto.shipper.service;

import com.produto.shipper.config.ShipperSettings;
import com.produto.shipper.model.LogRecord;
import com.produto.shipper.model.LokiPushRequest;
import com.produto.shipper.model.ShipperState;
import com.produto.shipper.service.ShipperMetrics.DropReason;
import com.produto.shipper.transport.LogBatchSender;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Queues log records from any thread and ships them to Loki in batches from a single
 * background worker.
 *
 * <p>A batch is sent when it reaches {@code batchSize} records or when
 * {@code flushInterval} has passed since its first record was taken off the queue,
 * whichever happens first. Delivery is at-most-once: a failed push is logged, counted
 * and discarded.</p>
 *
 * <p>{@link #shutdown(Duration)} stops intake, lets the worker send everything still
 * queued and waits for it up to the given timeout. Once stopped, records are written to
 * the local fallback logger instead.</p>
 *
 * <p>Create one instance per process, call {@link #start()} at boot and
 * {@link #shutdown(Duration)} at termination.</p>
 */
@Slf4j
public class LokiLogShipper implements AutoCloseable {

    private static final Logger FALLBACK = LoggerFactory.getLogger("com.produto.shipper.fallback");

    // Identity-compared marker that wakes the worker for the final drain
    private static final LogRecord DRAIN_MARKER = new LogRecord("", "", "", Instant.EPOCH, null);

    private static final long OVERFLOW_WARN_INTERVAL_NANOS = TimeUnit.SECONDS.toNanos(10);

    private final ShipperSettings settings;
    private final LogBatchSender sender;
    private final LokiPayloadEncoder encoder;
    private final ShipperMetrics metrics;
    private final int batchSize;
    private final long flushIntervalNanos;

    private final BlockingQueue<LogRecord> queue = new LinkedBlockingQueue<>();
    private final ReadWriteLock stateLock = new ReentrantReadWriteLock();
    private final CountDownLatch drained = new CountDownLatch(1);
    private final AtomicLong lastOverflowWarning = new AtomicLong(System.nanoTime() - OVERFLOW_WARN_INTERVAL_NANOS);

    private volatile ShipperState state = ShipperState.RUNNING;
    private volatile boolean drainedCleanly;
    private Thread worker;

    public LokiLogShipper(ShipperSettings settings, LogBatchSender sender, MeterRegistry meterRegistry) {
        this(settings, sender, new LokiPayloadEncoder(), meterRegistry);
    }

    public LokiLogShipper(ShipperSettings settings,
                          LogBatchSender sender,
                          LokiPayloadEncoder encoder,
                          MeterRegistry meterRegistry) {
        settings.validate();
        this.settings = settings;
        this.sender = sender;
        this.encoder = encoder;
        this.batchSize = settings.getBatchSize();
        this.flushIntervalNanos = settings.getFlushInterval().toNanos();
        this.metrics = new ShipperMetrics(meterRegistry, settings.getJob());
        this.metrics.bindQueue(queue);
    }

    /**
     * Starts the background worker. Calling it again while running has no effect.
     *
     * @throws IllegalStateException if the shipper has already been shut down
     */
    public synchronized void start() {
        if (state != ShipperState.RUNNING) {
            throw new IllegalStateException("Loki shipper cannot be restarted once shut down");
        }
        if (worker != null) {
            log.debug("Loki shipper already started");
            return;
        }
        worker = new Thread(this::runWorker, "loki-shipper");
        worker.setDaemon(true);
        worker.start();
        log.info("Loki shipper started - endpoint: {}, job: {}, batch size: {}, flush interval: {}ms",
            settings.pushEndpoint(), settings.getJob(), batchSize, settings.getFlushInterval().toMillis());
    }

    /**
     * Queues a record for shipping. Never blocks on I/O and never throws; when the
     * shipper is no longer running the record goes to the local fallback logger.
     */
    public void enqueue(LogRecord record) {
        if (record == null) {
            return;
        }
        stateLock.readLock().lock();
        try {
            if (state == ShipperState.RUNNING) {
                queue.offer(record);
                if (settings.getQueueCapacity() > 0) {
                    evictOverflow();
                }
                return;
            }
        } finally {
            stateLock.readLock().unlock();
        }
        fallback(record);
    }

    /**
     * Stops intake, sends everything still queued and waits for the worker up to
     * {@code timeout}. Records still queued when the timeout expires are dropped.
     *
     * @return true if every queued record got a send attempt before the timeout
     */
    public boolean shutdown(Duration timeout) {
        Thread workerThread;
        synchronized (this) {
            stateLock.writeLock().lock();
            try {
                if (state != ShipperState.RUNNING) {
                    return state == ShipperState.STOPPED && drainedCleanly;
                }
                state = ShipperState.SHUTTING_DOWN;
            } finally {
                stateLock.writeLock().unlock();
            }
            workerThread = worker;
        }

        if (workerThread == null) {
            int dropped = discardQueued();
            if (dropped > 0) {
                log.warn("Loki shipper was never started, dropping {} queued log records", dropped);
            }
            return finishShutdown(dropped == 0);
        }

        log.info("Shutting down Loki shipper, flushing {} queued log records", queue.size());
        queue.offer(DRAIN_MARKER);

        boolean completed;
        try {
            completed = drained.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            completed = false;
        }

        if (!completed) {
            workerThread.interrupt();
            int dropped = discardQueued();
            log.warn("Loki shipper did not finish flushing within {}ms, dropping {} queued log records",
                timeout.toMillis(), dropped);
        }
        return finishShutdown(completed);
    }

    @Override
    public void close() {
        shutdown(settings.getShutdownTimeout());
    }

    public ShipperState getState() {
        return state;
    }

    public int getQueueDepth() {
        return queue.size();
    }

    public ShipperSettings getSettings() {
        return settings;
    }

    private boolean finishShutdown(boolean completed) {
        drainedCleanly = completed;
        state = ShipperState.STOPPED;
        log.info("Loki shipper stopped");
        return completed;
    }

    private void runWorker() {
        List<LogRecord> batch = new ArrayList<>(batchSize);
        long deadline = 0L;

        while (true) {
            try {
                LogRecord next;
                if (batch.isEmpty()) {
                    next = queue.take();
                    deadline = System.nanoTime() + flushIntervalNanos;
                } else {
                    long remaining = deadline - System.nanoTime();
                    next = remaining > 0 ? queue.poll(remaining, TimeUnit.NANOSECONDS) : null;
                }

                if (next == DRAIN_MARKER) {
                    break;
                }
                if (next != null) {
                    batch.add(next);
                }
                if (next == null || batch.size() >= batchSize) {
                    flush(batch);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Loki shipper worker interrupted, {} log records not sent", batch.size());
                return;
            } catch (RuntimeException e) {
                log.error("Unexpected error in Loki shipper worker", e);
            }
        }

        drainRemaining(batch);
        drained.countDown();
    }

    private void drainRemaining(List<LogRecord> pending) {
        List<LogRecord> remaining = new ArrayList<>(pending);
        pending.clear();
        queue.drainTo(remaining);
        remaining.removeIf(record -> record == DRAIN_MARKER);

        for (int from = 0; from < remaining.size(); from += batchSize) {
            if (Thread.currentThread().isInterrupted()) {
                log.warn("Final Loki flush interrupted, {} log records not sent", remaining.size() - from);
                return;
            }
            List<LogRecord> chunk = new ArrayList<>(remaining.subList(from, Math.min(remaining.size(), from + batchSize)));
            try {
                flush(chunk);
            } catch (RuntimeException e) {
                log.error("Unexpected error during final Loki flush", e);
            }
        }
    }

    /**
     * Sends the batch and clears it, whatever the outcome.
     */
    private void flush(List<LogRecord> batch) {
        if (batch.isEmpty()) {
            return;
        }
        int size = batch.size();
        try {
            LokiPushRequest request = encoder.encode(Collections.unmodifiableList(batch));
            int entries = request.entryCount();
            metrics.recordDropped(DropReason.SERIALIZATION, size - entries);
            if (entries == 0) {
                return;
            }
            push(request, entries);
        } finally {
            batch.clear();
        }
    }

    private void push(LokiPushRequest request, int entries) {
        Timer.Sample sample = Timer.start();
        try {
            sender.send(request);
            metrics.recordSent(entries);
            log.debug("POST to Loki | endpoint: {} | job: {} | batch: {} logs",
                settings.pushEndpoint(), settings.getJob(), entries);
        } catch (RuntimeException e) {
            metrics.recordFailed(entries);
            log.warn("Failed to push batch of {} log records to Loki: {}", entries, e.getMessage());
        } finally {
            sample.stop(metrics.pushLatency());
        }
    }

    private void evictOverflow() {
        int evicted = 0;
        while (queue.size() > settings.getQueueCapacity() && queue.poll() != null) {
            evicted++;
        }
        if (evicted == 0) {
            return;
        }
        metrics.recordDropped(DropReason.OVERFLOW, evicted);

        long now = System.nanoTime();
        long last = lastOverflowWarning.get();
        if (now - last >= OVERFLOW_WARN_INTERVAL_NANOS && lastOverflowWarning.compareAndSet(last, now)) {
            log.warn("Loki queue is full ({} records), dropping oldest log records", settings.getQueueCapacity());
        }
    }

    private int discardQueued() {
        List<LogRecord> discarded = new ArrayList<>();
        queue.drainTo(discarded);
        discarded.removeIf(record -> record == DRAIN_MARKER);
        metrics.recordDropped(DropReason.SHUTDOWN, discarded.size());
        return discarded.size();
    }

    private void fallback(LogRecord record) {
        metrics.recordDropped(DropReason.STOPPED, 1);
        FALLBACK.info("{} - {} - {}", record.logger(), record.level(), record.message());
    }
}
