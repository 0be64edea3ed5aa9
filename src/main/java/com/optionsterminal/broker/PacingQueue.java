package com.optionsterminal.broker;

import com.optionsterminal.config.GatewayProperties;
import com.optionsterminal.domain.enums.WorkKind;
import com.optionsterminal.exception.BrokerException;
import com.optionsterminal.exception.NotConnectedException;
import com.optionsterminal.exception.PacingRejectedException;
import com.optionsterminal.exception.PacingTimeoutException;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single-lane FIFO queue that funnels every broker REST call through one background
 * thread and keeps consecutive call starts at least {@code minIntervalMs} apart.
 *
 * <p>Submitters call {@link #enqueue} and block on the item's future until the lane has
 * executed it or their wait times out. A timed-out caller stops waiting; the work item
 * is not cancelled and may still run later, its result simply undelivered.
 *
 * <p>Capacity is bounded. When a new item arrives at a full queue, the oldest pending
 * {@link WorkKind#READ} item is evicted and its caller fails immediately with
 * {@link PacingRejectedException}. {@link WorkKind#ORDER} items are never evicted: if every
 * pending item is order-mutating, the incoming item is refused instead.
 *
 * <p>Failures of a work item propagate only to its own caller. The lane keeps draining.
 */
public class PacingQueue {

    private static final Logger log = LoggerFactory.getLogger(PacingQueue.class);

    private static final long WINDOW_MS = 60_000;

    private final String name;
    private final long minIntervalMs;
    private final int capacity;
    private final long callerTimeoutMs;
    private final int maxPerMinute;

    private final LinkedBlockingDeque<PacingWorkItem<?>> queue;
    private final Object admissionLock = new Object();
    private final AtomicLong sequenceCounter = new AtomicLong(0);
    private final AtomicBoolean running = new AtomicBoolean(false);

    /** Guards the hand-off between {@link #shutdown} and the lane starting a call. */
    private final Object laneStateLock = new Object();

    /** Ring buffer of recent execution start times (epoch millis), guarded by itself. */
    private final long[] executionTimes;

    private int ringNext;
    private int ringSize;

    /** Lane-thread only. */
    private long lastStartNanos;

    private boolean hasExecuted;
    private Thread laneThread;

    /** True while the lane is inside a work item; guarded by {@code laneStateLock}. */
    private boolean executing;

    public PacingQueue(String name, GatewayProperties.Pacing config) {
        this(
                name,
                config.getMinIntervalMs(),
                config.getCapacity(),
                config.getCallerTimeoutMs(),
                config.getMaxPerMinute(),
                config.getHistorySize());
    }

    public PacingQueue(
            String name, long minIntervalMs, int capacity, long callerTimeoutMs, int maxPerMinute, int historySize) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Pacing queue capacity must be at least 1, got " + capacity);
        }
        this.name = name;
        this.minIntervalMs = minIntervalMs;
        this.capacity = capacity;
        this.callerTimeoutMs = callerTimeoutMs;
        this.maxPerMinute = maxPerMinute;
        this.queue = new LinkedBlockingDeque<>(capacity);
        this.executionTimes = new long[Math.max(historySize, 1)];
    }

    /** Starts the execution lane. Idempotent. */
    public void start() {
        if (running.compareAndSet(false, true)) {
            laneThread = new Thread(this::laneLoop, "pacing-lane-" + name);
            laneThread.setDaemon(true);
            laneThread.start();
            log.info("Pacing lane '{}' started: minInterval={}ms, capacity={}", name, minIntervalMs, capacity);
        }
    }

    /**
     * Stops the lane. The item currently executing (if any) runs to completion without
     * being interrupted; every still-pending caller fails with {@link NotConnectedException}.
     * The lane thread is interrupted only while it is idle or waiting out the spacing.
     */
    public void shutdown() {
        boolean stopped;
        synchronized (laneStateLock) {
            stopped = running.compareAndSet(true, false);
            if (stopped && laneThread != null && !executing) {
                laneThread.interrupt();
            }
        }
        if (stopped) {
            int failed = failPending();
            log.info("Pacing lane '{}' stopped, {} pending calls abandoned", name, failed);
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /** Submits a {@link WorkKind#READ} call and waits for its result. */
    public <T> T enqueue(Callable<T> work) {
        return enqueue(work, WorkKind.READ, "call");
    }

    /**
     * Submits work to the lane and blocks until it has executed or the caller timeout
     * elapses.
     *
     * @return the work's result
     * @throws PacingTimeoutException if the work did not execute within the caller timeout
     * @throws PacingRejectedException if the work was evicted from, or refused by, a full queue
     * @throws NotConnectedException if the lane is not running or stops while the work is pending
     * @throws RuntimeException the work's own failure, rethrown to this caller only
     */
    public <T> T enqueue(Callable<T> work, WorkKind kind, String description) {
        if (!running.get()) {
            throw new NotConnectedException("Pacing lane '" + name + "' is not running");
        }
        PacingWorkItem<T> item = new PacingWorkItem<>(work, kind, description, sequenceCounter.incrementAndGet());
        admit(item);
        log.debug("Enqueued {} #{} '{}' on lane '{}', depth={}", kind, item.getSequenceNumber(), description, name,
                queue.size());
        return await(item);
    }

    /** Number of execution starts recorded within the trailing 60 seconds. */
    public int callsLastMinute() {
        long cutoff = System.currentTimeMillis() - WINDOW_MS;
        synchronized (executionTimes) {
            int count = 0;
            for (int i = 0; i < ringSize; i++) {
                if (executionTimes[i] > cutoff) {
                    count++;
                }
            }
            return count;
        }
    }

    public int queueDepth() {
        return queue.size();
    }

    public RateStatus rateStatus() {
        return RateStatus.builder()
                .callsLastMinute(callsLastMinute())
                .maxPerMinute(maxPerMinute)
                .minIntervalMs(minIntervalMs)
                .queueDepth(queueDepth())
                .build();
    }

    public String getName() {
        return name;
    }

    private void admit(PacingWorkItem<?> item) {
        synchronized (admissionLock) {
            while (!queue.offerLast(item)) {
                PacingWorkItem<?> victim = oldestEvictable();
                if (victim == null) {
                    // Lane may have freed a slot since the failed offer
                    if (queue.offerLast(item)) {
                        return;
                    }
                    log.warn(
                            "Pacing lane '{}' full of order calls, refusing {} '{}'",
                            name,
                            item.getKind(),
                            item.getDescription());
                    throw new PacingRejectedException("Pacing queue '" + name + "' is full of pending order calls ("
                            + capacity + "); '" + item.getDescription() + "' was not admitted");
                }
                if (queue.removeFirstOccurrence(victim)) {
                    log.warn(
                            "Pacing lane '{}' full, evicted oldest pending #{} '{}' (waited {}ms)",
                            name,
                            victim.getSequenceNumber(),
                            victim.getDescription(),
                            System.currentTimeMillis() - victim.getEnqueuedAt());
                    victim.fail(new PacingRejectedException("Evicted from full pacing queue '" + name
                            + "' by a newer call; '" + victim.getDescription() + "' was not executed"));
                }
            }
        }
    }

    /** Oldest pending READ item, or null. The deque iterates head (oldest) first. */
    private PacingWorkItem<?> oldestEvictable() {
        for (PacingWorkItem<?> pending : queue) {
            if (pending.isEvictable()) {
                return pending;
            }
        }
        return null;
    }

    private <T> T await(PacingWorkItem<T> item) {
        try {
            return item.getResult().get(callerTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn(
                    "Caller gave up on '{}' after {}ms on lane '{}' (depth={}); the call may still execute",
                    item.getDescription(),
                    callerTimeoutMs,
                    name,
                    queue.size());
            throw new PacingTimeoutException(name, callerTimeoutMs);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new BrokerException("Broker call '" + item.getDescription() + "' failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BrokerException("Interrupted while waiting for '" + item.getDescription() + "'", e);
        }
    }

    private void laneLoop() {
        while (running.get()) {
            PacingWorkItem<?> item;
            try {
                item = queue.takeFirst();
            } catch (InterruptedException e) {
                if (!running.get()) {
                    break;
                }
                log.warn("Pacing lane '{}' interrupted unexpectedly, resuming", name);
                continue;
            }

            try {
                awaitSpacing();
            } catch (InterruptedException e) {
                item.fail(new NotConnectedException("Pacing lane '" + name + "' stopped before the call executed"));
                if (!running.get()) {
                    break;
                }
                continue;
            }

            synchronized (laneStateLock) {
                if (!running.get()) {
                    item.fail(new NotConnectedException("Pacing lane '" + name + "' stopped before the call executed"));
                    break;
                }
                executing = true;
                // Clear any interrupt left from the idle phase so the broker call starts clean
                Thread.interrupted();
            }
            try {
                lastStartNanos = System.nanoTime();
                hasExecuted = true;
                recordExecution(System.currentTimeMillis());
                log.debug("Executing #{} '{}' on lane '{}'", item.getSequenceNumber(), item.getDescription(), name);
                item.execute();
            } finally {
                synchronized (laneStateLock) {
                    executing = false;
                }
            }
        }
        failPending();
    }

    private void awaitSpacing() throws InterruptedException {
        if (!hasExecuted) {
            return;
        }
        long remainingNanos = lastStartNanos + TimeUnit.MILLISECONDS.toNanos(minIntervalMs) - System.nanoTime();
        if (remainingNanos > 0) {
            TimeUnit.NANOSECONDS.sleep(remainingNanos);
        }
    }

    private void recordExecution(long epochMillis) {
        synchronized (executionTimes) {
            executionTimes[ringNext] = epochMillis;
            ringNext = (ringNext + 1) % executionTimes.length;
            ringSize = Math.min(ringSize + 1, executionTimes.length);
        }
    }

    private int failPending() {
        int failed = 0;
        PacingWorkItem<?> pending;
        while ((pending = queue.pollFirst()) != null) {
            pending.fail(new NotConnectedException("Pacing lane '" + name + "' stopped; call was not executed"));
            failed++;
        }
        return failed;
    }
}
