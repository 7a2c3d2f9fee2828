package com.squadron.agent;

import com.squadron.core.error.SpawnException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;
import java.util.concurrent.CompletableFuture;

/**
 * Counting limit on concurrently running workers with a waiting queue.
 *
 * <p>A released slot passes straight to the head of the queue, so a queued request never
 * loses its turn to a later {@link #tryAcquire}. Lowering the limit never preempts running
 * holders; it takes effect as they release.
 */
public class AgentSlotPool {

    private static final Logger log = LoggerFactory.getLogger(AgentSlotPool.class);

    /** Order in which queued requests receive released slots. */
    public enum QueueStrategy {
        FIFO,
        PRIORITY
    }

    /**
     * Snapshot of pool usage.
     *
     * @param utilizationPercent running over maxConcurrent, rounded, 0-100 unless the limit was lowered
     */
    public record Stats(int maxConcurrent, int running, int queued, int available, int utilizationPercent) {
    }

    private record Waiter(CompletableFuture<Void> slot, int priority, long sequence) {
    }

    private final QueueStrategy strategy;
    private final PriorityQueue<Waiter> queue;
    private int maxConcurrent;
    private int running;
    private long sequence;

    public AgentSlotPool(int maxConcurrent, QueueStrategy strategy) {
        requireValidLimit(maxConcurrent);
        this.maxConcurrent = maxConcurrent;
        this.strategy = strategy;
        Comparator<Waiter> bySequence = Comparator.comparingLong(Waiter::sequence);
        this.queue = new PriorityQueue<>(strategy == QueueStrategy.PRIORITY
                ? Comparator.comparingInt(Waiter::priority).reversed().thenComparing(bySequence)
                : bySequence);
    }

    /**
     * Takes a slot if one is free and nobody is queued.
     */
    public synchronized boolean tryAcquire() {
        if (running < maxConcurrent && queue.isEmpty()) {
            running++;
            return true;
        }
        return false;
    }

    /**
     * Takes a slot now or queues for one. Priority orders the queue only under
     * {@link QueueStrategy#PRIORITY}; higher runs first.
     *
     * @return a future completed once the caller holds a slot, or completed exceptionally
     *         when the queue is cleared
     */
    public synchronized CompletableFuture<Void> acquire(int priority) {
        if (running < maxConcurrent && queue.isEmpty()) {
            running++;
            return CompletableFuture.completedFuture(null);
        }
        var waiter = new Waiter(new CompletableFuture<>(), priority, sequence++);
        queue.add(waiter);
        log.debug("Agent slot request queued (priority {}, {} waiting)", priority, queue.size());
        return waiter.slot();
    }

    /**
     * Returns a slot. Over-release is ignored.
     */
    public void release() {
        CompletableFuture<Void> handoff;
        synchronized (this) {
            if (running <= 0) {
                log.warn("Agent slot released while none is held, ignoring");
                return;
            }
            running--;
            handoff = grantNext();
        }
        // complete outside the monitor; dependents may run inline
        if (handoff != null) {
            handOver(handoff);
        }
    }

    /**
     * Changes the limit. Raising it hands the new slots to queued requests.
     *
     * @throws IllegalArgumentException if {@code max} is below 1
     */
    public void setLimit(int max) {
        requireValidLimit(max);
        var granted = new ArrayList<CompletableFuture<Void>>();
        synchronized (this) {
            maxConcurrent = max;
            CompletableFuture<Void> next;
            while ((next = grantNext()) != null) {
                granted.add(next);
            }
        }
        log.info("Agent concurrency limit set to {}", max);
        granted.forEach(this::handOver);
    }

    /**
     * Fails every queued request with a {@link SpawnException}. Running holders are untouched.
     *
     * @return number of requests cleared
     */
    public int clearQueue() {
        List<Waiter> cleared;
        synchronized (this) {
            cleared = new ArrayList<>(queue);
            queue.clear();
        }
        var error = new SpawnException("Agent slot queue cleared");
        cleared.forEach(w -> w.slot().completeExceptionally(error));
        return cleared.size();
    }

    public synchronized Stats getStats() {
        int available = Math.max(0, maxConcurrent - running);
        int utilization = (int) Math.round(running * 100.0 / maxConcurrent);
        return new Stats(maxConcurrent, running, queue.size(), available, utilization);
    }

    public QueueStrategy getStrategy() {
        return strategy;
    }

    private void handOver(CompletableFuture<Void> slot) {
        if (!slot.complete(null)) {
            // cancelled between grant and completion
            release();
        }
    }

    /** Caller holds the monitor. */
    private CompletableFuture<Void> grantNext() {
        while (running < maxConcurrent && !queue.isEmpty()) {
            Waiter next = queue.poll();
            // a caller may have cancelled its request while queued
            if (!next.slot().isDone()) {
                running++;
                return next.slot();
            }
        }
        return null;
    }

    private static void requireValidLimit(int max) {
        if (max < 1) {
            throw new IllegalArgumentException("Agent concurrency limit must be at least 1, was " + max);
        }
    }
}
