package com.squadron.agent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Fixed-capacity replay log of the most recent output chunks of one process.
 *
 * <p>Appending to a full buffer evicts the oldest chunk. A subscriber attaching at any
 * time first receives the buffered backlog and then every chunk appended afterwards,
 * in append order, with no gap and no duplicate: backlog replay and registration happen
 * under the same lock that appends take.
 *
 * @param <T> chunk type
 */
public class OutputRingBuffer<T> {

    private static final Logger log = LoggerFactory.getLogger(OutputRingBuffer.class);

    private final int capacity;
    private final ArrayDeque<T> chunks;
    private final List<Consumer<T>> subscribers = new ArrayList<>();
    private boolean closed;

    public OutputRingBuffer(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.chunks = new ArrayDeque<>(capacity);
    }

    /**
     * Appends a chunk, evicting the oldest when full, and delivers it to live subscribers.
     * Appends after {@link #close()} are dropped.
     */
    public synchronized void append(T chunk) {
        if (closed) {
            log.debug("Dropping chunk appended after close");
            return;
        }
        if (chunks.size() == capacity) {
            chunks.removeFirst();
        }
        chunks.addLast(chunk);
        for (Consumer<T> subscriber : List.copyOf(subscribers)) {
            deliverSafely(subscriber, chunk);
        }
    }

    /**
     * Replays the backlog to {@code subscriber} and registers it for live chunks.
     * On a closed buffer only the backlog is replayed.
     *
     * @return handle that detaches the subscriber
     */
    public synchronized Subscription subscribe(Consumer<T> subscriber) {
        for (T chunk : chunks) {
            deliverSafely(subscriber, chunk);
        }
        if (closed) {
            return () -> { };
        }
        subscribers.add(subscriber);
        return () -> {
            synchronized (OutputRingBuffer.this) {
                subscribers.remove(subscriber);
            }
        };
    }

    /** Copy of the buffered chunks, oldest first. */
    public synchronized List<T> snapshot() {
        return List.copyOf(chunks);
    }

    public synchronized int size() {
        return chunks.size();
    }

    public int capacity() {
        return capacity;
    }

    /** Stops accepting chunks and detaches all subscribers. The backlog stays readable. */
    public synchronized void close() {
        closed = true;
        subscribers.clear();
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<T> subscriber, T chunk) {
        try {
            subscriber.accept(chunk);
        } catch (Exception e) {
            log.warn("Output subscriber threw exception: {}", e.getMessage(), e);
        }
    }
}
