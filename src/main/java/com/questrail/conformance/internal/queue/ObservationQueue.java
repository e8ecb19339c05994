package com.questrail.conformance.internal.queue;

import com.questrail.conformance.internal.time.MonotonicClock;
import com.questrail.conformance.model.Observation;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * ObservationQueue
 * =============================================================================
 * Bounded FIFO of observations between adapter-side producers and the
 * expectation matcher.
 *
 * <h2>Threading Model</h2>
 * Any number of producer threads may {@link #add} concurrently; a single
 * consumer (the test-execution thread) calls {@link #tryGet}. All state
 * transitions happen under one private monitor, and a waiting consumer is woken
 * the moment a producer adds an entry.
 *
 * <h2>Ordering</h2>
 * <ul>
 *   <li>Entries are drained strictly in arrival order</li>
 *   <li>A peek ({@code consume = false}) never removes or reorders entries</li>
 *   <li>A consume removes exactly the head entry</li>
 * </ul>
 *
 * <h2>Capacity</h2>
 * When the queue holds {@code capacity} entries, {@link #add} rejects the new
 * entry and returns {@code false}. It never blocks the producer.
 *
 * <h2>Timeouts</h2>
 * A wait ends when the {@link MonotonicClock} reaches the deadline or when the
 * timeout has elapsed in real time, whichever comes first, so a clock that is
 * stopped or advanced by hand never stalls the consumer. A zero timeout polls
 * once without waiting.
 */
public final class ObservationQueue<O extends Observation> {

    private final Object lock = new Object();
    private final Deque<O> entries = new ArrayDeque<>();
    private final int capacity;
    private final MonotonicClock clock;

    /**
     * @param capacity maximum number of queued entries, at least 1
     * @param clock    monotonic clock used for wait deadlines
     */
    public ObservationQueue(int capacity, MonotonicClock clock) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1");
        }
        this.capacity = capacity;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Appends an observation at the tail and wakes any waiting consumer.
     *
     * @return {@code false} if the queue is full and the observation was dropped
     */
    public boolean add(O observation) {
        Objects.requireNonNull(observation, "observation");
        synchronized (lock) {
            if (entries.size() >= capacity) {
                return false;
            }
            entries.addLast(observation);
            lock.notifyAll();
            return true;
        }
    }

    /**
     * Waits up to {@code timeout} for a head entry.
     *
     * @param timeout maximum wait; {@link Duration#ZERO} polls once
     * @param consume whether to remove the head entry or only peek at it
     * @return the head entry, or empty if none arrived in time or the calling
     *         thread was interrupted (the interrupt flag is restored)
     */
    public Optional<O> tryGet(Duration timeout, boolean consume) {
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be >= 0");
        }

        long timeoutNanos = saturatedNanos(timeout);
        long deadline = clock.nowNanos() + timeoutNanos;
        long waitStart = System.nanoTime();
        synchronized (lock) {
            while (entries.isEmpty()) {
                long remaining = Math.min(
                        deadline - clock.nowNanos(),
                        timeoutNanos - (System.nanoTime() - waitStart));
                if (remaining <= 0) {
                    return Optional.empty();
                }
                try {
                    TimeUnit.NANOSECONDS.timedWait(lock, remaining);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return Optional.empty();
                }
            }
            return Optional.of(consume ? entries.removeFirst() : entries.peekFirst());
        }
    }

    /**
     * Returns a copy of the queued entries in arrival order, for diagnostics.
     */
    public List<O> snapshot() {
        synchronized (lock) {
            return new ArrayList<>(entries);
        }
    }

    public int size() {
        synchronized (lock) {
            return entries.size();
        }
    }

    public int capacity() {
        return capacity;
    }

    private static long saturatedNanos(Duration timeout) {
        try {
            return timeout.toNanos();
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE / 2;
        }
    }
}
