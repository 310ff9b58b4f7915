package com.questrail.kitchen.channel;

import com.questrail.kitchen.api.StationId;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * StationSubscription
 * -----------------------------------------------------------------------------
 * One connected display client's view of a station channel.
 *
 * <h2>Backpressure</h2>
 * Messages are held in a bounded queue. When a slow client lets the queue
 * fill up, the oldest message is dropped and {@link #needsRefresh()} turns
 * true: the client has a gap and must reload the station's full state from
 * the snapshot endpoint. {@link #acknowledgeRefresh()} clears the flag.
 *
 * <h2>Delivery</h2>
 * At most once. A message offered after {@link #close()} is discarded.
 */
public final class StationSubscription implements AutoCloseable
{
    private final StationId stationId;
    private final BlockingQueue<StationMessage> queue;
    private final StationChannelHub hub;

    private final AtomicBoolean needsRefresh = new AtomicBoolean();
    private final AtomicBoolean closed = new AtomicBoolean();
    private final AtomicLong dropped = new AtomicLong();

    StationSubscription(StationId stationId, int capacity, StationChannelHub hub) {
        this.stationId = Objects.requireNonNull(stationId, "stationId");
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1 (was " + capacity + ")");
        }
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.hub = Objects.requireNonNull(hub, "hub");
    }

    public StationId stationId() {
        return stationId;
    }

    /**
     * Waits up to {@code timeout} for the next message.
     *
     * @return the message, or {@code null} if none arrived in time
     */
    public StationMessage poll(Duration timeout) throws InterruptedException {
        Objects.requireNonNull(timeout, "timeout");
        return queue.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    /**
     * Removes and returns every queued message, oldest first.
     */
    public List<StationMessage> drain() {
        List<StationMessage> out = new ArrayList<>();
        queue.drainTo(out);
        return out;
    }

    public int pending() {
        return queue.size();
    }

    public boolean needsRefresh() {
        return needsRefresh.get();
    }

    public void acknowledgeRefresh() {
        needsRefresh.set(false);
    }

    public long droppedCount() {
        return dropped.get();
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Unsubscribes. Safe to call more than once.
     */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            hub.unsubscribe(this);
            queue.clear();
        }
    }

    /**
     * @return {@code true} if the message was queued
     */
    boolean offer(StationMessage message) {
        if (closed.get()) {
            return false;
        }
        synchronized (queue) {
            while (!queue.offer(message)) {
                if (queue.poll() != null) {
                    dropped.incrementAndGet();
                    needsRefresh.set(true);
                }
            }
        }
        return true;
    }
}
