package com.questrail.kitchen.channel;

import com.questrail.kitchen.api.OrderContext;
import com.questrail.kitchen.api.RoutingManifestEntry;
import com.questrail.kitchen.api.StationId;
import com.questrail.kitchen.internal.time.WallClock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * StationChannelHub
 * =============================================================================
 * Publish/subscribe channels keyed by station id.
 *
 * <p>Publishing is fire-and-forget: the hub copies the message into each
 * subscriber's bounded queue and returns without waiting for any client to
 * render it. A client that reconnects after a drop recovers from the external
 * snapshot endpoint, never from the hub.</p>
 */
public final class StationChannelHub
{
    private static final Logger log = LoggerFactory.getLogger(StationChannelHub.class);

    private final Map<StationId, List<StationSubscription>> channels = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final WallClock wallClock;
    private final int defaultCapacity;

    public StationChannelHub(WallClock wallClock, int defaultCapacity) {
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        if (defaultCapacity < 1) {
            throw new IllegalArgumentException("defaultCapacity must be >= 1 (was " + defaultCapacity + ")");
        }
        this.defaultCapacity = defaultCapacity;
    }

    public StationSubscription subscribe(StationId stationId) {
        return subscribe(stationId, defaultCapacity);
    }

    public StationSubscription subscribe(StationId stationId, int capacity) {
        Objects.requireNonNull(stationId, "stationId");
        StationSubscription sub = new StationSubscription(stationId, capacity, this);
        channels.computeIfAbsent(stationId, id -> new CopyOnWriteArrayList<>()).add(sub);
        log.debug("Station {}: subscriber connected (capacity {})", stationId, capacity);
        return sub;
    }

    /**
     * Delivers the entry to every current subscriber of its station.
     *
     * @return the number of subscribers the message was queued for
     */
    public int publish(OrderContext order, RoutingManifestEntry entry) {
        Objects.requireNonNull(order, "order");
        Objects.requireNonNull(entry, "entry");

        StationMessage message = new StationMessage(sequence.incrementAndGet(), order, entry, wallClock.now());
        List<StationSubscription> subs = channels.get(entry.stationId());
        if (subs == null) {
            return 0;
        }
        int delivered = 0;
        for (StationSubscription sub : subs) {
            if (sub.offer(message)) {
                delivered++;
            }
        }
        return delivered;
    }

    public int subscriberCount(StationId stationId) {
        List<StationSubscription> subs = channels.get(stationId);
        return subs == null ? 0 : subs.size();
    }

    /**
     * Disconnects every subscriber. Used on shutdown.
     */
    public void closeAll() {
        for (List<StationSubscription> subs : channels.values()) {
            for (StationSubscription sub : subs) {
                sub.close();
            }
        }
        channels.clear();
    }

    void unsubscribe(StationSubscription sub) {
        List<StationSubscription> subs = channels.get(sub.stationId());
        if (subs != null) {
            subs.remove(sub);
            log.debug("Station {}: subscriber disconnected", sub.stationId());
        }
    }
}
