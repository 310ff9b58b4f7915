package com.questrail.kitchen.dispatch;

import com.questrail.kitchen.api.StationId;
import com.questrail.kitchen.api.UnroutedItem;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * DispatchReport
 * -----------------------------------------------------------------------------
 * What happened to every destination of one send action.
 *
 * <p>The aggregate tells the caller whether to say "sent" or "partially sent"
 * to the operator:</p>
 * <ul>
 *   <li>{@link Status#SENT}: every destination not cancelled was delivered</li>
 *   <li>{@link Status#PARTIALLY_SENT}: some were delivered, some failed</li>
 *   <li>{@link Status#NOT_SENT}: nothing was delivered (including a fully
 *       unrouted order)</li>
 * </ul>
 * Unrouted items do not change the aggregate; they are listed separately.
 */
public record DispatchReport(String orderId, List<DestinationOutcome> outcomes, List<UnroutedItem> unrouted)
{
    public enum Status {
        SENT,
        PARTIALLY_SENT,
        NOT_SENT
    }

    public DispatchReport {
        Objects.requireNonNull(orderId, "orderId");
        outcomes = List.copyOf(Objects.requireNonNull(outcomes, "outcomes"));
        unrouted = List.copyOf(Objects.requireNonNull(unrouted, "unrouted"));
    }

    public Status status() {
        int delivered = 0;
        int counted = 0;
        for (DestinationOutcome o : outcomes) {
            if (o.status() == DeliveryStatus.CANCELLED) {
                continue;
            }
            counted++;
            if (o.status().delivered()) {
                delivered++;
            }
        }
        if (delivered == 0) {
            return Status.NOT_SENT;
        }
        return delivered == counted ? Status.SENT : Status.PARTIALLY_SENT;
    }

    public Optional<DestinationOutcome> outcome(StationId stationId) {
        for (DestinationOutcome o : outcomes) {
            if (o.stationId().equals(stationId)) {
                return Optional.of(o);
            }
        }
        return Optional.empty();
    }

    public List<DestinationOutcome> withStatus(DeliveryStatus status) {
        List<DestinationOutcome> out = new ArrayList<>();
        for (DestinationOutcome o : outcomes) {
            if (o.status() == status) {
                out.add(o);
            }
        }
        return out;
    }

    /**
     * Destinations that did not receive their items.
     */
    public List<DestinationOutcome> failed() {
        List<DestinationOutcome> out = new ArrayList<>();
        for (DestinationOutcome o : outcomes) {
            if (!o.status().delivered() && o.status() != DeliveryStatus.CANCELLED) {
                out.add(o);
            }
        }
        return out;
    }
}
