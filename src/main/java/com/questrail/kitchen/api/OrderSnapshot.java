package com.questrail.kitchen.api;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * The input of one send action: the order header and the items being sent,
 * in the order they were entered.
 */
public record OrderSnapshot(OrderContext context, List<OrderItem> items)
{
    public OrderSnapshot {
        Objects.requireNonNull(context, "context");
        items = List.copyOf(Objects.requireNonNull(items, "items"));

        Set<String> seen = new HashSet<>();
        for (OrderItem item : items) {
            if (!seen.add(item.id())) {
                throw new IllegalArgumentException("Duplicate order item id: " + item.id());
            }
        }
    }

    public static OrderSnapshot of(OrderContext context, OrderItem... items) {
        return new OrderSnapshot(context, List.of(items));
    }

    public String orderId() {
        return context.orderId();
    }
}
