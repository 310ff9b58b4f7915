package com.questrail.kitchen.api;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Order-level header data carried with every manifest entry and printed on
 * every ticket header.
 *
 * <p>Only {@code orderId} and {@code createdAt} are required. The rest are
 * display data supplied by the order subsystem and may be {@code null}.</p>
 */
public record OrderContext(
        String orderId,
        String orderNumber,
        String orderType,
        String tableName,
        String tabName,
        String serverName,
        Instant createdAt
) {
    public OrderContext {
        Objects.requireNonNull(orderId, "orderId");
        Objects.requireNonNull(createdAt, "createdAt");
        if (orderId.isBlank()) {
            throw new IllegalArgumentException("orderId must not be blank");
        }
    }

    public static OrderContext of(String orderId, Instant createdAt) {
        return new OrderContext(orderId, null, null, null, null, null, createdAt);
    }

    public Optional<String> number() {
        return Optional.ofNullable(orderNumber);
    }

    public Optional<String> type() {
        return Optional.ofNullable(orderType);
    }

    public Optional<String> table() {
        return Optional.ofNullable(tableName);
    }

    public Optional<String> tab() {
        return Optional.ofNullable(tabName);
    }

    public Optional<String> server() {
        return Optional.ofNullable(serverName);
    }

    public OrderContext withTable(String table) {
        return new OrderContext(orderId, orderNumber, orderType, table, tabName, serverName, createdAt);
    }

    public OrderContext withNumber(String number) {
        return new OrderContext(orderId, number, orderType, tableName, tabName, serverName, createdAt);
    }

    public OrderContext withServer(String server) {
        return new OrderContext(orderId, orderNumber, orderType, tableName, tabName, server, createdAt);
    }

    public OrderContext withTab(String tab) {
        return new OrderContext(orderId, orderNumber, orderType, tableName, tab, serverName, createdAt);
    }

    public OrderContext withType(String type) {
        return new OrderContext(orderId, orderNumber, type, tableName, tabName, serverName, createdAt);
    }
}
