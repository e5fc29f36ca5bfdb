package com.example.storefront.domain.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Enum representing the possible states of an Order.
 */
public enum OrderStatus {

    /**
     * Stock is reserved, awaiting a successful payment.
     */
    PENDING,

    /**
     * Payment has been completed.
     */
    CONFIRMED,

    /**
     * Handed over to the carrier with a tracking number.
     */
    SHIPPED,

    /**
     * Received by the customer. Terminal.
     */
    DELIVERED,

    /**
     * Cancelled before shipping; reserved stock was restored. Terminal.
     */
    CANCELLED;

    private static final Set<OrderStatus> CANCELLABLE = EnumSet.of(PENDING, CONFIRMED);

    public boolean isCancellable() {
        return CANCELLABLE.contains(this);
    }

    public boolean isTerminal() {
        return this == DELIVERED || this == CANCELLED;
    }
}
