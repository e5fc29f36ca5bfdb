package com.example.storefront.domain.exception;

import com.example.storefront.domain.model.OrderEvent;
import com.example.storefront.domain.model.OrderStatus;

/**
 * An order lifecycle guard rejected the event. The order is left untouched.
 */
public class InvalidTransitionException extends DomainException {

    private final OrderStatus fromStatus;
    private final OrderEvent attemptedEvent;

    public InvalidTransitionException(OrderStatus fromStatus, OrderEvent attemptedEvent) {
        this(fromStatus, attemptedEvent, "not allowed");
    }

    public InvalidTransitionException(OrderStatus fromStatus, OrderEvent attemptedEvent, String reason) {
        super("Cannot apply " + attemptedEvent + " to order in status " + fromStatus + ": " + reason);
        this.fromStatus = fromStatus;
        this.attemptedEvent = attemptedEvent;
    }

    public OrderStatus getFromStatus() {
        return fromStatus;
    }

    public OrderEvent getAttemptedEvent() {
        return attemptedEvent;
    }
}
