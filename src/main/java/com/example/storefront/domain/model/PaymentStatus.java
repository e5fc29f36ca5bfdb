package com.example.storefront.domain.model;

/**
 * Settlement state of an order, tracked independently of {@link OrderStatus}.
 */
public enum PaymentStatus {

    /**
     * No payment attempted yet.
     */
    PENDING,

    /**
     * Processor settled the order total.
     */
    COMPLETED,

    /**
     * Last attempt was declined or the processor was unreachable. Payment may be retried.
     */
    FAILED,

    /**
     * Completed payment returned to the customer.
     */
    REFUNDED
}
