package com.example.storefront.application.dto;

import com.example.storefront.domain.model.Order;
import com.example.storefront.domain.model.PaymentStatus;
import com.example.storefront.domain.model.Receipt;

/**
 * Result of a payment attempt on an order.
 */
public record PaymentOutcome(
        PaymentStatus status,
        Order order,
        Receipt receipt,
        String failureReason
) {
    public static PaymentOutcome completed(Order order, Receipt receipt) {
        return new PaymentOutcome(PaymentStatus.COMPLETED, order, receipt, null);
    }

    public static PaymentOutcome failed(Order order, String reason) {
        return new PaymentOutcome(PaymentStatus.FAILED, order, null, reason);
    }

    public boolean succeeded() {
        return status == PaymentStatus.COMPLETED;
    }
}
