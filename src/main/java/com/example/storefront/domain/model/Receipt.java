package com.example.storefront.domain.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Proof of a settled charge, kept on the order for refunds.
 */
public record Receipt(
        String transactionId,
        PaymentMethod method,
        Money amount,
        Instant processedAt
) {
    public Receipt {
        Objects.requireNonNull(transactionId, "TransactionId cannot be null");
        Objects.requireNonNull(method, "Method cannot be null");
        Objects.requireNonNull(amount, "Amount cannot be null");
        Objects.requireNonNull(processedAt, "ProcessedAt cannot be null");
    }
}
