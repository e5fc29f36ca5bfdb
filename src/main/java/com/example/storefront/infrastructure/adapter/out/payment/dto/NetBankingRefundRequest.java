package com.example.storefront.infrastructure.adapter.out.payment.dto;

import java.math.BigDecimal;

/**
 * Request DTO for the bank gateway refund endpoint.
 */
public record NetBankingRefundRequest(
        String transactionId,
        BigDecimal amount,
        String currency
) {
}
