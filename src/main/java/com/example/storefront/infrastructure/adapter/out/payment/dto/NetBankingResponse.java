package com.example.storefront.infrastructure.adapter.out.payment.dto;

/**
 * Response DTO from the bank gateway, shared by charge and refund.
 */
public record NetBankingResponse(
        String transactionId,
        String status,
        String message
) {
}
