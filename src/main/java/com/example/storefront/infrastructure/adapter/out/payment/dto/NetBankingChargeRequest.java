package com.example.storefront.infrastructure.adapter.out.payment.dto;

import java.math.BigDecimal;

/**
 * Request DTO for the bank gateway charge endpoint.
 */
public record NetBankingChargeRequest(
        String bankCode,
        String accountNumber,
        BigDecimal amount,
        String currency
) {
    public static NetBankingChargeRequest of(String bankCode, String accountNumber, BigDecimal amount,
                                             String currency) {
        return new NetBankingChargeRequest(bankCode, accountNumber, amount, currency);
    }
}
