package com.example.storefront.domain.model;

/**
 * Supported payment methods. Each one is settled by its own processor.
 */
public enum PaymentMethod {
    CREDIT_CARD,
    DEBIT_CARD,
    NET_BANKING,
    WALLET
}
