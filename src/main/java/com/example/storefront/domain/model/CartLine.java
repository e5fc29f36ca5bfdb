package com.example.storefront.domain.model;

import java.util.Objects;

/**
 * One product line of a cart.
 */
public record CartLine(ProductId productId, int quantity) {

    public CartLine {
        Objects.requireNonNull(productId, "ProductId cannot be null");
        if (quantity <= 0) {
            throw new IllegalArgumentException("Quantity must be positive: " + quantity);
        }
    }
}
