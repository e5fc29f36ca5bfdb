package com.example.storefront.application.dto;

import com.example.storefront.domain.model.Cart;
import com.example.storefront.domain.model.CartLine;
import com.example.storefront.domain.model.UserId;

import java.util.List;
import java.util.Objects;

/**
 * Immutable copy of a cart's lines at checkout time.
 */
public record CartSnapshot(
        UserId userId,
        List<CartLine> lines
) {
    public CartSnapshot {
        Objects.requireNonNull(userId, "UserId cannot be null");
        lines = List.copyOf(Objects.requireNonNull(lines, "Lines cannot be null"));
    }

    public static CartSnapshot of(Cart cart) {
        return new CartSnapshot(cart.getOwner(), cart.getLines());
    }

    public boolean isEmpty() {
        return lines.isEmpty();
    }
}
