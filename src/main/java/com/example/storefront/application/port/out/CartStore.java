package com.example.storefront.application.port.out;

import com.example.storefront.domain.model.Cart;
import com.example.storefront.domain.model.UserId;

import java.util.Optional;

/**
 * Outbound port for per-user carts.
 */
public interface CartStore {

    /**
     * Returns the user's cart, creating an empty one on first access.
     */
    Cart cartFor(UserId userId);

    Optional<Cart> find(UserId userId);
}
