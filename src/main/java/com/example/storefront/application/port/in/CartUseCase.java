package com.example.storefront.application.port.in;

import com.example.storefront.domain.model.CartLine;
import com.example.storefront.domain.model.Money;
import com.example.storefront.domain.model.ProductId;
import com.example.storefront.domain.model.UserId;

import java.util.List;
import java.util.Optional;

/**
 * Inbound port for editing a user's cart.
 */
public interface CartUseCase {

    CartLine addItem(UserId userId, ProductId productId, int quantity);

    /**
     * Sets a line's quantity; zero removes it.
     */
    Optional<CartLine> setQuantity(UserId userId, ProductId productId, int quantity);

    void removeItem(UserId userId, ProductId productId);

    void clear(UserId userId);

    List<CartLine> getLines(UserId userId);

    /**
     * Cart total at current catalog prices.
     */
    Money total(UserId userId);
}
