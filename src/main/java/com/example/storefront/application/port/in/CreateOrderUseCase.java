package com.example.storefront.application.port.in;

import com.example.storefront.application.dto.CartSnapshot;
import com.example.storefront.domain.model.Order;
import com.example.storefront.domain.model.ShippingAddress;
import com.example.storefront.domain.model.UserId;

/**
 * Inbound port for turning cart contents into orders.
 */
public interface CreateOrderUseCase {

    /**
     * Reserves stock for every line and records a PENDING order. All or nothing: if any
     * line cannot be reserved, reservations already made are released and no order exists.
     *
     * @param snapshot        the lines to order
     * @param shippingAddress the shipping address
     * @return the created order
     * @throws com.example.storefront.domain.exception.EmptyCartException         if there are no lines
     * @throws com.example.storefront.domain.exception.InsufficientStockException if a line cannot be reserved
     */
    Order createOrder(CartSnapshot snapshot, ShippingAddress shippingAddress);

    /**
     * Converts the user's current cart into an order and clears the cart.
     *
     * @param userId          the cart owner
     * @param shippingAddress the shipping address
     * @return the created order
     */
    Order checkout(UserId userId, ShippingAddress shippingAddress);
}
