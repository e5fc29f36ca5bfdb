package com.example.storefront.application.port.out;

import com.example.storefront.domain.model.Order;
import com.example.storefront.domain.model.OrderId;
import com.example.storefront.domain.model.UserId;

import java.util.List;
import java.util.Optional;

/**
 * Outbound port holding the record of every order ever created. Orders are never deleted.
 */
public interface OrderStore {

    Order save(Order order);

    Optional<Order> findById(OrderId orderId);

    /**
     * Orders of one user, oldest first.
     */
    List<Order> findByUserId(UserId userId);

    List<Order> findAll();
}
