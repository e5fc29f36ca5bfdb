package com.example.storefront.infrastructure.persistence;

import com.example.storefront.application.port.out.OrderStore;
import com.example.storefront.domain.model.Order;
import com.example.storefront.domain.model.OrderId;
import com.example.storefront.domain.model.UserId;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Order store kept in process memory, indexed by id and by owning user.
 */
@Repository
public class InMemoryOrderStore implements OrderStore {

    private final ConcurrentMap<OrderId, Order> orders = new ConcurrentHashMap<>();
    private final ConcurrentMap<UserId, List<OrderId>> ordersByUser = new ConcurrentHashMap<>();

    @Override
    public Order save(Order order) {
        Objects.requireNonNull(order, "Order cannot be null");
        if (orders.putIfAbsent(order.getOrderId(), order) == null) {
            ordersByUser.computeIfAbsent(order.getUserId(), id -> new CopyOnWriteArrayList<>())
                    .add(order.getOrderId());
        }
        return order;
    }

    @Override
    public Optional<Order> findById(OrderId orderId) {
        return Optional.ofNullable(orders.get(orderId));
    }

    @Override
    public List<Order> findByUserId(UserId userId) {
        return ordersByUser.getOrDefault(userId, List.of()).stream()
                .map(orders::get)
                .toList();
    }

    @Override
    public List<Order> findAll() {
        return orders.values().stream()
                .sorted(Comparator.comparing(Order::getCreatedAt))
                .toList();
    }
}
