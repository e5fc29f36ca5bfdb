package com.example.storefront.infrastructure.persistence;

import com.example.storefront.application.port.out.CartStore;
import com.example.storefront.domain.model.Cart;
import com.example.storefront.domain.model.UserId;
import org.springframework.stereotype.Repository;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

@Repository
public class InMemoryCartStore implements CartStore {

    private final ConcurrentMap<UserId, Cart> carts = new ConcurrentHashMap<>();

    @Override
    public Cart cartFor(UserId userId) {
        return carts.computeIfAbsent(Objects.requireNonNull(userId, "UserId cannot be null"), Cart::emptyFor);
    }

    @Override
    public Optional<Cart> find(UserId userId) {
        return Optional.ofNullable(carts.get(userId));
    }
}
