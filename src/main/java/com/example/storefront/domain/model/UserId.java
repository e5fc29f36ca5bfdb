package com.example.storefront.domain.model;

import java.util.Objects;

/**
 * Value Object identifying the shopper who owns a cart and its orders.
 */
public final class UserId {

    private final String value;

    private UserId(String value) {
        this.value = value;
    }

    /**
     * @throws IllegalArgumentException if value is blank
     */
    public static UserId of(String value) {
        Objects.requireNonNull(value, "UserId value cannot be null");
        if (value.isBlank()) {
            throw new IllegalArgumentException("UserId cannot be blank");
        }
        return new UserId(value.trim());
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        UserId userId = (UserId) o;
        return Objects.equals(value, userId.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
