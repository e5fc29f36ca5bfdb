package com.example.storefront.domain.model;

import java.util.Objects;

/**
 * Destination an order is shipped to. Copied by value onto the order at creation.
 */
public record ShippingAddress(
        String street,
        String city,
        String state,
        String postalCode,
        String country
) {
    public ShippingAddress {
        Objects.requireNonNull(street, "Street cannot be null");
        Objects.requireNonNull(city, "City cannot be null");
        Objects.requireNonNull(postalCode, "PostalCode cannot be null");
        Objects.requireNonNull(country, "Country cannot be null");
        if (street.isBlank() || city.isBlank() || country.isBlank()) {
            throw new IllegalArgumentException("Street, city and country cannot be blank");
        }
        state = state == null ? "" : state;
    }

    @Override
    public String toString() {
        return state.isEmpty()
                ? String.join(", ", street, city, postalCode, country)
                : String.join(", ", street, city, state, postalCode, country);
    }
}
