package com.example.storefront.domain.model;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Value Object identifying a catalog product.
 * Format: 3 uppercase letters followed by 3 to 6 digits (e.g., PRD001, PHN123456).
 * Natural ordering is the global lock order used when several products are reserved together.
 */
public final class ProductId implements Comparable<ProductId> {

    private static final Pattern PRODUCT_ID_PATTERN = Pattern.compile("^[A-Z]{3}[0-9]{3,6}$");

    private final String value;

    private ProductId(String value) {
        this.value = Objects.requireNonNull(value, "ProductId value cannot be null");
    }

    /**
     * Creates a new ProductId with the given value.
     *
     * @param value product id string
     * @return new ProductId instance
     * @throws IllegalArgumentException if value doesn't match pattern [A-Z]{3}[0-9]{3,6}
     */
    public static ProductId of(String value) {
        if (value == null || !PRODUCT_ID_PATTERN.matcher(value).matches()) {
            throw new IllegalArgumentException(
                    "Invalid ProductId format: " + value + ". Expected pattern: [A-Z]{3}[0-9]{3,6}");
        }
        return new ProductId(value);
    }

    public String getValue() {
        return value;
    }

    @Override
    public int compareTo(ProductId other) {
        return value.compareTo(other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ProductId productId = (ProductId) o;
        return Objects.equals(value, productId.value);
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
