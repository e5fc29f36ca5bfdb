package com.example.storefront.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Method-specific payment details (card number, wallet id, bank account...).
 * Values never appear in {@link #toString()}.
 */
public final class PaymentInfo {

    private final Map<String, String> fields;

    private PaymentInfo(Map<String, String> fields) {
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public static PaymentInfo of(Map<String, String> fields) {
        Objects.requireNonNull(fields, "Payment fields cannot be null");
        return new PaymentInfo(fields);
    }

    public static PaymentInfo of(String key, String value) {
        return new PaymentInfo(Map.of(key, value));
    }

    public static PaymentInfo of(String key1, String value1, String key2, String value2) {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put(key1, value1);
        fields.put(key2, value2);
        return new PaymentInfo(fields);
    }

    public static PaymentInfo empty() {
        return new PaymentInfo(Map.of());
    }

    public Optional<String> get(String key) {
        return Optional.ofNullable(fields.get(key)).map(String::trim).filter(v -> !v.isEmpty());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PaymentInfo that = (PaymentInfo) o;
        return Objects.equals(fields, that.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fields);
    }

    @Override
    public String toString() {
        return "PaymentInfo{fields=" + fields.keySet() + '}';
    }
}
