package com.example.storefront.domain.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A customer's rating of a product, from 1 to 5 stars.
 */
public record Review(
        UserId userId,
        int rating,
        String comment,
        Instant createdAt
) {
    public static final int MIN_RATING = 1;
    public static final int MAX_RATING = 5;

    public Review {
        Objects.requireNonNull(userId, "UserId cannot be null");
        Objects.requireNonNull(createdAt, "CreatedAt cannot be null");
        rating = Math.min(Math.max(rating, MIN_RATING), MAX_RATING);
        comment = comment == null ? "" : comment.trim();
    }

    /**
     * Creates a review stamped now. Out-of-range ratings are clamped to 1..5.
     */
    public static Review of(UserId userId, int rating, String comment) {
        return new Review(userId, rating, comment, Instant.now());
    }
}
