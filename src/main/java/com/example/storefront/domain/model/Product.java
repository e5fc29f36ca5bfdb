package com.example.storefront.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Catalog entry. Available stock is not held here: the
 * {@link com.example.storefront.domain.service.StockLedger} owns it.
 */
public final class Product {

    private final ProductId productId;
    private final String name;
    private final String description;
    private final Category category;
    private final Map<String, String> specifications = new LinkedHashMap<>();
    private final List<Review> reviews = new ArrayList<>();
    private volatile Money price;
    private volatile boolean active = true;

    private Product(ProductId productId, String name, String description, Money price, Category category) {
        this.productId = Objects.requireNonNull(productId, "ProductId cannot be null");
        this.name = Objects.requireNonNull(name, "Product name cannot be null");
        this.description = description == null ? "" : description;
        this.price = Objects.requireNonNull(price, "Price cannot be null");
        this.category = category;
        if (name.isBlank()) {
            throw new IllegalArgumentException("Product name cannot be blank");
        }
    }

    /**
     * Creates a new active product.
     *
     * @param productId   the product id
     * @param name        display name
     * @param description free text, searched together with the name
     * @param price       current unit price
     * @param category    owning category, may be null
     * @return new Product instance
     */
    public static Product of(ProductId productId, String name, String description, Money price, Category category) {
        return new Product(productId, name, description, price, category);
    }

    public void changePrice(Money newPrice) {
        this.price = Objects.requireNonNull(newPrice, "Price cannot be null");
    }

    public void deactivate() {
        this.active = false;
    }

    public synchronized void addSpecification(String key, String value) {
        Objects.requireNonNull(key, "Specification key cannot be null");
        specifications.put(key, Objects.requireNonNull(value, "Specification value cannot be null"));
    }

    public synchronized void addReview(Review review) {
        reviews.add(Objects.requireNonNull(review, "Review cannot be null"));
    }

    /**
     * Mean rating over all reviews; empty while the product has none.
     */
    public synchronized OptionalDouble averageRating() {
        return reviews.stream().mapToInt(Review::rating).average();
    }

    /**
     * Case-insensitive substring match against name and description.
     */
    public boolean matches(String query) {
        String needle = query.toLowerCase();
        return name.toLowerCase().contains(needle) || description.toLowerCase().contains(needle);
    }

    public ProductId getProductId() {
        return productId;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public Money getPrice() {
        return price;
    }

    public Optional<Category> getCategory() {
        return Optional.ofNullable(category);
    }

    public boolean isActive() {
        return active;
    }

    public synchronized Map<String, String> getSpecifications() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(specifications));
    }

    public synchronized List<Review> getReviews() {
        return List.copyOf(reviews);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Product product = (Product) o;
        return Objects.equals(productId, product.productId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(productId);
    }

    @Override
    public String toString() {
        return "Product{" +
                "productId=" + productId +
                ", name='" + name + '\'' +
                ", price=" + price +
                ", active=" + active +
                '}';
    }
}
