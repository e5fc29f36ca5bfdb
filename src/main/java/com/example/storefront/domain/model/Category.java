package com.example.storefront.domain.model;

import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Node of the catalog category tree.
 */
public final class Category {

    private final String id;
    private final String name;
    private final String description;
    private final Category parent;

    private Category(String id, String name, String description, Category parent) {
        this.id = Objects.requireNonNull(id, "Category id cannot be null");
        this.name = Objects.requireNonNull(name, "Category name cannot be null");
        this.description = description == null ? "" : description;
        this.parent = parent;
        if (name.isBlank()) {
            throw new IllegalArgumentException("Category name cannot be blank");
        }
    }

    public static Category root(String name, String description) {
        return new Category(UUID.randomUUID().toString(), name, description, null);
    }

    public static Category childOf(Category parent, String name, String description) {
        Objects.requireNonNull(parent, "Parent category cannot be null");
        return new Category(UUID.randomUUID().toString(), name, description, parent);
    }

    /**
     * Renders the path from the root, e.g. {@code Electronics > Phones}.
     */
    public String fullPath() {
        return parent == null ? name : parent.fullPath() + " > " + name;
    }

    /**
     * True if this category is {@code other} or lies underneath it.
     */
    public boolean isWithin(Category other) {
        for (Category current = this; current != null; current = current.parent) {
            if (current.equals(other)) {
                return true;
            }
        }
        return false;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public Optional<Category> getParent() {
        return Optional.ofNullable(parent);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Category category = (Category) o;
        return Objects.equals(id, category.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return fullPath();
    }
}
