package com.example.storefront.infrastructure.persistence;

import com.example.storefront.application.port.out.ProductCatalog;
import com.example.storefront.domain.model.Category;
import com.example.storefront.domain.model.Product;
import com.example.storefront.domain.model.ProductId;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Product and category registry kept in process memory.
 */
@Repository
public class InMemoryProductCatalog implements ProductCatalog {

    private final ConcurrentMap<ProductId, Product> products = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Category> categories = new ConcurrentHashMap<>();

    @Override
    public boolean saveIfAbsent(Product product) {
        Objects.requireNonNull(product, "Product cannot be null");
        return products.putIfAbsent(product.getProductId(), product) == null;
    }

    @Override
    public Optional<Product> findById(ProductId productId) {
        return Optional.ofNullable(products.get(productId));
    }

    /**
     * All products, ordered by id.
     */
    @Override
    public List<Product> findAll() {
        return products.values().stream()
                .sorted(Comparator.comparing(Product::getProductId))
                .toList();
    }

    @Override
    public Category saveCategory(Category category) {
        Objects.requireNonNull(category, "Category cannot be null");
        categories.put(category.getId(), category);
        return category;
    }

    @Override
    public Optional<Category> findCategory(String categoryId) {
        return Optional.ofNullable(categories.get(categoryId));
    }
}
