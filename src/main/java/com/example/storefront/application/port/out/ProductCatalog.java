package com.example.storefront.application.port.out;

import com.example.storefront.domain.model.Category;
import com.example.storefront.domain.model.Product;
import com.example.storefront.domain.model.ProductId;

import java.util.List;
import java.util.Optional;

/**
 * Outbound port for catalog data: products and their categories.
 */
public interface ProductCatalog {

    /**
     * Stores the product unless one with the same id is already present.
     *
     * @return true if stored, false if the id was taken
     */
    boolean saveIfAbsent(Product product);

    Optional<Product> findById(ProductId productId);

    List<Product> findAll();

    Category saveCategory(Category category);

    Optional<Category> findCategory(String categoryId);
}
