package com.example.storefront.application.service;

import com.example.storefront.application.port.in.CatalogUseCase;
import com.example.storefront.application.port.out.ProductCatalog;
import com.example.storefront.domain.exception.InvalidQuantityException;
import com.example.storefront.domain.exception.ProductNotFoundException;
import com.example.storefront.domain.model.Category;
import com.example.storefront.domain.model.Money;
import com.example.storefront.domain.model.Product;
import com.example.storefront.domain.model.ProductId;
import com.example.storefront.domain.model.Review;
import com.example.storefront.domain.model.UserId;
import com.example.storefront.domain.service.StockLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Catalog maintenance: categories, products, prices, restocking and reviews.
 */
@Service
public class CatalogService implements CatalogUseCase {

    private static final Logger log = LoggerFactory.getLogger(CatalogService.class);

    private final ProductCatalog productCatalog;
    private final StockLedger stockLedger;

    public CatalogService(ProductCatalog productCatalog, StockLedger stockLedger) {
        this.productCatalog = productCatalog;
        this.stockLedger = stockLedger;
    }

    @Override
    public Category registerCategory(String name, String description, String parentCategoryId) {
        Category category = parentCategoryId == null
                ? Category.root(name, description)
                : Category.childOf(requireCategory(parentCategoryId), name, description);
        productCatalog.saveCategory(category);
        log.info("Category registered: {}", category.fullPath());
        return category;
    }

    @Override
    public Product registerProduct(ProductId productId, String name, String description, Money price,
                                   String categoryId, int initialStock) {
        if (initialStock < 0) {
            throw new InvalidQuantityException(initialStock, "initial stock cannot be negative");
        }
        Category category = categoryId == null ? null : requireCategory(categoryId);
        Product product = Product.of(productId, name, description, price, category);
        if (!productCatalog.saveIfAbsent(product)) {
            throw new IllegalArgumentException("Product already registered: " + productId);
        }
        if (initialStock > 0) {
            stockLedger.receive(productId, initialStock);
        }
        log.info("Product registered: {} '{}' at {}, initial stock {}", productId, name, price, initialStock);
        return product;
    }

    @Override
    public int restock(ProductId productId, int quantity) {
        getProduct(productId);
        int available = stockLedger.receive(productId, quantity);
        log.info("Restocked {} with {} units, available {}", productId, quantity, available);
        return available;
    }

    @Override
    public Product changePrice(ProductId productId, Money price) {
        Product product = getProduct(productId);
        Money previous = product.getPrice();
        product.changePrice(price);
        log.info("Price of {} changed from {} to {}", productId, previous, price);
        return product;
    }

    @Override
    public Product deactivate(ProductId productId) {
        Product product = getProduct(productId);
        product.deactivate();
        log.info("Product {} deactivated", productId);
        return product;
    }

    @Override
    public Product addSpecification(ProductId productId, String key, String value) {
        Product product = getProduct(productId);
        product.addSpecification(key, value);
        return product;
    }

    @Override
    public Review addReview(ProductId productId, UserId userId, int rating, String comment) {
        Product product = getProduct(productId);
        Review review = Review.of(userId, rating, comment);
        product.addReview(review);
        log.info("Review of {} by {}: {} stars", productId, userId, review.rating());
        return review;
    }

    @Override
    public Product getProduct(ProductId productId) {
        return productCatalog.findById(productId)
                .orElseThrow(() -> new ProductNotFoundException(productId));
    }

    @Override
    public List<Product> search(String query, String categoryId) {
        Optional<Category> category = categoryId == null
                ? Optional.empty()
                : Optional.of(requireCategory(categoryId));
        String needle = query == null ? "" : query.trim();

        return productCatalog.findAll().stream()
                .filter(Product::isActive)
                .filter(product -> needle.isEmpty() || product.matches(needle))
                .filter(product -> category.isEmpty() || product.getCategory()
                        .map(c -> c.isWithin(category.get()))
                        .orElse(false))
                .toList();
    }

    @Override
    public int availableQuantity(ProductId productId) {
        return stockLedger.availableQuantity(productId);
    }

    private Category requireCategory(String categoryId) {
        return productCatalog.findCategory(categoryId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown category: " + categoryId));
    }
}
