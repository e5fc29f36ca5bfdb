package com.example.storefront.domain.exception;

import com.example.storefront.domain.model.ProductId;

/**
 * Product is unknown to the catalog, or no longer sold.
 */
public class ProductNotFoundException extends DomainException {

    private final ProductId productId;

    public ProductNotFoundException(ProductId productId) {
        super("Product not found or inactive: " + productId);
        this.productId = productId;
    }

    public ProductId getProductId() {
        return productId;
    }
}
