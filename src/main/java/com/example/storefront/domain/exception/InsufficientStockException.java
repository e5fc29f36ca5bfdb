package com.example.storefront.domain.exception;

import com.example.storefront.domain.model.ProductId;

/**
 * Exception thrown when there is insufficient stock for a product.
 */
public class InsufficientStockException extends DomainException {

    private final ProductId productId;
    private final int requestedQuantity;
    private final int availableQuantity;

    public InsufficientStockException(ProductId productId, int requestedQuantity, int availableQuantity) {
        super(String.format("Insufficient stock for product %s: requested %d, available %d",
                productId, requestedQuantity, availableQuantity));
        this.productId = productId;
        this.requestedQuantity = requestedQuantity;
        this.availableQuantity = availableQuantity;
    }

    public ProductId getProductId() {
        return productId;
    }

    public int getRequestedQuantity() {
        return requestedQuantity;
    }

    public int getAvailableQuantity() {
        return availableQuantity;
    }
}
