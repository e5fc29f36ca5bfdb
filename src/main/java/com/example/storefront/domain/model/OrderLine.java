package com.example.storefront.domain.model;

import java.util.Objects;

/**
 * Frozen copy of a purchased product line. Price and quantity are captured at order
 * creation and never follow later catalog changes.
 */
public final class OrderLine {

    private final ProductId productId;
    private final String productName;
    private final int quantity;
    private final Money unitPrice;

    private OrderLine(ProductId productId, String productName, int quantity, Money unitPrice) {
        this.productId = Objects.requireNonNull(productId, "ProductId cannot be null");
        this.productName = Objects.requireNonNull(productName, "ProductName cannot be null");
        this.unitPrice = Objects.requireNonNull(unitPrice, "UnitPrice cannot be null");
        if (quantity <= 0) {
            throw new IllegalArgumentException("Quantity must be positive: " + quantity);
        }
        this.quantity = quantity;
    }

    /**
     * Creates a new OrderLine.
     *
     * @param productId   the purchased product
     * @param productName product name at purchase time
     * @param quantity    the quantity (must be positive)
     * @param unitPrice   the unit price at purchase time
     * @return new OrderLine instance
     */
    public static OrderLine of(ProductId productId, String productName, int quantity, Money unitPrice) {
        return new OrderLine(productId, productName, quantity, unitPrice);
    }

    /**
     * Calculates the subtotal for this line (quantity * unitPrice).
     *
     * @return the subtotal as Money
     */
    public Money getSubtotal() {
        return unitPrice.multiply(quantity);
    }

    public ProductId getProductId() {
        return productId;
    }

    public String getProductName() {
        return productName;
    }

    public int getQuantity() {
        return quantity;
    }

    public Money getUnitPrice() {
        return unitPrice;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        OrderLine orderLine = (OrderLine) o;
        return quantity == orderLine.quantity &&
                Objects.equals(productId, orderLine.productId) &&
                Objects.equals(unitPrice, orderLine.unitPrice);
    }

    @Override
    public int hashCode() {
        return Objects.hash(productId, quantity, unitPrice);
    }

    @Override
    public String toString() {
        return "OrderLine{" +
                "productId=" + productId +
                ", quantity=" + quantity +
                ", unitPrice=" + unitPrice +
                '}';
    }
}
