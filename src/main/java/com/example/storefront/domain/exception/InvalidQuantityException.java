package com.example.storefront.domain.exception;

/**
 * Caller supplied a quantity the operation does not accept (negative, or zero where
 * a positive amount is required).
 */
public class InvalidQuantityException extends DomainException {

    private final int quantity;

    public InvalidQuantityException(int quantity, String rule) {
        super("Invalid quantity " + quantity + ": " + rule);
        this.quantity = quantity;
    }

    public int getQuantity() {
        return quantity;
    }
}
