package com.example.storefront.domain.exception;

import com.example.storefront.domain.model.UserId;

/**
 * Exception thrown when checking out a cart without lines.
 */
public class EmptyCartException extends DomainException {

    private final UserId userId;

    public EmptyCartException(UserId userId) {
        super("Cart of user " + userId + " is empty");
        this.userId = userId;
    }

    public UserId getUserId() {
        return userId;
    }
}
