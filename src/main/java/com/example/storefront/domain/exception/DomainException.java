package com.example.storefront.domain.exception;

/**
 * Base class for business rule violations raised by the domain and the order workflow.
 * A DomainException never leaves partially applied state behind.
 */
public class DomainException extends RuntimeException {

    public DomainException(String message) {
        super(message);
    }

    public DomainException(String message, Throwable cause) {
        super(message, cause);
    }
}
