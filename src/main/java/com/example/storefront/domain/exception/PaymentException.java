package com.example.storefront.domain.exception;

import com.example.storefront.domain.model.PaymentMethod;

/**
 * A payment processor declined or could not complete an operation.
 */
public class PaymentException extends DomainException {

    private final PaymentMethod method;
    private final String reason;

    public PaymentException(PaymentMethod method, String reason) {
        super("Payment via " + method + " failed: " + reason);
        this.method = method;
        this.reason = reason;
    }

    public PaymentMethod getMethod() {
        return method;
    }

    public String getReason() {
        return reason;
    }
}
