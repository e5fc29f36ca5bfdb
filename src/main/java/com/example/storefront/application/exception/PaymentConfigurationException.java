package com.example.storefront.application.exception;

import com.example.storefront.domain.model.PaymentMethod;

/**
 * No processor is registered for the requested payment method. This is a deployment
 * problem, not a declined payment, and retrying will not help.
 */
public class PaymentConfigurationException extends RuntimeException {

    private final PaymentMethod method;

    public PaymentConfigurationException(PaymentMethod method) {
        super("No payment processor registered for method " + method);
        this.method = method;
    }

    public PaymentMethod getMethod() {
        return method;
    }
}
