package com.example.storefront.application.service;

import com.example.storefront.application.exception.PaymentConfigurationException;
import com.example.storefront.application.exception.ServiceUnavailableException;
import com.example.storefront.application.port.out.PaymentProcessor;
import com.example.storefront.application.port.out.PaymentProcessor.ChargeResult;
import com.example.storefront.application.port.out.PaymentProcessor.RefundResult;
import com.example.storefront.domain.model.Money;
import com.example.storefront.domain.model.PaymentInfo;
import com.example.storefront.domain.model.PaymentMethod;
import com.example.storefront.domain.model.Receipt;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Dispatches charges and refunds to the processor registered for each payment method.
 * Every call goes through a per-method circuit breaker; an unreachable processor or an
 * open breaker is reported as a failed result. Nothing is retried here.
 */
@Service
public class PaymentGateway {

    private static final Logger log = LoggerFactory.getLogger(PaymentGateway.class);

    private final Map<PaymentMethod, PaymentProcessor> processors = new EnumMap<>(PaymentMethod.class);
    private final CircuitBreakerRegistry circuitBreakerRegistry;

    public PaymentGateway(List<PaymentProcessor> processors, CircuitBreakerRegistry circuitBreakerRegistry) {
        this.circuitBreakerRegistry = circuitBreakerRegistry;
        for (PaymentProcessor processor : processors) {
            PaymentProcessor previous = this.processors.putIfAbsent(processor.method(), processor);
            if (previous != null) {
                throw new IllegalStateException("Duplicate payment processor for " + processor.method() + ": "
                        + previous.getClass().getSimpleName() + ", " + processor.getClass().getSimpleName());
            }
        }
        log.info("Payment processors registered for {}", this.processors.keySet());
    }

    /**
     * @throws PaymentConfigurationException if no processor handles the method
     */
    public PaymentProcessor processorFor(PaymentMethod method) {
        Objects.requireNonNull(method, "Payment method cannot be null");
        PaymentProcessor processor = processors.get(method);
        if (processor == null) {
            throw new PaymentConfigurationException(method);
        }
        return processor;
    }

    public boolean supports(PaymentMethod method) {
        return processors.containsKey(method);
    }

    /**
     * Charges {@code amount} with the processor of {@code method}.
     *
     * @return the processor's result, or a declined result if it could not be reached
     * @throws PaymentConfigurationException if no processor handles the method
     */
    public ChargeResult charge(PaymentMethod method, Money amount, PaymentInfo info) {
        PaymentProcessor processor = processorFor(method);
        CircuitBreaker circuitBreaker = circuitBreakerFor(method);
        try {
            return circuitBreaker.executeSupplier(() -> processor.charge(amount, info));
        } catch (CallNotPermittedException e) {
            log.warn("Circuit breaker {} is OPEN, charge of {} rejected", circuitBreaker.getName(), amount);
            return ChargeResult.declined(method + " processor temporarily unavailable");
        } catch (ServiceUnavailableException e) {
            log.warn("{} processor unreachable ({}): {}", method, e.getServiceName(), e.getMessage());
            return ChargeResult.declined(e.getMessage());
        }
    }

    /**
     * Refunds a settled charge with the processor that took it.
     *
     * @throws PaymentConfigurationException if no processor handles the method
     */
    public RefundResult refund(PaymentMethod method, Receipt receipt, PaymentInfo info) {
        PaymentProcessor processor = processorFor(method);
        CircuitBreaker circuitBreaker = circuitBreakerFor(method);
        try {
            return circuitBreaker.executeSupplier(() -> processor.refund(receipt, info));
        } catch (CallNotPermittedException e) {
            log.warn("Circuit breaker {} is OPEN, refund of {} rejected",
                    circuitBreaker.getName(), receipt.transactionId());
            return RefundResult.failure(method + " processor temporarily unavailable");
        } catch (ServiceUnavailableException e) {
            log.warn("{} refund processor unreachable ({}): {}", method, e.getServiceName(), e.getMessage());
            return RefundResult.failure(e.getMessage());
        }
    }

    private CircuitBreaker circuitBreakerFor(PaymentMethod method) {
        return circuitBreakerRegistry.circuitBreaker(circuitBreakerName(method));
    }

    /**
     * Breaker instance name for a method, e.g. {@code payment-net-banking}.
     */
    public static String circuitBreakerName(PaymentMethod method) {
        return "payment-" + method.name().toLowerCase().replace('_', '-');
    }

    /**
     * Inverse of {@link #circuitBreakerName}; empty for breakers that guard no payment method.
     */
    public static Optional<PaymentMethod> methodOfCircuitBreaker(String name) {
        return Arrays.stream(PaymentMethod.values())
                .filter(method -> circuitBreakerName(method).equals(name))
                .findFirst();
    }
}
