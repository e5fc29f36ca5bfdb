package com.example.storefront.infrastructure.config;

import com.example.storefront.application.service.PaymentGateway;
import com.example.storefront.domain.model.PaymentMethod;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Configuration;

/**
 * Logs what the payment circuit breakers do, per payment method. Breakers that guard no
 * payment method are left alone. Breakers created lazily on the first payment of a
 * method are picked up when the registry adds them.
 */
@Configuration
public class Resilience4jEventConfig {

    private static final Logger log = LoggerFactory.getLogger(Resilience4jEventConfig.class);

    private final CircuitBreakerRegistry circuitBreakerRegistry;

    public Resilience4jEventConfig(CircuitBreakerRegistry circuitBreakerRegistry) {
        this.circuitBreakerRegistry = circuitBreakerRegistry;
    }

    @PostConstruct
    public void registerEventListeners() {
        circuitBreakerRegistry.getAllCircuitBreakers().forEach(this::watch);
        circuitBreakerRegistry.getEventPublisher()
                .onEntryAdded(event -> watch(event.getAddedEntry()));
    }

    private void watch(CircuitBreaker circuitBreaker) {
        PaymentGateway.methodOfCircuitBreaker(circuitBreaker.getName())
                .ifPresent(method -> listen(method, circuitBreaker));
    }

    private void listen(PaymentMethod method, CircuitBreaker circuitBreaker) {
        log.debug("[PAYMENT_CB] watching {} for {}", circuitBreaker.getName(), method);
        circuitBreaker.getEventPublisher()
                .onStateTransition(event -> {
                    CircuitBreaker.State to = event.getStateTransition().getToState();
                    if (to == CircuitBreaker.State.OPEN || to == CircuitBreaker.State.FORCED_OPEN) {
                        log.warn("[PAYMENT_CB] {} payments suspended: {} -> {}",
                                method, event.getStateTransition().getFromState(), to);
                    } else {
                        log.info("[PAYMENT_CB] {} payments {}: {} -> {}",
                                method, to == CircuitBreaker.State.CLOSED ? "resumed" : "on trial",
                                event.getStateTransition().getFromState(), to);
                    }
                })
                .onError(event -> log.warn("[PAYMENT_CB] {} processor failure after {}ms: {}",
                        method, event.getElapsedDuration().toMillis(), event.getThrowable().getMessage()))
                .onFailureRateExceeded(event -> log.warn("[PAYMENT_CB] {} failure rate at {}%",
                        method, event.getFailureRate()))
                .onCallNotPermitted(event -> log.info("[PAYMENT_CB] {} payment refused while breaker is open",
                        method));
    }
}
