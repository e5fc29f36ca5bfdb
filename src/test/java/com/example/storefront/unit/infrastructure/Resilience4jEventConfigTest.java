package com.example.storefront.unit.infrastructure;

import com.example.storefront.application.service.PaymentGateway;
import com.example.storefront.domain.model.PaymentMethod;
import com.example.storefront.infrastructure.config.Resilience4jEventConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Resilience4jEventConfig Tests")
@ExtendWith(OutputCaptureExtension.class)
class Resilience4jEventConfigTest {

    private CircuitBreakerRegistry registry;

    @BeforeEach
    void setUp() {
        registry = CircuitBreakerRegistry.ofDefaults();
        new Resilience4jEventConfig(registry).registerEventListeners();
    }

    @Test
    @DisplayName("should_log_suspension_of_payment_method_when_breaker_opens")
    void should_log_suspension_of_payment_method_when_breaker_opens(CapturedOutput output) {
        // Given: created after registration, as on the first payment of a method
        CircuitBreaker breaker = registry.circuitBreaker(PaymentGateway.circuitBreakerName(PaymentMethod.WALLET));

        // When
        breaker.transitionToOpenState();

        // Then
        assertThat(output).contains("[PAYMENT_CB] WALLET payments suspended: CLOSED -> OPEN");
    }

    @Test
    @DisplayName("should_ignore_breakers_of_other_services")
    void should_ignore_breakers_of_other_services(CapturedOutput output) {
        // When
        registry.circuitBreaker("inventory").transitionToOpenState();

        // Then
        assertThat(output).doesNotContain("[PAYMENT_CB]");
    }
}
