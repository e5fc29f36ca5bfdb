package com.example.storefront.support;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import static com.github.tomakehurst.wiremock.client.WireMock.*;

/**
 * Base class for integration tests that talk to a WireMock bank gateway.
 */
@SpringBootTest
@ActiveProfiles("test")
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_CLASS)
public abstract class WireMockTestSupport {

    protected static final String CHARGE_PATH = "/api/netbanking/charge";
    protected static final String REFUND_PATH = "/api/netbanking/refund";

    // Started at class loading time, before @DynamicPropertySource is evaluated
    protected static WireMockServer bankServer;

    static {
        bankServer = new WireMockServer(WireMockConfiguration.options().dynamicPort());
        bankServer.start();
        Runtime.getRuntime().addShutdownHook(new Thread(() -> bankServer.stop()));
    }

    @Autowired(required = false)
    private CircuitBreakerRegistry circuitBreakerRegistry;

    @BeforeEach
    void resetStateBeforeTest() {
        bankServer.resetAll();
        if (circuitBreakerRegistry != null) {
            circuitBreakerRegistry.getAllCircuitBreakers()
                    .forEach(cb -> cb.reset());
        }
    }

    @AfterEach
    void resetWireMockServer() {
        bankServer.resetAll();
    }

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("storefront.net-banking.base-url", () -> bankServer.baseUrl());
    }

    // ==================== Bank Gateway Stubs ====================

    /**
     * Stubs the bank to approve charges with the given transaction id.
     */
    protected void stubChargeApproved(String transactionId) {
        bankServer.stubFor(post(urlEqualTo(CHARGE_PATH))
                .willReturn(aResponse()
                        .withStatus(200)
                        .withHeader("Content-Type", "application/json")
                        .withBody("""
                                {
                                    "transactionId": "%s",
                                    "status": "SUCCESS",
                                    "message": "Charge approved"
                                }
                                """.formatted(transactionId))));
    }

    /**
     * Stubs the bank to answer 200 with a declined body.
     */
    protected void stubChargeDeclinedInBody(String message) {
        bankServer.stubFor(post(urlEqualTo(CHARGE_PATH))
                .willReturn(aResponse()
                        .withStatus(200)
                        .withHeader("Content-Type", "application/json")
                        .withBody("""
                                {
                                    "transactionId": null,
                                    "status": "DECLINED",
                                    "message": "%s"
                                }
                                """.formatted(message))));
    }

    /**
     * Stubs the bank to reject charges with 402.
     */
    protected void stubChargeRejected() {
        bankServer.stubFor(post(urlEqualTo(CHARGE_PATH))
                .willReturn(aResponse()
                        .withStatus(402)
                        .withHeader("Content-Type", "application/json")
                        .withBody("""
                                {
                                    "code": "INSUFFICIENT_FUNDS",
                                    "message": "Account balance too low"
                                }
                                """)));
    }

    /**
     * Stubs the bank to always fail with 503.
     */
    protected void stubChargeUnavailable() {
        bankServer.stubFor(post(urlEqualTo(CHARGE_PATH))
                .willReturn(aResponse()
                        .withStatus(503)
                        .withHeader("Content-Type", "application/json")
                        .withBody("""
                                {
                                    "code": "SERVICE_UNAVAILABLE",
                                    "message": "Bank gateway unavailable"
                                }
                                """)));
    }

    /**
     * Stubs the bank to answer 200 with a body that is not JSON.
     */
    protected void stubChargeMalformedBody() {
        bankServer.stubFor(post(urlEqualTo(CHARGE_PATH))
                .willReturn(aResponse()
                        .withStatus(200)
                        .withHeader("Content-Type", "application/json")
                        .withBody("<html>gateway maintenance</html>")));
    }

    /**
     * Stubs the bank to approve charges after a delay (for timeout testing).
     */
    protected void stubChargeWithDelay(String transactionId, int delayMs) {
        bankServer.stubFor(post(urlEqualTo(CHARGE_PATH))
                .willReturn(aResponse()
                        .withStatus(200)
                        .withFixedDelay(delayMs)
                        .withHeader("Content-Type", "application/json")
                        .withBody("""
                                {
                                    "transactionId": "%s",
                                    "status": "SUCCESS",
                                    "message": "Charge approved"
                                }
                                """.formatted(transactionId))));
    }

    /**
     * Stubs the bank to approve refunds.
     */
    protected void stubRefundApproved(String refundId) {
        bankServer.stubFor(post(urlEqualTo(REFUND_PATH))
                .willReturn(aResponse()
                        .withStatus(200)
                        .withHeader("Content-Type", "application/json")
                        .withBody("""
                                {
                                    "transactionId": "%s",
                                    "status": "SUCCESS",
                                    "message": "Refund accepted"
                                }
                                """.formatted(refundId))));
    }

    // ==================== Verification Helpers ====================

    protected void verifyChargeCalledTimes(int count) {
        bankServer.verify(count, postRequestedFor(urlEqualTo(CHARGE_PATH)));
    }

    protected void verifyRefundCalledTimes(int count) {
        bankServer.verify(count, postRequestedFor(urlEqualTo(REFUND_PATH)));
    }
}
