package com.example.storefront.unit.application;

import com.example.storefront.application.dto.CartSnapshot;
import com.example.storefront.application.dto.PaymentOutcome;
import com.example.storefront.application.exception.PaymentConfigurationException;
import com.example.storefront.application.port.out.OrderStore;
import com.example.storefront.application.service.CartService;
import com.example.storefront.application.service.CatalogService;
import com.example.storefront.application.service.OrderWorkflowService;
import com.example.storefront.application.service.PaymentGateway;
import com.example.storefront.domain.exception.EmptyCartException;
import com.example.storefront.domain.exception.InsufficientStockException;
import com.example.storefront.domain.exception.InvalidTransitionException;
import com.example.storefront.domain.exception.OrderNotFoundException;
import com.example.storefront.domain.exception.ProductNotFoundException;
import com.example.storefront.domain.model.*;
import com.example.storefront.domain.service.StockLedger;
import com.example.storefront.infrastructure.adapter.out.payment.CreditCardProcessor;
import com.example.storefront.infrastructure.adapter.out.payment.WalletProcessor;
import com.example.storefront.infrastructure.persistence.InMemoryCartStore;
import com.example.storefront.infrastructure.persistence.InMemoryOrderStore;
import com.example.storefront.infrastructure.persistence.InMemoryProductCatalog;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Order lifecycle tests running against the in-memory adapters.
 */
@DisplayName("OrderWorkflowService Tests")
class OrderWorkflowServiceTest {

    private static final ProductId LAPTOP = ProductId.of("PRD001");
    private static final ProductId MOUSE = ProductId.of("PRD002");
    private static final UserId ALICE = UserId.of("alice");
    private static final UserId BOB = UserId.of("bob");
    private static final ShippingAddress ADDRESS =
            new ShippingAddress("1 Main St", "Springfield", "IL", "62701", "US");
    private static final PaymentInfo VALID_CARD = PaymentInfo.of("card_number", "4111111111111111");

    private StockLedger ledger;
    private InMemoryProductCatalog catalog;
    private InMemoryCartStore cartStore;
    private InMemoryOrderStore orderStore;
    private WalletProcessor walletProcessor;
    private CatalogService catalogService;
    private CartService cartService;
    private OrderWorkflowService workflow;

    @BeforeEach
    void setUp() {
        ledger = new StockLedger();
        catalog = new InMemoryProductCatalog();
        cartStore = new InMemoryCartStore();
        orderStore = new InMemoryOrderStore();
        walletProcessor = new WalletProcessor();
        PaymentGateway gateway = new PaymentGateway(
                List.of(new CreditCardProcessor(), walletProcessor), CircuitBreakerRegistry.ofDefaults());

        catalogService = new CatalogService(catalog, ledger);
        cartService = new CartService(cartStore, catalog, ledger);
        workflow = new OrderWorkflowService(ledger, catalog, cartStore, orderStore, gateway);

        catalogService.registerProduct(LAPTOP, "Laptop", "14 inch", Money.of("1000.00"), null, 5);
        catalogService.registerProduct(MOUSE, "Mouse", "Wireless", Money.of("25.00"), null, 10);
    }

    @Nested
    @DisplayName("Order Creation")
    class OrderCreation {

        @Test
        @DisplayName("should_reserve_stock_and_clear_cart_on_checkout")
        void should_reserve_stock_and_clear_cart_on_checkout() {
            // Given
            cartService.addItem(ALICE, LAPTOP, 2);
            cartService.addItem(ALICE, MOUSE, 1);

            // When
            Order order = workflow.checkout(ALICE, ADDRESS);

            // Then
            assertThat(order.getStatus()).isEqualTo(OrderStatus.PENDING);
            assertThat(order.getTotal()).isEqualTo(Money.of("2025.00"));
            assertThat(ledger.availableQuantity(LAPTOP)).isEqualTo(3);
            assertThat(ledger.availableQuantity(MOUSE)).isEqualTo(9);
            assertThat(cartService.getLines(ALICE)).isEmpty();
            assertThat(workflow.getOrdersForUser(ALICE)).containsExactly(order);
        }

        @Test
        @DisplayName("should_freeze_prices_at_creation")
        void should_freeze_prices_at_creation() {
            // Given
            cartService.addItem(ALICE, LAPTOP, 1);
            Order order = workflow.checkout(ALICE, ADDRESS);

            // When
            catalogService.changePrice(LAPTOP, Money.of("1200.00"));

            // Then
            assertThat(workflow.getOrder(order.getOrderId()).getTotal()).isEqualTo(Money.of("1000.00"));
            assertThat(order.getLines().get(0).getProductName()).isEqualTo("Laptop");
        }

        @Test
        @DisplayName("should_reject_empty_cart")
        void should_reject_empty_cart() {
            assertThatThrownBy(() -> workflow.checkout(ALICE, ADDRESS))
                    .isInstanceOf(EmptyCartException.class);
            assertThatThrownBy(() -> workflow.createOrder(new CartSnapshot(ALICE, List.of()), ADDRESS))
                    .isInstanceOf(EmptyCartException.class);
            assertThat(orderStore.findAll()).isEmpty();
        }

        @Test
        @DisplayName("should_create_nothing_when_any_line_is_short")
        void should_create_nothing_when_any_line_is_short() {
            // Given: cart is valid when built, then stock drops underneath it
            cartService.addItem(ALICE, LAPTOP, 2);
            cartService.addItem(ALICE, MOUSE, 8);
            ledger.reserve(MOUSE, 5);

            // When & Then
            assertThatThrownBy(() -> workflow.checkout(ALICE, ADDRESS))
                    .isInstanceOf(InsufficientStockException.class)
                    .satisfies(ex -> {
                        InsufficientStockException e = (InsufficientStockException) ex;
                        assertThat(e.getProductId()).isEqualTo(MOUSE);
                        assertThat(e.getRequestedQuantity()).isEqualTo(8);
                        assertThat(e.getAvailableQuantity()).isEqualTo(5);
                    });

            // And: the laptop reservation was rolled back, cart kept, no order stored
            assertThat(ledger.availableQuantity(LAPTOP)).isEqualTo(5);
            assertThat(ledger.availableQuantity(MOUSE)).isEqualTo(5);
            assertThat(cartService.getLines(ALICE)).hasSize(2);
            assertThat(orderStore.findAll()).isEmpty();
        }

        @Test
        @DisplayName("should_reject_inactive_product")
        void should_reject_inactive_product() {
            // Given
            cartService.addItem(ALICE, LAPTOP, 1);
            catalogService.deactivate(LAPTOP);

            // When & Then
            assertThatThrownBy(() -> workflow.checkout(ALICE, ADDRESS))
                    .isInstanceOf(ProductNotFoundException.class);
            assertThat(ledger.availableQuantity(LAPTOP)).isEqualTo(5);
        }

        @Test
        @DisplayName("should_release_reservations_when_store_fails")
        void should_release_reservations_when_store_fails() {
            // Given
            OrderStore failingStore = mock(OrderStore.class);
            when(failingStore.save(any())).thenThrow(new IllegalStateException("store down"));
            OrderWorkflowService failing = new OrderWorkflowService(ledger, catalog, cartStore, failingStore,
                    new PaymentGateway(List.of(), CircuitBreakerRegistry.ofDefaults()));
            CartSnapshot snapshot = new CartSnapshot(ALICE, List.of(new CartLine(LAPTOP, 3)));

            // When & Then
            assertThatThrownBy(() -> failing.createOrder(snapshot, ADDRESS))
                    .isInstanceOf(IllegalStateException.class);
            assertThat(ledger.availableQuantity(LAPTOP)).isEqualTo(5);
        }

        @Test
        @DisplayName("should_sell_last_unit_to_exactly_one_of_concurrent_buyers")
        void should_sell_last_unit_to_exactly_one_of_concurrent_buyers() throws Exception {
            // Given: one laptop left, two carts holding it
            ledger.reserve(LAPTOP, 4);
            cartService.addItem(ALICE, LAPTOP, 1);
            cartService.addItem(BOB, LAPTOP, 1);
            ExecutorService executor = Executors.newFixedThreadPool(2);
            CountDownLatch start = new CountDownLatch(1);

            // When
            List<Future<Order>> results = new ArrayList<>();
            for (UserId user : List.of(ALICE, BOB)) {
                Callable<Order> checkout = () -> {
                    start.await();
                    return workflow.checkout(user, ADDRESS);
                };
                results.add(executor.submit(checkout));
            }
            start.countDown();
            executor.shutdown();
            assertThat(executor.awaitTermination(5, TimeUnit.SECONDS)).isTrue();

            // Then
            int succeeded = 0;
            int rejected = 0;
            for (Future<Order> result : results) {
                try {
                    result.get();
                    succeeded++;
                } catch (java.util.concurrent.ExecutionException e) {
                    assertThat(e.getCause()).isInstanceOf(InsufficientStockException.class);
                    rejected++;
                }
            }
            assertThat(succeeded).isEqualTo(1);
            assertThat(rejected).isEqualTo(1);
            assertThat(ledger.availableQuantity(LAPTOP)).isZero();
        }
    }

    @Nested
    @DisplayName("Payment")
    class Payment {

        @Test
        @DisplayName("should_confirm_order_when_charge_succeeds")
        void should_confirm_order_when_charge_succeeds() {
            // Given
            Order order = orderOf(ALICE, LAPTOP, 2);

            // When
            PaymentOutcome outcome = workflow.pay(order.getOrderId(), PaymentMethod.CREDIT_CARD, VALID_CARD);

            // Then
            assertThat(outcome.succeeded()).isTrue();
            assertThat(outcome.receipt().amount()).isEqualTo(Money.of("2000.00"));
            assertThat(order.getStatus()).isEqualTo(OrderStatus.CONFIRMED);
            assertThat(order.getPaymentStatus()).isEqualTo(PaymentStatus.COMPLETED);
            assertThat(order.getReceipt()).contains(outcome.receipt());
        }

        @Test
        @DisplayName("should_keep_order_pending_and_stock_reserved_when_declined")
        void should_keep_order_pending_and_stock_reserved_when_declined() {
            // Given
            Order order = orderOf(ALICE, LAPTOP, 2);

            // When
            PaymentOutcome outcome = workflow.pay(order.getOrderId(), PaymentMethod.CREDIT_CARD,
                    PaymentInfo.of("card_number", "1234"));

            // Then
            assertThat(outcome.succeeded()).isFalse();
            assertThat(outcome.failureReason()).contains("card number");
            assertThat(order.getStatus()).isEqualTo(OrderStatus.PENDING);
            assertThat(order.getPaymentStatus()).isEqualTo(PaymentStatus.FAILED);
            assertThat(ledger.availableQuantity(LAPTOP)).isEqualTo(3);

            // And a retry with a valid card confirms it
            assertThat(workflow.pay(order.getOrderId(), PaymentMethod.CREDIT_CARD, VALID_CARD).succeeded())
                    .isTrue();
            assertThat(order.getStatus()).isEqualTo(OrderStatus.CONFIRMED);
        }

        @Test
        @DisplayName("should_charge_wallet_including_shipping_cost")
        void should_charge_wallet_including_shipping_cost() {
            // Given
            walletProcessor.topUp("w-1", Money.of("100.00"));
            Order order = orderOf(ALICE, MOUSE, 2);
            workflow.changeShippingCost(order.getOrderId(), Money.of("7.50"));

            // When
            PaymentOutcome outcome = workflow.pay(order.getOrderId(), PaymentMethod.WALLET,
                    PaymentInfo.of("wallet_id", "w-1"));

            // Then
            assertThat(outcome.succeeded()).isTrue();
            assertThat(walletProcessor.balance("w-1")).isEqualTo(Money.of("42.50"));
        }

        @Test
        @DisplayName("should_surface_unregistered_method_without_touching_order")
        void should_surface_unregistered_method_without_touching_order() {
            // Given
            Order order = orderOf(ALICE, LAPTOP, 1);

            // When & Then
            assertThatThrownBy(() -> workflow.pay(order.getOrderId(), PaymentMethod.NET_BANKING,
                    PaymentInfo.of("bank_code", "HDFC", "account_number", "123")))
                    .isInstanceOfSatisfying(PaymentConfigurationException.class,
                            e -> assertThat(e.getMethod()).isEqualTo(PaymentMethod.NET_BANKING));
            assertThat(order.getStatus()).isEqualTo(OrderStatus.PENDING);
            assertThat(order.getPaymentStatus()).isEqualTo(PaymentStatus.PENDING);
        }

        @Test
        @DisplayName("should_reject_payment_of_confirmed_order")
        void should_reject_payment_of_confirmed_order() {
            // Given
            Order order = paidOrderOf(ALICE, LAPTOP, 1);

            // When & Then
            assertThatThrownBy(() -> workflow.pay(order.getOrderId(), PaymentMethod.CREDIT_CARD, VALID_CARD))
                    .isInstanceOf(InvalidTransitionException.class);
        }
    }

    @Nested
    @DisplayName("Cancellation and Refund")
    class CancellationAndRefund {

        @Test
        @DisplayName("should_restore_stock_when_pending_order_is_cancelled")
        void should_restore_stock_when_pending_order_is_cancelled() {
            // Given
            Order order = orderOf(ALICE, LAPTOP, 3);
            workflow.pay(order.getOrderId(), PaymentMethod.CREDIT_CARD, PaymentInfo.empty());

            // When
            workflow.cancel(order.getOrderId());

            // Then
            assertThat(order.getStatus()).isEqualTo(OrderStatus.CANCELLED);
            assertThat(ledger.availableQuantity(LAPTOP)).isEqualTo(5);

            // And cancelling again changes nothing
            assertThatThrownBy(() -> workflow.cancel(order.getOrderId()))
                    .isInstanceOf(InvalidTransitionException.class);
            assertThat(ledger.availableQuantity(LAPTOP)).isEqualTo(5);
        }

        @Test
        @DisplayName("should_reject_payment_of_cancelled_order")
        void should_reject_payment_of_cancelled_order() {
            // Given
            Order order = orderOf(ALICE, LAPTOP, 2);
            workflow.cancel(order.getOrderId());
            assertThat(ledger.availableQuantity(LAPTOP)).isEqualTo(5);

            // When & Then
            assertThatThrownBy(() -> workflow.pay(order.getOrderId(), PaymentMethod.CREDIT_CARD, VALID_CARD))
                    .isInstanceOf(InvalidTransitionException.class);
            assertThat(order.getStatus()).isEqualTo(OrderStatus.CANCELLED);
            assertThat(order.getPaymentStatus()).isEqualTo(PaymentStatus.PENDING);
            assertThat(ledger.availableQuantity(LAPTOP)).isEqualTo(5);
        }

        @Test
        @DisplayName("should_restore_stock_exactly_once_across_refund_and_cancel")
        void should_restore_stock_exactly_once_across_refund_and_cancel() {
            // Given
            Order order = paidOrderOf(ALICE, LAPTOP, 2);

            // When
            workflow.refund(order.getOrderId());

            // Then
            assertThat(order.getPaymentStatus()).isEqualTo(PaymentStatus.REFUNDED);
            assertThat(order.getStatus()).isEqualTo(OrderStatus.CONFIRMED);
            assertThat(ledger.availableQuantity(LAPTOP)).isEqualTo(5);

            // And a later cancel does not release again
            workflow.cancel(order.getOrderId());
            assertThat(ledger.availableQuantity(LAPTOP)).isEqualTo(5);
            assertThatThrownBy(() -> workflow.refund(order.getOrderId()))
                    .isInstanceOf(InvalidTransitionException.class);
        }

        @Test
        @DisplayName("should_credit_wallet_on_refund")
        void should_credit_wallet_on_refund() {
            // Given
            walletProcessor.topUp("w-1", Money.of("100.00"));
            Order order = orderOf(ALICE, MOUSE, 2);
            workflow.pay(order.getOrderId(), PaymentMethod.WALLET, PaymentInfo.of("wallet_id", "w-1"));

            // When
            workflow.refund(order.getOrderId());

            // Then
            assertThat(walletProcessor.balance("w-1")).isEqualTo(Money.of("100.00"));
        }

        @Test
        @DisplayName("should_not_cancel_shipped_order")
        void should_not_cancel_shipped_order() {
            // Given
            Order order = paidOrderOf(ALICE, LAPTOP, 1);
            workflow.ship(order.getOrderId(), "TRK-42");

            // When & Then
            assertThatThrownBy(() -> workflow.cancel(order.getOrderId()))
                    .isInstanceOf(InvalidTransitionException.class);
            assertThat(ledger.availableQuantity(LAPTOP)).isEqualTo(4);
        }
    }

    @Nested
    @DisplayName("Fulfilment")
    class Fulfilment {

        @Test
        @DisplayName("should_ship_and_deliver_paid_order")
        void should_ship_and_deliver_paid_order() {
            // Given
            Order order = paidOrderOf(ALICE, LAPTOP, 1);

            // When
            workflow.ship(order.getOrderId(), "TRK-42");
            workflow.deliver(order.getOrderId());

            // Then
            assertThat(order.getStatus()).isEqualTo(OrderStatus.DELIVERED);
            assertThat(order.getTrackingNumber()).contains("TRK-42");
        }

        @Test
        @DisplayName("should_not_ship_unpaid_order")
        void should_not_ship_unpaid_order() {
            // Given
            Order order = orderOf(ALICE, LAPTOP, 1);

            // When & Then
            assertThatThrownBy(() -> workflow.ship(order.getOrderId(), "TRK-42"))
                    .isInstanceOf(InvalidTransitionException.class);
        }

        @Test
        @DisplayName("should_report_unknown_order")
        void should_report_unknown_order() {
            assertThatThrownBy(() -> workflow.getOrder(OrderId.generate()))
                    .isInstanceOf(OrderNotFoundException.class);
            assertThatThrownBy(() -> workflow.deliver(OrderId.generate()))
                    .isInstanceOf(OrderNotFoundException.class);
        }

        @Test
        @DisplayName("should_not_allocate_locks_for_unknown_orders")
        void should_not_allocate_locks_for_unknown_orders() {
            // Given
            Order known = orderOf(ALICE, MOUSE, 1);
            workflow.changeShippingCost(known.getOrderId(), Money.of("4.99"));

            // When
            for (int i = 0; i < 50; i++) {
                OrderId unknown = OrderId.generate();
                assertThatThrownBy(() -> workflow.cancel(unknown))
                        .isInstanceOf(OrderNotFoundException.class);
            }

            // Then
            @SuppressWarnings("unchecked")
            Map<OrderId, ?> locks = (Map<OrderId, ?>) ReflectionTestUtils.getField(workflow, "orderLocks");
            assertThat(locks).containsOnlyKeys(known.getOrderId());
        }
    }

    @Test
    @DisplayName("should_conserve_stock_across_a_mixed_history")
    void should_conserve_stock_across_a_mixed_history() {
        // Given / When: a mix of paid, cancelled, refunded and shipped orders
        Order cancelled = orderOf(ALICE, LAPTOP, 1);
        workflow.cancel(cancelled.getOrderId());
        Order refunded = paidOrderOf(BOB, LAPTOP, 1);
        workflow.refund(refunded.getOrderId());
        Order shipped = paidOrderOf(ALICE, LAPTOP, 2);
        workflow.ship(shipped.getOrderId(), "TRK-1");
        orderOf(BOB, LAPTOP, 1);
        catalogService.restock(LAPTOP, 4);

        // Then: available + held == received, for every product
        for (ProductId productId : List.of(LAPTOP, MOUSE)) {
            int held = orderStore.findAll().stream()
                    .filter(Order::holdsStock)
                    .flatMap(order -> order.getLines().stream())
                    .filter(line -> line.getProductId().equals(productId))
                    .mapToInt(OrderLine::getQuantity)
                    .sum();
            assertThat(ledger.availableQuantity(productId) + held)
                    .isEqualTo((int) ledger.totalReceived(productId));
            assertThat(ledger.availableQuantity(productId)).isNotNegative();
        }
        assertThat(ledger.availableQuantity(LAPTOP)).isEqualTo(6);
    }

    // ==================== Helper Methods ====================

    private Order orderOf(UserId user, ProductId productId, int quantity) {
        cartService.addItem(user, productId, quantity);
        return workflow.checkout(user, ADDRESS);
    }

    private Order paidOrderOf(UserId user, ProductId productId, int quantity) {
        Order order = orderOf(user, productId, quantity);
        assertThat(workflow.pay(order.getOrderId(), PaymentMethod.CREDIT_CARD, VALID_CARD).succeeded()).isTrue();
        return order;
    }
}
