package com.example.storefront.application.service;

import com.example.storefront.application.dto.CartSnapshot;
import com.example.storefront.application.dto.PaymentOutcome;
import com.example.storefront.application.exception.PaymentConfigurationException;
import com.example.storefront.application.port.in.CreateOrderUseCase;
import com.example.storefront.application.port.in.ManageOrderUseCase;
import com.example.storefront.application.port.out.CartStore;
import com.example.storefront.application.port.out.OrderStore;
import com.example.storefront.application.port.out.PaymentProcessor.ChargeResult;
import com.example.storefront.application.port.out.PaymentProcessor.RefundResult;
import com.example.storefront.application.port.out.ProductCatalog;
import com.example.storefront.domain.exception.EmptyCartException;
import com.example.storefront.domain.exception.InsufficientStockException;
import com.example.storefront.domain.exception.OrderNotFoundException;
import com.example.storefront.domain.exception.PaymentException;
import com.example.storefront.domain.exception.ProductNotFoundException;
import com.example.storefront.domain.model.Cart;
import com.example.storefront.domain.model.CartLine;
import com.example.storefront.domain.model.Money;
import com.example.storefront.domain.model.Order;
import com.example.storefront.domain.model.OrderId;
import com.example.storefront.domain.model.OrderLine;
import com.example.storefront.domain.model.PaymentInfo;
import com.example.storefront.domain.model.PaymentMethod;
import com.example.storefront.domain.model.Product;
import com.example.storefront.domain.model.Receipt;
import com.example.storefront.domain.model.ShippingAddress;
import com.example.storefront.domain.model.UserId;
import com.example.storefront.domain.service.StockLedger;
import com.example.storefront.domain.service.StockLedger.ReservationResult;
import com.example.storefront.domain.service.StockLedger.StockLocks;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Application service that drives orders from creation to delivery.
 * <p>
 * Stock is reserved when an order is created and released exactly once, on cancel or
 * refund. Transitions on one order are serialized by a per-order lock; payment processors
 * are called under that lock but never while stock locks are held.
 */
@Service
public class OrderWorkflowService implements CreateOrderUseCase, ManageOrderUseCase {

    private static final Logger log = LoggerFactory.getLogger(OrderWorkflowService.class);

    private final StockLedger stockLedger;
    private final ProductCatalog productCatalog;
    private final CartStore cartStore;
    private final OrderStore orderStore;
    private final PaymentGateway paymentGateway;
    private final ConcurrentMap<OrderId, ReentrantLock> orderLocks = new ConcurrentHashMap<>();

    public OrderWorkflowService(
            StockLedger stockLedger,
            ProductCatalog productCatalog,
            CartStore cartStore,
            OrderStore orderStore,
            PaymentGateway paymentGateway) {
        this.stockLedger = stockLedger;
        this.productCatalog = productCatalog;
        this.cartStore = cartStore;
        this.orderStore = orderStore;
        this.paymentGateway = paymentGateway;
    }

    @Override
    public Order createOrder(CartSnapshot snapshot, ShippingAddress shippingAddress) {
        Objects.requireNonNull(snapshot, "CartSnapshot cannot be null");
        Objects.requireNonNull(shippingAddress, "ShippingAddress cannot be null");
        if (snapshot.isEmpty()) {
            throw new EmptyCartException(snapshot.userId());
        }
        log.info("Creating order for user {} with {} lines", snapshot.userId(), snapshot.lines().size());

        List<OrderLine> orderLines = snapshot.lines().stream()
                .map(this::freeze)
                .toList();

        List<OrderLine> reserved = new ArrayList<>(orderLines.size());
        try (StockLocks ignored = stockLedger.lockAll(
                orderLines.stream().map(OrderLine::getProductId).toList())) {
            for (OrderLine line : orderLines) {
                ReservationResult result = stockLedger.reserve(line.getProductId(), line.getQuantity());
                if (!result.reserved()) {
                    releaseAll(reserved);
                    log.warn("Order for user {} rejected: {} requested {}, available {}",
                            snapshot.userId(), result.productId(), result.requestedQuantity(),
                            result.availableQuantity());
                    throw new InsufficientStockException(
                            result.productId(), result.requestedQuantity(), result.availableQuantity());
                }
                reserved.add(line);
            }

            Order order = Order.create(snapshot.userId(), orderLines, shippingAddress);
            try {
                orderStore.save(order);
            } catch (RuntimeException e) {
                log.error("Failed to store order for user {}, releasing reserved stock", snapshot.userId(), e);
                releaseAll(reserved);
                throw e;
            }
            log.info("Order {} created for user {}, total {}", order.getOrderId(), order.getUserId(),
                    order.getTotal());
            return order;
        }
    }

    @Override
    public Order checkout(UserId userId, ShippingAddress shippingAddress) {
        Cart cart = cartStore.find(userId)
                .orElseThrow(() -> new EmptyCartException(userId));
        return cart.withLock(() -> {
            Order order = createOrder(CartSnapshot.of(cart), shippingAddress);
            cart.clear();
            return order;
        });
    }

    @Override
    public PaymentOutcome pay(OrderId orderId, PaymentMethod method, PaymentInfo info) {
        Objects.requireNonNull(method, "Payment method cannot be null");
        PaymentInfo paymentInfo = info == null ? PaymentInfo.empty() : info;
        return withOrderLock(orderId, order -> {
            order.ensurePayable();
            Money amount = order.getTotal();
            log.debug("Charging {} for order {} via {}", amount, orderId, method);

            ChargeResult result;
            try {
                result = paymentGateway.charge(method, amount, paymentInfo);
            } catch (PaymentConfigurationException e) {
                log.error("Order {} cannot be paid: no processor for {}", orderId, e.getMethod());
                throw e;
            }
            if (result.success()) {
                order.markPaymentCompleted(method, paymentInfo, result.receipt());
                orderStore.save(order);
                log.info("Payment completed for order {}, transactionId: {}",
                        orderId, result.receipt().transactionId());
                return PaymentOutcome.completed(order, result.receipt());
            }

            order.markPaymentFailed(method);
            orderStore.save(order);
            log.warn("Payment failed for order {} via {}: {}", orderId, method, result.declineReason());
            return PaymentOutcome.failed(order, result.declineReason());
        });
    }

    @Override
    public Order cancel(OrderId orderId) {
        return withOrderLock(orderId, order -> {
            List<OrderLine> toRelease = order.cancel();
            releaseAll(toRelease);
            orderStore.save(order);
            log.info("Order {} cancelled, {} lines returned to stock", orderId, toRelease.size());
            return order;
        });
    }

    @Override
    public Order ship(OrderId orderId, String trackingNumber) {
        return withOrderLock(orderId, order -> {
            order.ship(trackingNumber);
            orderStore.save(order);
            log.info("Order {} shipped, trackingNumber: {}", orderId, trackingNumber);
            return order;
        });
    }

    @Override
    public Order deliver(OrderId orderId) {
        return withOrderLock(orderId, order -> {
            order.deliver();
            orderStore.save(order);
            log.info("Order {} delivered", orderId);
            return order;
        });
    }

    @Override
    public Order refund(OrderId orderId) {
        return withOrderLock(orderId, order -> {
            order.ensureRefundable();
            Receipt receipt = order.getReceipt().orElseThrow();
            PaymentInfo info = order.getPaymentInfo().orElseGet(PaymentInfo::empty);

            RefundResult result = paymentGateway.refund(receipt.method(), receipt, info);
            if (!result.success()) {
                log.warn("Refund of order {} refused: {}", orderId, result.failureReason());
                throw new PaymentException(receipt.method(), result.failureReason());
            }

            List<OrderLine> toRelease = order.markRefunded();
            releaseAll(toRelease);
            orderStore.save(order);
            log.info("Order {} refunded, refundId: {}", orderId, result.refundId());
            return order;
        });
    }

    @Override
    public Order changeShippingCost(OrderId orderId, Money shippingCost) {
        return withOrderLock(orderId, order -> {
            order.changeShippingCost(shippingCost);
            orderStore.save(order);
            log.debug("Shipping cost of order {} set to {}", orderId, shippingCost);
            return order;
        });
    }

    @Override
    public Order getOrder(OrderId orderId) {
        return orderStore.findById(orderId)
                .orElseThrow(() -> new OrderNotFoundException(orderId));
    }

    @Override
    public List<Order> getOrdersForUser(UserId userId) {
        return orderStore.findByUserId(userId);
    }

    private OrderLine freeze(CartLine line) {
        Product product = productCatalog.findById(line.productId())
                .filter(Product::isActive)
                .orElseThrow(() -> new ProductNotFoundException(line.productId()));
        return OrderLine.of(product.getProductId(), product.getName(), line.quantity(), product.getPrice());
    }

    private void releaseAll(List<OrderLine> lines) {
        for (OrderLine line : lines) {
            stockLedger.release(line.getProductId(), line.getQuantity());
        }
    }

    /**
     * Runs the action on the stored order while holding its lock. Unknown ids fail
     * before a lock is allocated for them.
     */
    private <T> T withOrderLock(OrderId orderId, Function<Order, T> action) {
        Objects.requireNonNull(orderId, "OrderId cannot be null");
        getOrder(orderId);
        ReentrantLock lock = orderLocks.computeIfAbsent(orderId, id -> new ReentrantLock());
        lock.lock();
        try {
            return action.apply(getOrder(orderId));
        } finally {
            lock.unlock();
        }
    }
}
