package com.example.storefront.domain.model;

import com.example.storefront.domain.exception.InvalidTransitionException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Aggregate Root representing a customer order.
 * <p>
 * Identity, owner, address and lines are fixed at creation. Status and payment state change
 * only through the transition methods below, each of which checks its guard first and
 * leaves the order untouched when the guard fails.
 */
public final class Order {

    private final OrderId orderId;
    private final UserId userId;
    private final List<OrderLine> lines;
    private final ShippingAddress shippingAddress;
    private final Instant createdAt;
    private OrderStatus status;
    private PaymentStatus paymentStatus;
    private PaymentMethod paymentMethod;
    private PaymentInfo paymentInfo;
    private Receipt receipt;
    private String trackingNumber;
    private Money shippingCost;
    private boolean stockHeld;

    private Order(OrderId orderId, UserId userId, List<OrderLine> lines, ShippingAddress shippingAddress,
                  Instant createdAt) {
        this.orderId = Objects.requireNonNull(orderId, "OrderId cannot be null");
        this.userId = Objects.requireNonNull(userId, "UserId cannot be null");
        this.lines = List.copyOf(Objects.requireNonNull(lines, "Lines cannot be null"));
        this.shippingAddress = Objects.requireNonNull(shippingAddress, "ShippingAddress cannot be null");
        this.createdAt = Objects.requireNonNull(createdAt, "CreatedAt cannot be null");

        if (lines.isEmpty()) {
            throw new IllegalArgumentException("Order must have at least one line");
        }
        this.status = OrderStatus.PENDING;
        this.paymentStatus = PaymentStatus.PENDING;
        this.shippingCost = Money.zero(this.lines.get(0).getUnitPrice().getCurrency());
        this.stockHeld = true;
    }

    /**
     * Creates a new PENDING order whose stock has already been reserved.
     *
     * @param userId          the ordering user
     * @param lines           frozen order lines (must not be empty)
     * @param shippingAddress the shipping address
     * @return new Order instance
     */
    public static Order create(UserId userId, List<OrderLine> lines, ShippingAddress shippingAddress) {
        return new Order(OrderId.generate(), userId, lines, shippingAddress, Instant.now());
    }

    public Money getSubtotal() {
        return lines.stream()
                .map(OrderLine::getSubtotal)
                .reduce(Money::add)
                .orElseThrow();
    }

    /**
     * Sum of frozen line subtotals plus the shipping cost.
     */
    public synchronized Money getTotal() {
        return getSubtotal().add(shippingCost);
    }

    /**
     * @throws InvalidTransitionException unless the order is PENDING
     */
    public synchronized void ensurePayable() {
        if (status != OrderStatus.PENDING) {
            throw new InvalidTransitionException(status, OrderEvent.PAY);
        }
    }

    /**
     * PENDING → CONFIRMED, payment COMPLETED.
     */
    public synchronized void markPaymentCompleted(PaymentMethod method, PaymentInfo info, Receipt receipt) {
        ensurePayable();
        this.paymentMethod = Objects.requireNonNull(method, "Method cannot be null");
        this.paymentInfo = Objects.requireNonNull(info, "PaymentInfo cannot be null");
        this.receipt = Objects.requireNonNull(receipt, "Receipt cannot be null");
        this.paymentStatus = PaymentStatus.COMPLETED;
        this.status = OrderStatus.CONFIRMED;
    }

    /**
     * Records a declined or unreachable payment. The order stays PENDING and keeps its stock.
     */
    public synchronized void markPaymentFailed(PaymentMethod method) {
        ensurePayable();
        this.paymentMethod = Objects.requireNonNull(method, "Method cannot be null");
        this.paymentStatus = PaymentStatus.FAILED;
    }

    /**
     * PENDING|CONFIRMED → CANCELLED.
     *
     * @return lines whose stock must now be released; empty when the stock was already
     * returned by a refund
     */
    public synchronized List<OrderLine> cancel() {
        if (!status.isCancellable()) {
            throw new InvalidTransitionException(status, OrderEvent.CANCEL);
        }
        this.status = OrderStatus.CANCELLED;
        return takeHeldStock();
    }

    /**
     * CONFIRMED → SHIPPED.
     */
    public synchronized void ship(String trackingNumber) {
        if (status != OrderStatus.CONFIRMED) {
            throw new InvalidTransitionException(status, OrderEvent.SHIP);
        }
        if (paymentStatus != PaymentStatus.COMPLETED) {
            throw new InvalidTransitionException(status, OrderEvent.SHIP, "payment is " + paymentStatus);
        }
        if (trackingNumber == null || trackingNumber.isBlank()) {
            throw new InvalidTransitionException(status, OrderEvent.SHIP, "tracking number is required");
        }
        this.trackingNumber = trackingNumber.trim();
        this.status = OrderStatus.SHIPPED;
    }

    /**
     * SHIPPED → DELIVERED.
     */
    public synchronized void deliver() {
        if (status != OrderStatus.SHIPPED) {
            throw new InvalidTransitionException(status, OrderEvent.DELIVER);
        }
        this.status = OrderStatus.DELIVERED;
    }

    /**
     * @throws InvalidTransitionException unless CONFIRMED with a COMPLETED payment
     */
    public synchronized void ensureRefundable() {
        if (status != OrderStatus.CONFIRMED) {
            throw new InvalidTransitionException(status, OrderEvent.REFUND);
        }
        if (paymentStatus != PaymentStatus.COMPLETED) {
            throw new InvalidTransitionException(status, OrderEvent.REFUND, "payment is " + paymentStatus);
        }
    }

    /**
     * Payment COMPLETED → REFUNDED. Order status is unchanged.
     *
     * @return lines whose stock must now be released
     */
    public synchronized List<OrderLine> markRefunded() {
        ensureRefundable();
        this.paymentStatus = PaymentStatus.REFUNDED;
        return takeHeldStock();
    }

    /**
     * Shipping cost can change until the order ships.
     */
    public synchronized void changeShippingCost(Money cost) {
        Objects.requireNonNull(cost, "Shipping cost cannot be null");
        if (!status.isCancellable()) {
            throw new InvalidTransitionException(status, OrderEvent.CHANGE_SHIPPING_COST);
        }
        if (paymentStatus == PaymentStatus.COMPLETED || paymentStatus == PaymentStatus.REFUNDED) {
            throw new InvalidTransitionException(status, OrderEvent.CHANGE_SHIPPING_COST,
                    "total already settled");
        }
        this.shippingCost = cost;
    }

    private List<OrderLine> takeHeldStock() {
        if (!stockHeld) {
            return List.of();
        }
        stockHeld = false;
        return lines;
    }

    public OrderId getOrderId() {
        return orderId;
    }

    public UserId getUserId() {
        return userId;
    }

    public List<OrderLine> getLines() {
        return Collections.unmodifiableList(new ArrayList<>(lines));
    }

    public ShippingAddress getShippingAddress() {
        return shippingAddress;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public synchronized OrderStatus getStatus() {
        return status;
    }

    public synchronized PaymentStatus getPaymentStatus() {
        return paymentStatus;
    }

    public synchronized Optional<PaymentMethod> getPaymentMethod() {
        return Optional.ofNullable(paymentMethod);
    }

    public synchronized Optional<PaymentInfo> getPaymentInfo() {
        return Optional.ofNullable(paymentInfo);
    }

    public synchronized Optional<Receipt> getReceipt() {
        return Optional.ofNullable(receipt);
    }

    public synchronized Optional<String> getTrackingNumber() {
        return Optional.ofNullable(trackingNumber);
    }

    public synchronized Money getShippingCost() {
        return shippingCost;
    }

    /**
     * True while this order's quantities are counted as reserved in the stock ledger.
     */
    public synchronized boolean holdsStock() {
        return stockHeld;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Order order = (Order) o;
        return Objects.equals(orderId, order.orderId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(orderId);
    }

    @Override
    public String toString() {
        return "Order{" +
                "orderId=" + orderId +
                ", userId=" + userId +
                ", status=" + getStatus() +
                ", paymentStatus=" + getPaymentStatus() +
                ", lineCount=" + lines.size() +
                ", total=" + getTotal() +
                '}';
    }
}
