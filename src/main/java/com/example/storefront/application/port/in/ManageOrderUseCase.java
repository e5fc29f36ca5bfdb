package com.example.storefront.application.port.in;

import com.example.storefront.application.dto.PaymentOutcome;
import com.example.storefront.domain.model.Money;
import com.example.storefront.domain.model.Order;
import com.example.storefront.domain.model.OrderId;
import com.example.storefront.domain.model.PaymentInfo;
import com.example.storefront.domain.model.PaymentMethod;
import com.example.storefront.domain.model.UserId;

import java.util.List;

/**
 * Inbound port for driving existing orders through their lifecycle.
 * Guard failures raise {@link com.example.storefront.domain.exception.InvalidTransitionException}.
 */
public interface ManageOrderUseCase {

    /**
     * Charges the order total. Success confirms the order; a decline leaves it PENDING
     * with its stock still reserved so payment can be retried.
     */
    PaymentOutcome pay(OrderId orderId, PaymentMethod method, PaymentInfo info);

    /**
     * Cancels a PENDING or CONFIRMED order and restores its stock.
     */
    Order cancel(OrderId orderId);

    Order ship(OrderId orderId, String trackingNumber);

    Order deliver(OrderId orderId);

    /**
     * Refunds a completed payment and restores the order's stock.
     *
     * @throws com.example.storefront.domain.exception.PaymentException if the processor refuses
     */
    Order refund(OrderId orderId);

    Order changeShippingCost(OrderId orderId, Money shippingCost);

    Order getOrder(OrderId orderId);

    List<Order> getOrdersForUser(UserId userId);
}
