package com.example.storefront.domain.model;

/**
 * Events that drive an order through its lifecycle.
 */
public enum OrderEvent {
    PAY,
    CANCEL,
    SHIP,
    DELIVER,
    REFUND,
    CHANGE_SHIPPING_COST
}
