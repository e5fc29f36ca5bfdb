package com.example.storefront.application.service;

import com.example.storefront.application.port.in.CartUseCase;
import com.example.storefront.application.port.out.CartStore;
import com.example.storefront.application.port.out.ProductCatalog;
import com.example.storefront.domain.exception.ProductNotFoundException;
import com.example.storefront.domain.model.Cart;
import com.example.storefront.domain.model.CartLine;
import com.example.storefront.domain.model.Money;
import com.example.storefront.domain.model.Product;
import com.example.storefront.domain.model.ProductId;
import com.example.storefront.domain.model.UserId;
import com.example.storefront.domain.service.StockLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Application service for cart editing. Quantities are checked against the stock ledger
 * when they change; the check is repeated at checkout.
 */
@Service
public class CartService implements CartUseCase {

    private static final Logger log = LoggerFactory.getLogger(CartService.class);

    private final CartStore cartStore;
    private final ProductCatalog productCatalog;
    private final StockLedger stockLedger;

    public CartService(CartStore cartStore, ProductCatalog productCatalog, StockLedger stockLedger) {
        this.cartStore = cartStore;
        this.productCatalog = productCatalog;
        this.stockLedger = stockLedger;
    }

    @Override
    public CartLine addItem(UserId userId, ProductId productId, int quantity) {
        requireActiveProduct(productId);
        Cart cart = cartStore.cartFor(userId);
        CartLine line = cart.addItem(productId, quantity, stockLedger.availableQuantity(productId));
        log.debug("Cart of {} now holds {} x {}", userId, line.quantity(), productId);
        return line;
    }

    @Override
    public Optional<CartLine> setQuantity(UserId userId, ProductId productId, int quantity) {
        if (quantity > 0) {
            requireActiveProduct(productId);
        }
        Cart cart = cartStore.cartFor(userId);
        Optional<CartLine> line = cart.setQuantity(productId, quantity, stockLedger.availableQuantity(productId));
        log.debug("Cart of {} set {} to {}", userId, productId, quantity);
        return line;
    }

    @Override
    public void removeItem(UserId userId, ProductId productId) {
        cartStore.find(userId).ifPresent(cart -> cart.removeItem(productId));
    }

    @Override
    public void clear(UserId userId) {
        cartStore.find(userId).ifPresent(Cart::clear);
    }

    @Override
    public List<CartLine> getLines(UserId userId) {
        return cartStore.find(userId)
                .map(Cart::getLines)
                .orElse(List.of());
    }

    @Override
    public Money total(UserId userId) {
        return cartStore.find(userId)
                .map(cart -> cart.total(this::currentPrice))
                .orElseGet(Money::zero);
    }

    private Money currentPrice(ProductId productId) {
        return productCatalog.findById(productId)
                .map(Product::getPrice)
                .orElseThrow(() -> new ProductNotFoundException(productId));
    }

    private void requireActiveProduct(ProductId productId) {
        productCatalog.findById(productId)
                .filter(Product::isActive)
                .orElseThrow(() -> new ProductNotFoundException(productId));
    }
}
