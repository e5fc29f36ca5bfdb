package com.example.storefront.domain.model;

import com.example.storefront.domain.exception.InsufficientStockException;
import com.example.storefront.domain.exception.InvalidQuantityException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Per-user staging area of product lines, at most one line per product.
 * <p>
 * Stock checks made here are advisory: availability is passed in by the caller and is
 * enforced again when the cart is converted to an order.
 */
public final class Cart {

    private final UserId owner;
    private final Map<ProductId, CartLine> lines = new LinkedHashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    private Cart(UserId owner) {
        this.owner = Objects.requireNonNull(owner, "Owner cannot be null");
    }

    public static Cart emptyFor(UserId owner) {
        return new Cart(owner);
    }

    /**
     * Adds {@code quantity} units, merging with an existing line for the product.
     *
     * @param productId the product to add
     * @param quantity  units to add, must be positive
     * @param available current availability of the product
     * @return the resulting line
     * @throws InvalidQuantityException    if quantity is not positive
     * @throws InsufficientStockException if the merged quantity exceeds availability
     */
    public CartLine addItem(ProductId productId, int quantity, int available) {
        if (quantity <= 0) {
            throw new InvalidQuantityException(quantity, "must be positive when adding to a cart");
        }
        return withLock(() -> {
            int requestedTotal = quantityOf(productId) + quantity;
            if (requestedTotal > available) {
                throw new InsufficientStockException(productId, requestedTotal, available);
            }
            CartLine line = new CartLine(productId, requestedTotal);
            lines.put(productId, line);
            return line;
        });
    }

    /**
     * Replaces the quantity of a product. Zero removes the line.
     *
     * @return the resulting line, empty when the line was removed
     * @throws InvalidQuantityException    if quantity is negative
     * @throws InsufficientStockException if quantity exceeds availability
     */
    public Optional<CartLine> setQuantity(ProductId productId, int quantity, int available) {
        if (quantity < 0) {
            throw new InvalidQuantityException(quantity, "cannot be negative");
        }
        return withLock(() -> {
            if (quantity == 0) {
                lines.remove(productId);
                return Optional.empty();
            }
            if (quantity > available) {
                throw new InsufficientStockException(productId, quantity, available);
            }
            CartLine line = new CartLine(productId, quantity);
            lines.put(productId, line);
            return Optional.of(line);
        });
    }

    public void removeItem(ProductId productId) {
        withLock(() -> lines.remove(productId));
    }

    public void clear() {
        withLock(() -> {
            lines.clear();
            return null;
        });
    }

    public int quantityOf(ProductId productId) {
        return withLock(() -> {
            CartLine line = lines.get(productId);
            return line == null ? 0 : line.quantity();
        });
    }

    /**
     * Sums quantity times the live price of each line.
     *
     * @param currentPrice price lookup into the catalog
     */
    public Money total(Function<ProductId, Money> currentPrice) {
        return getLines().stream()
                .map(line -> currentPrice.apply(line.productId()).multiply(line.quantity()))
                .reduce(Money::add)
                .orElseGet(Money::zero);
    }

    /**
     * Runs {@code action} while holding this cart's lock, so no other thread can edit
     * the cart in between (used by checkout to snapshot and clear atomically).
     */
    public <T> T withLock(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public List<CartLine> getLines() {
        return withLock(() -> List.copyOf(new ArrayList<>(lines.values())));
    }

    public boolean isEmpty() {
        return withLock(lines::isEmpty);
    }

    public UserId getOwner() {
        return owner;
    }

    @Override
    public String toString() {
        return "Cart{" +
                "owner=" + owner +
                ", lines=" + getLines() +
                '}';
    }
}
