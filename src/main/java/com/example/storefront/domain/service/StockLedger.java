package com.example.storefront.domain.service;

import com.example.storefront.domain.exception.InvalidQuantityException;
import com.example.storefront.domain.model.ProductId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the available quantity of every product and is the only place stock changes.
 * <p>
 * Each product has its own reentrant lock, so {@link #reserve} is linearizable per product.
 * Callers touching several products at once take {@link #lockAll} first; locks are always
 * acquired in ascending {@link ProductId} order.
 */
public class StockLedger {

    private static final Logger log = LoggerFactory.getLogger(StockLedger.class);

    private final ConcurrentMap<ProductId, StockEntry> entries = new ConcurrentHashMap<>();

    /**
     * Adds newly received units to a product's available stock.
     *
     * @param productId the product
     * @param quantity  units received, must be positive
     * @return available quantity after the addition
     * @throws InvalidQuantityException if the quantity is not positive or would overflow
     *                                  the available stock; nothing changes in that case
     */
    public int receive(ProductId productId, int quantity) {
        requirePositive(quantity, "received quantity must be positive");
        StockEntry entry = entryFor(productId);
        entry.lock.lock();
        try {
            entry.available = addWithoutOverflow(entry.available, quantity);
            entry.received += quantity;
            log.debug("Received {} units of {}, available={}", quantity, productId, entry.available);
            return entry.available;
        } finally {
            entry.lock.unlock();
        }
    }

    /**
     * Atomically checks {@code available >= quantity} and decrements on success.
     * A failed reservation changes nothing.
     *
     * @param productId the product
     * @param quantity  units to reserve, must be positive
     * @return reservation outcome, carrying the quantity left (or found) after the attempt
     */
    public ReservationResult reserve(ProductId productId, int quantity) {
        requirePositive(quantity, "reserved quantity must be positive");
        StockEntry entry = entries.get(productId);
        if (entry == null) {
            log.debug("Reservation of {} units of unknown product {} rejected", quantity, productId);
            return ReservationResult.failure(productId, quantity, 0);
        }
        entry.lock.lock();
        try {
            if (entry.available < quantity) {
                log.debug("Reservation of {} units of {} rejected, available={}",
                        quantity, productId, entry.available);
                return ReservationResult.failure(productId, quantity, entry.available);
            }
            entry.available -= quantity;
            log.debug("Reserved {} units of {}, available={}", quantity, productId, entry.available);
            return ReservationResult.success(productId, quantity, entry.available);
        } finally {
            entry.lock.unlock();
        }
    }

    /**
     * Returns previously reserved units. Releasing the same reservation twice is the
     * caller's bug; the ledger cannot detect it.
     *
     * @param productId the product
     * @param quantity  units to give back, must be positive
     */
    public void release(ProductId productId, int quantity) {
        requirePositive(quantity, "released quantity must be positive");
        StockEntry entry = entryFor(productId);
        entry.lock.lock();
        try {
            entry.available = addWithoutOverflow(entry.available, quantity);
            log.debug("Released {} units of {}, available={}", quantity, productId, entry.available);
        } finally {
            entry.lock.unlock();
        }
    }

    /**
     * Snapshot of the available quantity; 0 for products never stocked. Not a promise that
     * a later {@link #reserve} will succeed.
     */
    public int availableQuantity(ProductId productId) {
        StockEntry entry = entries.get(Objects.requireNonNull(productId, "ProductId cannot be null"));
        return entry == null ? 0 : entry.available;
    }

    /**
     * Total units ever received for a product.
     */
    public long totalReceived(ProductId productId) {
        StockEntry entry = entries.get(Objects.requireNonNull(productId, "ProductId cannot be null"));
        return entry == null ? 0 : entry.received;
    }

    /**
     * Acquires the locks of all given products in ascending id order. Duplicates are
     * ignored. While held, no other thread can reserve or release those products.
     *
     * @param productIds products about to be reserved together
     * @return handle that releases the locks in reverse order on close
     */
    public StockLocks lockAll(Collection<ProductId> productIds) {
        SortedSet<ProductId> ordered = new TreeSet<>(productIds);
        List<ReentrantLock> acquired = new ArrayList<>(ordered.size());
        for (ProductId productId : ordered) {
            ReentrantLock lock = entryFor(productId).lock;
            lock.lock();
            acquired.add(lock);
        }
        log.debug("Locked stock of {}", ordered);
        return new StockLocks(acquired);
    }

    private StockEntry entryFor(ProductId productId) {
        return entries.computeIfAbsent(Objects.requireNonNull(productId, "ProductId cannot be null"),
                id -> new StockEntry());
    }

    private static int addWithoutOverflow(int available, int quantity) {
        try {
            return Math.addExact(available, quantity);
        } catch (ArithmeticException e) {
            throw new InvalidQuantityException(quantity, "would overflow available stock of " + available);
        }
    }

    private static void requirePositive(int quantity, String rule) {
        if (quantity <= 0) {
            throw new InvalidQuantityException(quantity, rule);
        }
    }

    private static final class StockEntry {
        private final ReentrantLock lock = new ReentrantLock();
        private volatile int available;
        private volatile long received;
    }

    /**
     * Set of product locks held by the current thread.
     */
    public static final class StockLocks implements AutoCloseable {

        private final List<ReentrantLock> locks;

        private StockLocks(List<ReentrantLock> locks) {
            this.locks = locks;
        }

        @Override
        public void close() {
            for (int i = locks.size() - 1; i >= 0; i--) {
                locks.get(i).unlock();
            }
        }
    }

    /**
     * Result of a reservation attempt.
     */
    public record ReservationResult(
            ProductId productId,
            boolean reserved,
            int requestedQuantity,
            int availableQuantity
    ) {
        public static ReservationResult success(ProductId productId, int requestedQuantity, int remainingQuantity) {
            return new ReservationResult(productId, true, requestedQuantity, remainingQuantity);
        }

        public static ReservationResult failure(ProductId productId, int requestedQuantity, int availableQuantity) {
            return new ReservationResult(productId, false, requestedQuantity, availableQuantity);
        }
    }
}
