package com.example.storefront.infrastructure.adapter.out.payment;

import com.example.storefront.application.port.out.PaymentProcessor;
import com.example.storefront.domain.model.Money;
import com.example.storefront.domain.model.PaymentInfo;
import com.example.storefront.domain.model.PaymentMethod;
import com.example.storefront.domain.model.Receipt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Stored-value wallets keyed by {@code wallet_id}. A charge debits the balance atomically
 * and is declined when the balance does not cover it; a refund credits it back.
 */
@Component
public class WalletProcessor implements PaymentProcessor {

    private static final Logger log = LoggerFactory.getLogger(WalletProcessor.class);

    static final String WALLET_ID = "wallet_id";

    private final ConcurrentMap<String, Money> balances = new ConcurrentHashMap<>();

    @Override
    public PaymentMethod method() {
        return PaymentMethod.WALLET;
    }

    /**
     * Credits a wallet, opening it on first use.
     *
     * @return the new balance
     */
    public Money topUp(String walletId, Money amount) {
        Objects.requireNonNull(walletId, "WalletId cannot be null");
        Objects.requireNonNull(amount, "Amount cannot be null");
        Money balance = balances.merge(walletId, amount, Money::add);
        log.info("Wallet {} topped up by {}, balance {}", walletId, amount, balance);
        return balance;
    }

    public Money balance(String walletId) {
        return balances.getOrDefault(walletId, Money.zero());
    }

    @Override
    public ChargeResult charge(Money amount, PaymentInfo info) {
        Optional<String> walletId = info.get(WALLET_ID);
        if (walletId.isEmpty()) {
            return ChargeResult.declined("Missing wallet_id");
        }
        if (!balances.containsKey(walletId.get())) {
            log.warn("Wallet charge of {} declined: unknown wallet {}", amount, walletId.get());
            return ChargeResult.declined("Unknown wallet " + walletId.get());
        }

        AtomicBoolean debited = new AtomicBoolean();
        balances.computeIfPresent(walletId.get(), (id, balance) -> {
            if (amount.isGreaterThan(balance)) {
                return balance;
            }
            debited.set(true);
            return Money.of(balance.getAmount().subtract(amount.getAmount()), balance.getCurrency());
        });
        if (!debited.get()) {
            log.warn("Wallet charge of {} declined: insufficient balance in {}", amount, walletId.get());
            return ChargeResult.declined("Insufficient wallet balance");
        }

        Receipt receipt = new Receipt("WL-" + UUID.randomUUID(), method(), amount, Instant.now());
        log.debug("Wallet {} charged {}, transactionId: {}", walletId.get(), amount, receipt.transactionId());
        return ChargeResult.success(receipt);
    }

    @Override
    public RefundResult refund(Receipt receipt, PaymentInfo info) {
        Optional<String> walletId = info.get(WALLET_ID);
        if (walletId.isEmpty()) {
            return RefundResult.failure("Missing wallet_id");
        }
        Money balance = balances.merge(walletId.get(), receipt.amount(), Money::add);
        log.info("Wallet {} refunded {} for {}, balance {}",
                walletId.get(), receipt.amount(), receipt.transactionId(), balance);
        return RefundResult.success("WLR-" + UUID.randomUUID());
    }
}
