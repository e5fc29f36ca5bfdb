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
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Debit card processor: 16-digit {@code card_number} plus a 4-digit {@code pin}.
 */
@Component
public class DebitCardProcessor implements PaymentProcessor {

    private static final Logger log = LoggerFactory.getLogger(DebitCardProcessor.class);

    static final String CARD_NUMBER = "card_number";
    static final String PIN = "pin";

    private static final Pattern CARD_NUMBER_PATTERN = Pattern.compile("^\\d{16}$");
    private static final Pattern PIN_PATTERN = Pattern.compile("^\\d{4}$");

    @Override
    public PaymentMethod method() {
        return PaymentMethod.DEBIT_CARD;
    }

    @Override
    public ChargeResult charge(Money amount, PaymentInfo info) {
        boolean validCard = info.get(CARD_NUMBER)
                .map(number -> CARD_NUMBER_PATTERN.matcher(number).matches())
                .orElse(false);
        if (!validCard) {
            log.warn("Debit card charge of {} declined: invalid card number", amount);
            return ChargeResult.declined("Invalid card number");
        }
        boolean validPin = info.get(PIN)
                .map(pin -> PIN_PATTERN.matcher(pin).matches())
                .orElse(false);
        if (!validPin) {
            log.warn("Debit card charge of {} declined: missing or malformed pin", amount);
            return ChargeResult.declined("Invalid pin");
        }

        Receipt receipt = new Receipt("DC-" + UUID.randomUUID(), method(), amount, Instant.now());
        log.debug("Debit card charged {}, transactionId: {}", amount, receipt.transactionId());
        return ChargeResult.success(receipt);
    }

    @Override
    public RefundResult refund(Receipt receipt, PaymentInfo info) {
        return RefundResult.success("DCR-" + UUID.randomUUID());
    }
}
