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
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Card processor settled locally. Requires a 16-digit {@code card_number}; a {@code cvv},
 * when given, must have 3 or 4 digits.
 */
@Component
public class CreditCardProcessor implements PaymentProcessor {

    private static final Logger log = LoggerFactory.getLogger(CreditCardProcessor.class);

    static final String CARD_NUMBER = "card_number";
    static final String CVV = "cvv";

    private static final Pattern CARD_NUMBER_PATTERN = Pattern.compile("^\\d{16}$");
    private static final Pattern CVV_PATTERN = Pattern.compile("^\\d{3,4}$");

    @Override
    public PaymentMethod method() {
        return PaymentMethod.CREDIT_CARD;
    }

    @Override
    public ChargeResult charge(Money amount, PaymentInfo info) {
        Optional<String> cardNumber = info.get(CARD_NUMBER);
        if (cardNumber.isEmpty() || !CARD_NUMBER_PATTERN.matcher(cardNumber.get()).matches()) {
            log.warn("Credit card charge of {} declined: invalid card number", amount);
            return ChargeResult.declined("Invalid card number");
        }
        Optional<String> cvv = info.get(CVV);
        if (cvv.isPresent() && !CVV_PATTERN.matcher(cvv.get()).matches()) {
            log.warn("Credit card charge of {} declined: invalid cvv", amount);
            return ChargeResult.declined("Invalid cvv");
        }

        Receipt receipt = new Receipt("CC-" + UUID.randomUUID(), method(), amount, Instant.now());
        log.debug("Credit card charged {}, transactionId: {}", amount, receipt.transactionId());
        return ChargeResult.success(receipt);
    }

    @Override
    public RefundResult refund(Receipt receipt, PaymentInfo info) {
        String refundId = "CCR-" + UUID.randomUUID();
        log.debug("Credit card charge {} refunded, refundId: {}", receipt.transactionId(), refundId);
        return RefundResult.success(refundId);
    }
}
