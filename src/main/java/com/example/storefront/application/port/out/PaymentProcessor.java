package com.example.storefront.application.port.out;

import com.example.storefront.domain.model.Money;
import com.example.storefront.domain.model.PaymentInfo;
import com.example.storefront.domain.model.PaymentMethod;
import com.example.storefront.domain.model.Receipt;

/**
 * Outbound port for one payment method. Method-specific validation lives in the
 * implementation; the order workflow treats every processor the same way.
 */
public interface PaymentProcessor {

    /**
     * The method this processor settles.
     */
    PaymentMethod method();

    /**
     * Attempts to settle an amount.
     *
     * @param amount the amount to charge
     * @param info   method-specific payment details
     * @return charge result, a decline is a result and not an exception
     * @throws com.example.storefront.application.exception.ServiceUnavailableException
     *         if a remote processor cannot be reached
     */
    ChargeResult charge(Money amount, PaymentInfo info);

    /**
     * Returns a settled charge to the customer.
     *
     * @param receipt receipt of the original charge
     * @param info    payment details used for the charge
     * @return refund result
     */
    RefundResult refund(Receipt receipt, PaymentInfo info);

    /**
     * Result of a charge attempt.
     */
    record ChargeResult(
            Receipt receipt,
            String declineReason
    ) {
        public static ChargeResult success(Receipt receipt) {
            return new ChargeResult(receipt, null);
        }

        public static ChargeResult declined(String reason) {
            return new ChargeResult(null, reason);
        }

        public boolean success() {
            return receipt != null;
        }
    }

    /**
     * Result of a refund attempt.
     */
    record RefundResult(
            String refundId,
            String failureReason
    ) {
        public static RefundResult success(String refundId) {
            return new RefundResult(refundId, null);
        }

        public static RefundResult failure(String reason) {
            return new RefundResult(null, reason);
        }

        public boolean success() {
            return failureReason == null;
        }
    }
}
