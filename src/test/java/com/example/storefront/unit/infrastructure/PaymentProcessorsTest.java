package com.example.storefront.unit.infrastructure;

import com.example.storefront.application.port.out.PaymentProcessor.ChargeResult;
import com.example.storefront.application.port.out.PaymentProcessor.RefundResult;
import com.example.storefront.domain.model.Money;
import com.example.storefront.domain.model.PaymentInfo;
import com.example.storefront.domain.model.PaymentMethod;
import com.example.storefront.infrastructure.adapter.out.payment.CreditCardProcessor;
import com.example.storefront.infrastructure.adapter.out.payment.DebitCardProcessor;
import com.example.storefront.infrastructure.adapter.out.payment.WalletProcessor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Local Payment Processor Tests")
class PaymentProcessorsTest {

    private static final Money AMOUNT = Money.of("120.00");

    @Nested
    @DisplayName("Credit Card")
    class CreditCard {

        private final CreditCardProcessor processor = new CreditCardProcessor();

        @Test
        @DisplayName("should_approve_sixteen_digit_card")
        void should_approve_sixteen_digit_card() {
            // When
            ChargeResult result = processor.charge(AMOUNT,
                    PaymentInfo.of("card_number", "4111111111111111", "cvv", "123"));

            // Then
            assertThat(result.success()).isTrue();
            assertThat(result.receipt().method()).isEqualTo(PaymentMethod.CREDIT_CARD);
            assertThat(result.receipt().amount()).isEqualTo(AMOUNT);
            assertThat(result.receipt().transactionId()).startsWith("CC-");
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "411111111111111", "41111111111111112", "4111-1111-1111-11"})
        @DisplayName("should_decline_malformed_card_number")
        void should_decline_malformed_card_number(String cardNumber) {
            ChargeResult result = processor.charge(AMOUNT, PaymentInfo.of("card_number", cardNumber));

            assertThat(result.success()).isFalse();
            assertThat(result.declineReason()).isEqualTo("Invalid card number");
        }

        @Test
        @DisplayName("should_decline_malformed_cvv")
        void should_decline_malformed_cvv() {
            ChargeResult result = processor.charge(AMOUNT,
                    PaymentInfo.of("card_number", "4111111111111111", "cvv", "12"));

            assertThat(result.success()).isFalse();
        }

        @Test
        @DisplayName("should_refund_any_receipt")
        void should_refund_any_receipt() {
            ChargeResult charge = processor.charge(AMOUNT, PaymentInfo.of("card_number", "4111111111111111"));

            RefundResult refund = processor.refund(charge.receipt(), PaymentInfo.empty());

            assertThat(refund.success()).isTrue();
            assertThat(refund.refundId()).isNotBlank();
        }
    }

    @Nested
    @DisplayName("Debit Card")
    class DebitCard {

        private final DebitCardProcessor processor = new DebitCardProcessor();

        @Test
        @DisplayName("should_require_four_digit_pin")
        void should_require_four_digit_pin() {
            assertThat(processor.charge(AMOUNT,
                    PaymentInfo.of("card_number", "5500000000000004", "pin", "1234")).success()).isTrue();
            assertThat(processor.charge(AMOUNT,
                    PaymentInfo.of("card_number", "5500000000000004", "pin", "12")).success()).isFalse();
            assertThat(processor.charge(AMOUNT,
                    PaymentInfo.of("card_number", "5500000000000004")).declineReason()).isEqualTo("Invalid pin");
        }
    }

    @Nested
    @DisplayName("Wallet")
    class Wallet {

        private final WalletProcessor processor = new WalletProcessor();

        @Test
        @DisplayName("should_debit_balance_and_credit_back_on_refund")
        void should_debit_balance_and_credit_back_on_refund() {
            // Given
            processor.topUp("w-1", Money.of("200.00"));

            // When
            ChargeResult charge = processor.charge(AMOUNT, PaymentInfo.of("wallet_id", "w-1"));

            // Then
            assertThat(charge.success()).isTrue();
            assertThat(processor.balance("w-1")).isEqualTo(Money.of("80.00"));

            // When
            RefundResult refund = processor.refund(charge.receipt(), PaymentInfo.of("wallet_id", "w-1"));

            // Then
            assertThat(refund.success()).isTrue();
            assertThat(processor.balance("w-1")).isEqualTo(Money.of("200.00"));
        }

        @Test
        @DisplayName("should_decline_insufficient_balance_without_debiting")
        void should_decline_insufficient_balance_without_debiting() {
            // Given
            processor.topUp("w-1", Money.of("100.00"));

            // When
            ChargeResult charge = processor.charge(AMOUNT, PaymentInfo.of("wallet_id", "w-1"));

            // Then
            assertThat(charge.success()).isFalse();
            assertThat(charge.declineReason()).contains("Insufficient");
            assertThat(processor.balance("w-1")).isEqualTo(Money.of("100.00"));
        }

        @Test
        @DisplayName("should_decline_unknown_or_missing_wallet")
        void should_decline_unknown_or_missing_wallet() {
            assertThat(processor.charge(AMOUNT, PaymentInfo.of("wallet_id", "nope")).success()).isFalse();
            assertThat(processor.charge(AMOUNT, PaymentInfo.of(Map.of())).success()).isFalse();
        }

        @Test
        @DisplayName("should_never_overdraw_under_concurrent_charges")
        void should_never_overdraw_under_concurrent_charges() throws Exception {
            // Given: enough for exactly 5 charges
            processor.topUp("w-1", Money.of("600.00"));
            ExecutorService executor = Executors.newFixedThreadPool(8);
            AtomicInteger approved = new AtomicInteger();

            // When
            for (int i = 0; i < 20; i++) {
                executor.submit(() -> {
                    if (processor.charge(AMOUNT, PaymentInfo.of("wallet_id", "w-1")).success()) {
                        approved.incrementAndGet();
                    }
                });
            }
            executor.shutdown();
            assertThat(executor.awaitTermination(5, TimeUnit.SECONDS)).isTrue();

            // Then
            assertThat(approved.get()).isEqualTo(5);
            assertThat(processor.balance("w-1")).isEqualTo(Money.zero());
        }
    }
}
