package com.example.storefront.infrastructure.adapter.out.payment.mapper;

import com.example.storefront.application.port.out.PaymentProcessor.ChargeResult;
import com.example.storefront.application.port.out.PaymentProcessor.RefundResult;
import com.example.storefront.domain.model.Money;
import com.example.storefront.domain.model.PaymentMethod;
import com.example.storefront.domain.model.Receipt;
import com.example.storefront.infrastructure.adapter.out.payment.dto.NetBankingChargeRequest;
import com.example.storefront.infrastructure.adapter.out.payment.dto.NetBankingRefundRequest;
import com.example.storefront.infrastructure.adapter.out.payment.dto.NetBankingResponse;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Mapper between payment domain objects and bank gateway DTOs.
 */
@Component
public class NetBankingMapper {

    private static final String APPROVED = "SUCCESS";

    public NetBankingChargeRequest toChargeRequest(String bankCode, String accountNumber, Money amount) {
        return NetBankingChargeRequest.of(bankCode, accountNumber, amount.getAmount(), amount.getCurrency());
    }

    public NetBankingRefundRequest toRefundRequest(Receipt receipt) {
        return new NetBankingRefundRequest(
                receipt.transactionId(),
                receipt.amount().getAmount(),
                receipt.amount().getCurrency()
        );
    }

    public ChargeResult toChargeResult(NetBankingResponse response, Money amount) {
        if (response == null || !APPROVED.equalsIgnoreCase(response.status()) || response.transactionId() == null) {
            return ChargeResult.declined(declineMessage(response));
        }
        return ChargeResult.success(
                new Receipt(response.transactionId(), PaymentMethod.NET_BANKING, amount, Instant.now()));
    }

    public RefundResult toRefundResult(NetBankingResponse response) {
        if (response == null || !APPROVED.equalsIgnoreCase(response.status())) {
            return RefundResult.failure(declineMessage(response));
        }
        return RefundResult.success(response.transactionId());
    }

    private static String declineMessage(NetBankingResponse response) {
        if (response == null) {
            return "Empty response from bank gateway";
        }
        return response.message() != null ? response.message() : "Declined by bank (" + response.status() + ")";
    }
}
