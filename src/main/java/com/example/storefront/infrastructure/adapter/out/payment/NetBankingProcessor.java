package com.example.storefront.infrastructure.adapter.out.payment;

import com.example.storefront.application.exception.ServiceUnavailableException;
import com.example.storefront.application.port.out.PaymentProcessor;
import com.example.storefront.domain.model.Money;
import com.example.storefront.domain.model.PaymentInfo;
import com.example.storefront.domain.model.PaymentMethod;
import com.example.storefront.domain.model.Receipt;
import com.example.storefront.infrastructure.adapter.out.payment.dto.NetBankingResponse;
import com.example.storefront.infrastructure.adapter.out.payment.mapper.NetBankingMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.codec.CodecException;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.util.Optional;

/**
 * Adapter for the remote bank gateway.
 * A 4xx answer or a non-SUCCESS body is a decline. A 5xx answer, a timeout, a
 * connection failure or an unreadable body raises {@link ServiceUnavailableException},
 * which the circuit breaker in front of this processor records as a failure.
 */
@Component
public class NetBankingProcessor implements PaymentProcessor {

    private static final Logger log = LoggerFactory.getLogger(NetBankingProcessor.class);
    private static final String SERVICE_NAME = "net-banking";

    static final String BANK_CODE = "bank_code";
    static final String ACCOUNT_NUMBER = "account_number";

    private final WebClient webClient;
    private final NetBankingMapper mapper;

    public NetBankingProcessor(
            @Qualifier("netBankingWebClient") WebClient webClient,
            NetBankingMapper mapper) {
        this.webClient = webClient;
        this.mapper = mapper;
    }

    @Override
    public PaymentMethod method() {
        return PaymentMethod.NET_BANKING;
    }

    @Override
    public ChargeResult charge(Money amount, PaymentInfo info) {
        Optional<String> bankCode = info.get(BANK_CODE);
        Optional<String> accountNumber = info.get(ACCOUNT_NUMBER);
        if (bankCode.isEmpty() || accountNumber.isEmpty()) {
            return ChargeResult.declined("bank_code and account_number are required");
        }
        log.debug("Requesting net banking charge of {} from bank {}", amount, bankCode.get());

        try {
            NetBankingResponse response = post("/api/netbanking/charge",
                    mapper.toChargeRequest(bankCode.get(), accountNumber.get(), amount));
            return mapper.toChargeResult(response, amount);
        } catch (BankRejectionException e) {
            log.warn("Net banking charge of {} rejected by bank {}: {}", amount, bankCode.get(), e.getMessage());
            return ChargeResult.declined(e.getMessage());
        }
    }

    @Override
    public RefundResult refund(Receipt receipt, PaymentInfo info) {
        log.debug("Requesting net banking refund of {}", receipt.transactionId());
        try {
            return mapper.toRefundResult(post("/api/netbanking/refund", mapper.toRefundRequest(receipt)));
        } catch (BankRejectionException e) {
            log.warn("Net banking refund of {} rejected: {}", receipt.transactionId(), e.getMessage());
            return RefundResult.failure(e.getMessage());
        }
    }

    private NetBankingResponse post(String uri, Object body) {
        try {
            return webClient.post()
                    .uri(uri)
                    .bodyValue(body)
                    .retrieve()
                    .onStatus(HttpStatusCode::is4xxClientError, response ->
                            response.bodyToMono(String.class)
                                    .defaultIfEmpty("")
                                    .flatMap(text -> Mono.error(new BankRejectionException(
                                            "Bank rejected request (" + response.statusCode().value() + ")"
                                                    + (text.isBlank() ? "" : ": " + text)))))
                    .onStatus(HttpStatusCode::is5xxServerError, response ->
                            Mono.error(new ServiceUnavailableException(SERVICE_NAME,
                                    "Bank gateway temporarily unavailable (" + response.statusCode().value() + ")")))
                    .bodyToMono(NetBankingResponse.class)
                    .block();
        } catch (WebClientRequestException e) {
            throw new ServiceUnavailableException(SERVICE_NAME, "Bank gateway unreachable: " + e.getMessage(), e);
        } catch (WebClientException | CodecException e) {
            throw new ServiceUnavailableException(SERVICE_NAME, "Unreadable bank gateway response: " + e.getMessage(), e);
        }
    }

    /**
     * The bank answered with a client error: a final decline for this request.
     */
    private static class BankRejectionException extends RuntimeException {
        BankRejectionException(String message) {
            super(message);
        }
    }
}
