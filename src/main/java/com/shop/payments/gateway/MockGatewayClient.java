package com.shop.payments.gateway;

import com.shop.payments.domain.ChargeVerdict;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process gateway for local runs: every started charge is reported as paid on the next
 * status lookup. Signatures are still checked with the configured secret, so webhooks can be
 * exercised with {@link WebhookSignatureVerifier#sign(String)}.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "shop.payments.gateway.mode", havingValue = "mock")
public class MockGatewayClient implements PaymentGatewayClient {

    private final WebhookSignatureVerifier signatureVerifier;
    private final Map<String, Long> startedCharges = new ConcurrentHashMap<>();

    public MockGatewayClient(WebhookSignatureVerifier signatureVerifier) {
        this.signatureVerifier = signatureVerifier;
    }

    @Override
    public ChargeInitialization startCharge(ChargeRequest request) {
        long minor = CurrencyUnits.toMinorUnits(request.getAmount());
        startedCharges.put(request.getReference(), minor);
        String accessCode = "mock_" + UUID.randomUUID().toString().substring(0, 12);
        log.debug("MockGatewayClient started charge reference={} amountMinor={}", request.getReference(), minor);
        return ChargeInitialization.builder()
                .authorizationUrl("https://checkout.mock.local/" + accessCode)
                .accessCode(accessCode)
                .rawPayload("{\"mock\":true,\"reference\":\"" + request.getReference() + "\"}")
                .build();
    }

    @Override
    public ChargeVerdict fetchChargeStatus(String reference) {
        Long minor = startedCharges.get(reference);
        if (minor == null) {
            throw new ReferenceNotFoundException(reference);
        }
        String paidAt = Instant.now().toString();
        return ChargeVerdict.builder()
                .status("success")
                .channel("card")
                .gatewayMessage("Approved")
                .paidAtRaw(paidAt)
                .amountMinor(minor)
                .gatewayTransactionId("mock-" + reference)
                .rawPayload("{\"mock\":true,\"status\":\"success\",\"reference\":\"" + reference
                        + "\",\"amount\":" + minor + ",\"paid_at\":\"" + paidAt + "\"}")
                .build();
    }

    @Override
    public boolean verifyNotificationSignature(String rawBody, String signatureHeader) {
        return signatureVerifier.verify(rawBody, signatureHeader);
    }
}
