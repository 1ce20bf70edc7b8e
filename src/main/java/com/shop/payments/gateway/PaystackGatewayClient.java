package com.shop.payments.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shop.payments.domain.ChargeVerdict;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Paystack-style HTTP gateway. Every call runs behind the {@code paymentGateway} circuit
 * breaker; status lookups are also retried because they are read-only. Starting a charge is
 * never retried here.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "shop.payments.gateway.mode", havingValue = "paystack", matchIfMissing = true)
public class PaystackGatewayClient implements PaymentGatewayClient {

    static final String RESILIENCE_INSTANCE = "paymentGateway";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final WebhookSignatureVerifier signatureVerifier;
    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final RetryRegistry retryRegistry;
    private final String baseUrl;
    private final String secretKey;

    public PaystackGatewayClient(@Qualifier("gatewayRestTemplate") RestTemplate restTemplate,
                                 ObjectMapper objectMapper,
                                 WebhookSignatureVerifier signatureVerifier,
                                 CircuitBreakerRegistry circuitBreakerRegistry,
                                 RetryRegistry retryRegistry,
                                 @Value("${shop.payments.gateway.base-url:https://api.paystack.co}") String baseUrl,
                                 @Value("${shop.payments.gateway.secret-key:}") String secretKey) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.signatureVerifier = signatureVerifier;
        this.circuitBreakerRegistry = circuitBreakerRegistry;
        this.retryRegistry = retryRegistry;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.secretKey = secretKey;
    }

    @Override
    public ChargeInitialization startCharge(ChargeRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("email", request.getEmail());
        body.put("amount", CurrencyUnits.toMinorUnits(request.getAmount()));
        body.put("reference", request.getReference());
        body.put("currency", request.getCurrency().name());
        if (request.getMetadata() != null) {
            body.put("metadata", request.getMetadata());
        }
        if (request.getCallbackUrl() != null) {
            body.put("callback_url", request.getCallbackUrl());
        }

        CircuitBreaker cb = circuitBreakerRegistry.circuitBreaker(RESILIENCE_INSTANCE);
        Supplier<ChargeInitialization> call = () -> {
            String responseBody = exchange(HttpMethod.POST, "/transaction/initialize", body, request.getReference());
            JsonNode data = readAccepted(responseBody).path("data");
            if (!data.hasNonNull("authorization_url")) {
                throw new GatewayRejectedException("Gateway response has no authorization_url for reference "
                        + request.getReference());
            }
            return ChargeInitialization.builder()
                    .authorizationUrl(data.path("authorization_url").asText())
                    .accessCode(data.path("access_code").asText(null))
                    .rawPayload(responseBody)
                    .build();
        };

        try {
            ChargeInitialization result = CircuitBreaker.decorateSupplier(cb, call).get();
            log.info("Charge started at gateway: reference={}", request.getReference());
            return result;
        } catch (CallNotPermittedException e) {
            throw new GatewayUnavailableException("Gateway circuit is open", e);
        }
    }

    @Override
    public ChargeVerdict fetchChargeStatus(String reference) {
        CircuitBreaker cb = circuitBreakerRegistry.circuitBreaker(RESILIENCE_INSTANCE);
        Retry retry = retryRegistry.retry(RESILIENCE_INSTANCE);
        Supplier<ChargeVerdict> call = () -> {
            String responseBody = exchange(HttpMethod.GET, "/transaction/verify/" + reference, null, reference);
            JsonNode data = readAccepted(responseBody).path("data");
            if (!data.isObject()) {
                throw new GatewayRejectedException("Gateway response has no charge data for reference " + reference);
            }
            return ChargeDataMapper.toVerdict(data, responseBody);
        };
        Supplier<ChargeVerdict> withRetry = Retry.decorateSupplier(retry, call);
        Supplier<ChargeVerdict> withCb = CircuitBreaker.decorateSupplier(cb, withRetry);

        try {
            ChargeVerdict verdict = withCb.get();
            log.info("Gateway status fetched: reference={}, status={}", reference, verdict.getStatus());
            return verdict;
        } catch (CallNotPermittedException e) {
            throw new GatewayUnavailableException("Gateway circuit is open", e);
        }
    }

    @Override
    public boolean verifyNotificationSignature(String rawBody, String signatureHeader) {
        return signatureVerifier.verify(rawBody, signatureHeader);
    }

    /**
     * Performs the HTTP call and translates every failure into a gateway exception so the
     * circuit breaker and retry see domain failures only. Returns the body text as received.
     */
    private String exchange(HttpMethod method, String path, Object body, String reference) {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(secretKey);
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));

        ResponseEntity<String> response;
        try {
            response = restTemplate.exchange(baseUrl + path, method, new HttpEntity<>(body, headers), String.class);
        } catch (RestClientResponseException e) {
            int status = e.getStatusCode().value();
            if (status == HttpStatus.NOT_FOUND.value() && method == HttpMethod.GET) {
                throw new ReferenceNotFoundException(reference);
            }
            if (e.getStatusCode().is5xxServerError() || status == HttpStatus.TOO_MANY_REQUESTS.value()) {
                log.warn("Gateway answered {} for {} {} (reference={})", status, method, path, reference);
                throw new GatewayUnavailableException("Gateway error " + status, e);
            }
            log.warn("Gateway rejected {} {} with {} (reference={}): {}", method, path, status, reference,
                    e.getResponseBodyAsString());
            throw new GatewayRejectedException("Gateway rejected request with status " + status, e);
        } catch (ResourceAccessException e) {
            log.warn("Gateway unreachable for {} {} (reference={}): {}", method, path, reference, e.getMessage());
            throw new GatewayUnavailableException("Gateway unreachable: " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw new GatewayUnavailableException("Gateway call failed: " + e.getMessage(), e);
        }
        return response.getBody() != null ? response.getBody() : "{}";
    }

    private JsonNode readAccepted(String responseBody) {
        JsonNode root;
        try {
            root = objectMapper.readTree(responseBody);
        } catch (IOException e) {
            throw new GatewayUnavailableException("Gateway returned unreadable body", e);
        }
        if (!root.path("status").asBoolean(false)) {
            throw new GatewayRejectedException("Gateway refused request: " + root.path("message").asText("no message"));
        }
        return root;
    }
}
