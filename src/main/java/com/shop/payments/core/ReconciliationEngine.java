package com.shop.payments.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shop.payments.api.ErrorCode;
import com.shop.payments.api.PaymentException;
import com.shop.payments.compliance.ComplianceAuditLogger;
import com.shop.payments.domain.ChargeVerdict;
import com.shop.payments.domain.InitializationResult;
import com.shop.payments.domain.InitializePaymentCommand;
import com.shop.payments.domain.OrderStatus;
import com.shop.payments.domain.PaymentCurrency;
import com.shop.payments.domain.PaymentSearchCriteria;
import com.shop.payments.domain.PaymentStatus;
import com.shop.payments.domain.PaymentView;
import com.shop.payments.gateway.ChargeDataMapper;
import com.shop.payments.gateway.ChargeInitialization;
import com.shop.payments.gateway.ChargeRequest;
import com.shop.payments.gateway.GatewayRejectedException;
import com.shop.payments.gateway.GatewayUnavailableException;
import com.shop.payments.gateway.PaymentGatewayClient;
import com.shop.payments.gateway.ReferenceNotFoundException;
import com.shop.payments.messaging.PaymentEventProducer;
import com.shop.payments.persistence.entity.OrderEntity;
import com.shop.payments.persistence.entity.PaymentEntity;
import com.shop.payments.persistence.repository.OrderRepository;
import com.shop.payments.persistence.service.PaymentPersistenceService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Keeps orders and payments consistent across the three ways a verdict can arrive:
 * the customer starting a payment, the client polling for its result and the gateway
 * pushing a signed notification. All status changes go through {@link PaymentResolver}.
 * <p>
 * Gateway calls are made outside of any database transaction.
 */
@Slf4j
@Service
public class ReconciliationEngine {

    static final String EVENT_CHARGE_SUCCESS = "charge.success";
    static final String EVENT_CHARGE_FAILED = "charge.failed";

    private final PaymentGatewayClient gateway;
    private final PaymentResolver resolver;
    private final PaymentPersistenceService persistenceService;
    private final OrderRepository orderRepository;
    private final ReferenceGenerator referenceGenerator;
    private final ResolvedPaymentCache cache;
    private final PaymentEventProducer eventProducer;
    private final ComplianceAuditLogger auditLogger;
    private final ObjectMapper objectMapper;
    private final PaymentCurrency defaultCurrency;
    private final String callbackBaseUrl;

    public ReconciliationEngine(PaymentGatewayClient gateway,
                                PaymentResolver resolver,
                                PaymentPersistenceService persistenceService,
                                OrderRepository orderRepository,
                                ReferenceGenerator referenceGenerator,
                                ResolvedPaymentCache cache,
                                PaymentEventProducer eventProducer,
                                ComplianceAuditLogger auditLogger,
                                ObjectMapper objectMapper,
                                @Value("${shop.payments.default-currency:NGN}") PaymentCurrency defaultCurrency,
                                @Value("${shop.payments.callback-base-url:}") String callbackBaseUrl) {
        this.gateway = gateway;
        this.resolver = resolver;
        this.persistenceService = persistenceService;
        this.orderRepository = orderRepository;
        this.referenceGenerator = referenceGenerator;
        this.cache = cache;
        this.eventProducer = eventProducer;
        this.auditLogger = auditLogger;
        this.objectMapper = objectMapper;
        this.defaultCurrency = defaultCurrency;
        this.callbackBaseUrl = callbackBaseUrl;
        log.info("ReconciliationEngine using gateway={}, defaultCurrency={}", gateway.getGatewayName(), defaultCurrency);
    }

    /**
     * Start paying for an order, or return the payment already in progress for it.
     */
    public InitializationResult initialize(InitializePaymentCommand command) {
        String orderId = command.getOrderId();
        OrderEntity order = orderRepository.findById(orderId)
                .orElseThrow(() -> new PaymentException(ErrorCode.ORDER_NOT_FOUND, "Order not found: " + orderId));
        if (!order.getUserId().equals(command.getRequestingUserId())) {
            throw new PaymentException(ErrorCode.FORBIDDEN, "Not authorized to pay for this order");
        }
        if (order.isPaid()) {
            throw new PaymentException(ErrorCode.ALREADY_PAID);
        }
        if (order.getStatus() == OrderStatus.CANCELLED) {
            throw new PaymentException(ErrorCode.ORDER_NOT_PAYABLE, "Cancelled orders cannot be paid");
        }

        Optional<InitializationResult> existing = existingActivePayment(orderId);
        if (existing.isPresent()) {
            return existing.get();
        }

        PaymentCurrency currency = command.getCurrency() != null ? command.getCurrency() : defaultCurrency;
        String reference = referenceGenerator.generate(orderId);
        Map<String, Object> metadata = new HashMap<>();
        if (command.getMetadata() != null) {
            metadata.putAll(command.getMetadata());
        }
        metadata.put("orderId", orderId);
        metadata.put("userId", order.getUserId());

        ChargeInitialization charge;
        try {
            charge = gateway.startCharge(ChargeRequest.builder()
                    .email(command.getEmail())
                    .amount(order.getTotalPrice())
                    .reference(reference)
                    .currency(currency)
                    .metadata(metadata)
                    .callbackUrl(callbackUrl(command.getCallbackUrl()))
                    .build());
        } catch (GatewayUnavailableException | GatewayRejectedException e) {
            log.error("Gateway refused to start charge for orderId={} reference={}: {}", orderId, reference, e.getMessage());
            throw new PaymentException(ErrorCode.PAYMENT_INIT_FAILED, "Failed to initialize payment", e);
        }

        PaymentEntity entity = PaymentEntity.builder()
                .reference(reference)
                .userId(order.getUserId())
                .orderId(orderId)
                .email(command.getEmail())
                .amount(order.getTotalPrice())
                .currency(currency)
                .authorizationUrl(charge.getAuthorizationUrl())
                .accessCode(charge.getAccessCode())
                .rawPayload(charge.getRawPayload())
                .metadata(toJson(metadata))
                .build();

        PaymentView created;
        try {
            created = persistenceService.insertPending(entity);
        } catch (DataIntegrityViolationException e) {
            log.warn("Concurrent initialization for orderId={}; discarding charge reference={}", orderId, reference);
            return existingActivePayment(orderId)
                    .orElseThrow(() -> new PaymentException(ErrorCode.PAYMENT_INIT_FAILED,
                            "Concurrent payment initialization, retry", e));
        }

        log.info("Payment initialized: reference={}, orderId={}, amount={} {}",
                reference, orderId, created.getAmount(), created.getCurrency());
        auditLogger.logInitialization(created);
        eventProducer.publishInitialized(created);
        return new InitializationResult(created, true);
    }

    private Optional<InitializationResult> existingActivePayment(String orderId) {
        Optional<PaymentView> active = persistenceService.findActiveForOrder(orderId);
        if (active.isEmpty()) {
            return Optional.empty();
        }
        PaymentView payment = active.get();
        if (payment.getStatus() == PaymentStatus.SUCCESS) {
            throw new PaymentException(ErrorCode.ALREADY_PAID);
        }
        log.info("Returning pending payment reference={} for orderId={}", payment.getReference(), orderId);
        return Optional.of(new InitializationResult(payment, false));
    }

    /**
     * Apply a verdict. Safe to call any number of times, from any thread, in any order.
     */
    public PaymentView resolve(String reference, ChargeVerdict verdict) {
        return resolve(reference, verdict, "direct");
    }

    private PaymentView resolve(String reference, ChargeVerdict verdict, String source) {
        ResolutionOutcome outcome = resolver.resolve(reference, verdict);
        PaymentView payment = outcome.getPayment();
        if (outcome.isChanged()) {
            auditLogger.logResolution(payment, source, outcome.isOrderMarkedPaid());
            eventProducer.publishResolved(payment, outcome.isOrderMarkedPaid());
        }
        cache.store(payment);
        return payment;
    }

    /**
     * Ask the gateway for the verdict of one of the caller's payments and apply it.
     */
    public PaymentView verifyByPolling(String reference, String requestingUserId) {
        Optional<PaymentView> cached = cache.get(reference);
        PaymentView payment = cached.isPresent() ? cached.get() : persistenceService.findByReference(reference)
                .orElseThrow(() -> new PaymentException(ErrorCode.PAYMENT_NOT_FOUND, "Payment not found: " + reference));
        if (!payment.getUserId().equals(requestingUserId)) {
            throw new PaymentException(ErrorCode.FORBIDDEN, "Not authorized to verify this payment");
        }
        if (payment.isTerminal()) {
            cache.store(payment);
            return payment;
        }

        ChargeVerdict verdict;
        try {
            verdict = gateway.fetchChargeStatus(reference);
        } catch (GatewayUnavailableException | GatewayRejectedException | ReferenceNotFoundException e) {
            log.warn("Verification of reference={} failed at the gateway: {}", reference, e.getMessage());
            throw new PaymentException(ErrorCode.VERIFICATION_FAILED, "Payment verification failed", e);
        }
        return resolve(reference, verdict, "verify");
    }

    /**
     * Handle a gateway notification. The signature is checked before anything in the body is
     * read. Once it passes, the notification is always acknowledged.
     *
     * @throws PaymentException INVALID_SIGNATURE or MALFORMED_NOTIFICATION
     */
    public NotificationOutcome handleNotification(String rawBody, String signatureHeader) {
        if (!gateway.verifyNotificationSignature(rawBody, signatureHeader)) {
            auditLogger.logRejectedNotification(signatureHeader == null || signatureHeader.isBlank()
                    ? "missing signature" : "signature mismatch");
            throw new PaymentException(ErrorCode.INVALID_SIGNATURE);
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(rawBody);
        } catch (JsonProcessingException e) {
            throw new PaymentException(ErrorCode.MALFORMED_NOTIFICATION, "Invalid webhook payload", e);
        }
        if (root == null || !root.isObject() || !root.path("event").isTextual() || !root.path("data").isObject()) {
            throw new PaymentException(ErrorCode.MALFORMED_NOTIFICATION);
        }

        String event = root.get("event").asText();
        JsonNode data = root.get("data");
        String statusOverride;
        switch (event) {
            case EVENT_CHARGE_SUCCESS:
                statusOverride = "success";
                break;
            case EVENT_CHARGE_FAILED:
                statusOverride = "failed";
                break;
            default:
                log.info("Ignoring gateway notification event={}", event);
                return NotificationOutcome.IGNORED;
        }

        String reference = data.path("reference").asText(null);
        if (reference == null || reference.isBlank()) {
            log.warn("Notification event={} carries no reference; acknowledged without action", event);
            return NotificationOutcome.FAILED;
        }

        try {
            resolve(reference, ChargeDataMapper.toVerdict(data, statusOverride, rawBody), "webhook");
            return NotificationOutcome.PROCESSED;
        } catch (PaymentException e) {
            if (e.getErrorCode() == ErrorCode.PAYMENT_NOT_FOUND) {
                log.warn("Notification for unknown reference={} (event={}); acknowledged", reference, event);
                return NotificationOutcome.UNKNOWN_REFERENCE;
            }
            log.error("Notification processing failed for reference={} event={}", reference, event, e);
            return NotificationOutcome.FAILED;
        } catch (RuntimeException e) {
            log.error("Notification processing failed for reference={} event={}", reference, event, e);
            return NotificationOutcome.FAILED;
        }
    }

    public Page<PaymentView> history(String userId, PaymentSearchCriteria filters, int page, int limit) {
        PaymentSearchCriteria criteria = PaymentSearchCriteria.builder()
                .userId(userId)
                .status(filters.getStatus())
                .startDate(filters.getStartDate())
                .endDate(filters.getEndDate())
                .build();
        return persistenceService.search(criteria, page, limit);
    }

    public Page<PaymentView> listAll(PaymentSearchCriteria filters, int page, int limit) {
        return persistenceService.search(filters, page, limit);
    }

    public PaymentView getByReference(String reference, String requestingUserId, boolean admin) {
        PaymentView payment = cache.get(reference)
                .or(() -> persistenceService.findByReference(reference))
                .orElseThrow(() -> new PaymentException(ErrorCode.PAYMENT_NOT_FOUND, "Payment not found: " + reference));
        if (!admin && !payment.getUserId().equals(requestingUserId)) {
            throw new PaymentException(ErrorCode.FORBIDDEN, "Not authorized to view this payment");
        }
        return payment;
    }

    private String callbackUrl(String requested) {
        if (requested != null && !requested.isBlank()) {
            return requested;
        }
        return callbackBaseUrl == null || callbackBaseUrl.isBlank() ? null : callbackBaseUrl;
    }

    private String toJson(Map<String, Object> metadata) {
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize payment metadata: {}", e.getMessage());
            return null;
        }
    }
}
