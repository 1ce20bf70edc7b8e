package com.shop.payments.api;

import com.shop.payments.core.NotificationOutcome;
import com.shop.payments.core.ReconciliationEngine;
import com.shop.payments.core.RequestVelocityService;
import com.shop.payments.domain.InitializationResult;
import com.shop.payments.domain.InitializePaymentCommand;
import com.shop.payments.domain.PaymentCurrency;
import com.shop.payments.domain.PaymentView;
import com.shop.payments.gateway.FeeQuote;
import com.shop.payments.gateway.GatewayFees;
import com.shop.payments.security.AuthenticatedUser;
import com.shop.payments.security.CurrentUser;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * REST API for starting, verifying and reading payments, plus the gateway webhook.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/payments")
@RequiredArgsConstructor
@Tag(name = "Payments", description = "Initialize and reconcile order payments")
public class PaymentController {

    static final String SIGNATURE_HEADER = "X-Signature";
    private static final int MIN_REFERENCE_LENGTH = 10;
    private static final int MAX_REFERENCE_LENGTH = 100;

    private final ReconciliationEngine engine;
    private final RequestVelocityService requestVelocityService;
    private final ClientIpResolver clientIpResolver;

    @PostMapping("/initialize")
    @Operation(
            summary = "Initialize payment",
            description = "Starts a gateway charge for the caller's unpaid order and returns the checkout URL. "
                    + "If a payment for the order is already pending it is returned unchanged with 200; "
                    + "a new payment returns 201.")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "201", description = "Payment initialized"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Payment already initialized"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Order already paid or not payable"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "429", description = "Too many initializations from this user or IP"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "502", description = "Gateway refused or unreachable")
    })
    public ResponseEntity<ApiResponse<InitializePaymentResponseDto>> initialize(
            @Valid @RequestBody InitializePaymentRequestDto dto, HttpServletRequest httpRequest) {
        AuthenticatedUser user = CurrentUser.require(httpRequest);

        RequestVelocityService.VelocitySnapshot velocity =
                requestVelocityService.recordAndCheck(user.getUserId(), clientIpResolver.resolve(httpRequest));
        if (velocity.isOverThreshold()) {
            log.warn("Request velocity over threshold: userId={} userCount={} ipCount={}",
                    user.getUserId(), velocity.getUserCountLast60s(), velocity.getIpCountLast60s());
            throw new PaymentException(ErrorCode.TOO_MANY_REQUESTS);
        }

        InitializationResult result = engine.initialize(InitializePaymentCommand.builder()
                .orderId(dto.getOrderId())
                .requestingUserId(user.getUserId())
                .email(dto.getEmail())
                .currency(dto.getCurrency())
                .metadata(dto.getMetadata())
                .callbackUrl(dto.getCallbackUrl())
                .build());

        InitializePaymentResponseDto body =
                InitializePaymentResponseDto.from(PaymentResponseDto.from(result.getPayment()));
        if (result.isCreated()) {
            return ResponseEntity.status(HttpStatus.CREATED)
                    .body(ApiResponse.ok("Payment initialized successfully", body));
        }
        return ResponseEntity.ok(ApiResponse.ok("Payment already initialized", body));
    }

    @GetMapping("/verify/{reference}")
    @Operation(summary = "Verify payment",
            description = "Asks the gateway for the result of the caller's payment and applies it. "
                    + "Payments that already reached a final state are returned without a gateway call.")
    public ResponseEntity<ApiResponse<Map<String, PaymentResponseDto>>> verify(
            @PathVariable String reference, HttpServletRequest httpRequest) {
        AuthenticatedUser user = CurrentUser.require(httpRequest);
        if (reference.length() < MIN_REFERENCE_LENGTH || reference.length() > MAX_REFERENCE_LENGTH) {
            throw new PaymentException(ErrorCode.VALIDATION_FAILED, "Invalid reference format");
        }
        PaymentView payment = engine.verifyByPolling(reference, user.getUserId());
        return ResponseEntity.ok(ApiResponse.ok("Payment " + payment.getStatus().name().toLowerCase(Locale.ROOT),
                Map.of("payment", PaymentResponseDto.from(payment))));
    }

    @PostMapping("/webhook")
    @Operation(summary = "Gateway webhook",
            description = "Signed charge notifications from the gateway. The body is verified with HMAC-SHA512 "
                    + "against the " + SIGNATURE_HEADER + " header before it is read. Acknowledged with 200 once "
                    + "the signature passes.")
    public ResponseEntity<ApiResponse<Void>> webhook(
            @RequestBody String rawBody,
            @RequestHeader(value = SIGNATURE_HEADER, required = false) String signature) {
        NotificationOutcome outcome = engine.handleNotification(rawBody, signature);
        log.debug("Webhook handled: outcome={}", outcome);
        return ResponseEntity.ok(ApiResponse.ok("Webhook processed", null));
    }

    @GetMapping("/history")
    @Operation(summary = "Payment history", description = "The caller's payments, newest first.")
    public ResponseEntity<ApiResponse<Map<String, List<PaymentResponseDto>>>> history(
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "10") int limit,
            @RequestParam(required = false) String status,
            @RequestParam(required = false) String startDate,
            @RequestParam(required = false) String endDate,
            HttpServletRequest httpRequest) {
        AuthenticatedUser user = CurrentUser.require(httpRequest);
        ListingParams.checkPage(page, limit);
        Page<PaymentView> payments = engine.history(user.getUserId(),
                ListingParams.criteria(user.getUserId(), status, startDate, endDate), page, limit);
        return ResponseEntity.ok(listing(payments, page, limit, false));
    }

    @GetMapping("/admin/all")
    @Operation(summary = "All payments (admin)", description = "Every payment, with the gateway's raw payload.")
    public ResponseEntity<ApiResponse<Map<String, List<PaymentResponseDto>>>> all(
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "10") int limit,
            @RequestParam(required = false) String status,
            @RequestParam(required = false) String startDate,
            @RequestParam(required = false) String endDate,
            HttpServletRequest httpRequest) {
        CurrentUser.requireAdmin(httpRequest);
        ListingParams.checkPage(page, limit);
        Page<PaymentView> payments = engine.listAll(
                ListingParams.criteria(null, status, startDate, endDate), page, limit);
        return ResponseEntity.ok(listing(payments, page, limit, true));
    }

    @GetMapping("/fees")
    @Operation(summary = "Fee quote", description = "Gateway fee for charging the given amount.")
    public ResponseEntity<ApiResponse<FeeQuote>> fees(
            @RequestParam BigDecimal amount,
            @RequestParam(required = false) PaymentCurrency currency,
            HttpServletRequest httpRequest) {
        CurrentUser.require(httpRequest);
        if (amount.signum() < 0) {
            throw new PaymentException(ErrorCode.VALIDATION_FAILED, "amount must not be negative");
        }
        return ResponseEntity.ok(ApiResponse.ok(
                GatewayFees.calculate(amount, currency != null ? currency : PaymentCurrency.NGN)));
    }

    @GetMapping("/{reference}")
    @Operation(summary = "Get payment", description = "A payment by reference, for its owner or an admin.")
    public ResponseEntity<ApiResponse<Map<String, PaymentResponseDto>>> get(
            @PathVariable String reference, HttpServletRequest httpRequest) {
        AuthenticatedUser user = CurrentUser.require(httpRequest);
        PaymentView payment = engine.getByReference(reference, user.getUserId(), user.isAdmin());
        return ResponseEntity.ok(ApiResponse.ok(Map.of("payment", PaymentResponseDto.from(payment, user.isAdmin()))));
    }

    private static ApiResponse<Map<String, List<PaymentResponseDto>>> listing(
            Page<PaymentView> payments, int page, int limit, boolean includeRawPayload) {
        List<PaymentResponseDto> items = payments.getContent().stream()
                .map(p -> PaymentResponseDto.from(p, includeRawPayload))
                .toList();
        return ApiResponse.<Map<String, List<PaymentResponseDto>>>builder()
                .status(ApiResponse.SUCCESS)
                .results(items.size())
                .pagination(ListingParams.pagination(payments, page, limit))
                .data(Map.of("payments", items))
                .build();
    }
}
