package com.shop.payments.api;

import com.shop.payments.core.NotificationOutcome;
import com.shop.payments.core.ReconciliationEngine;
import com.shop.payments.core.RequestVelocityService;
import com.shop.payments.domain.InitializationResult;
import com.shop.payments.domain.PaymentCurrency;
import com.shop.payments.domain.PaymentSearchCriteria;
import com.shop.payments.domain.PaymentStatus;
import com.shop.payments.domain.PaymentView;
import com.shop.payments.security.AuthenticatedUser;
import com.shop.payments.security.JwtTokenProvider;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Unit tests for PaymentController using MockMvc.
 */
@WebMvcTest(controllers = PaymentController.class)
@Import({JwtTokenProvider.class, ClientIpResolver.class})
class PaymentControllerTest {

    private static final String REFERENCE = "ORDER-O1-1704067200000-0011223344556677";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private JwtTokenProvider jwtTokenProvider;

    @MockitoBean
    private ReconciliationEngine engine;

    @MockitoBean
    private RequestVelocityService requestVelocityService;

    private String bearer(String userId, String role) {
        return "Bearer " + jwtTokenProvider.createToken(userId, role);
    }

    private static PaymentView payment(PaymentStatus status) {
        return PaymentView.builder()
                .id("p-1")
                .reference(REFERENCE)
                .userId("u1")
                .orderId("O1")
                .email("buyer@example.com")
                .amount(new BigDecimal("5000.00"))
                .currency(PaymentCurrency.NGN)
                .status(status)
                .authorizationUrl("https://checkout.test/abc")
                .accessCode("abc")
                .rawPayload("{\"gateway\":\"raw\"}")
                .createdAt(Instant.parse("2024-01-01T00:00:00Z"))
                .build();
    }

    private void velocityOk() {
        when(requestVelocityService.recordAndCheck(any(), any()))
                .thenReturn(new RequestVelocityService.VelocitySnapshot(1, 1, false));
    }

    @Test
    void initializeWithoutTokenIsUnauthorized() throws Exception {
        mockMvc.perform(post("/api/v1/payments/initialize")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"orderId": "O1", "email": "buyer@example.com"}
                                """))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.status").value("error"));
        verifyNoInteractions(engine);
    }

    @Test
    void initializeReturnsCreatedForNewPayment() throws Exception {
        velocityOk();
        when(engine.initialize(any())).thenReturn(new InitializationResult(payment(PaymentStatus.PENDING), true));

        mockMvc.perform(post("/api/v1/payments/initialize")
                        .header("Authorization", bearer("u1", AuthenticatedUser.ROLE_USER))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "orderId": "O1",
                                  "email": "buyer@example.com",
                                  "callback_url": "https://shop.test/return"
                                }
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.status").value("success"))
                .andExpect(jsonPath("$.message").value("Payment initialized successfully"))
                .andExpect(jsonPath("$.data.reference").value(REFERENCE))
                .andExpect(jsonPath("$.data.authorizationUrl").value("https://checkout.test/abc"))
                .andExpect(jsonPath("$.data.payment.status").value("PENDING"))
                .andExpect(jsonPath("$.data.payment.rawPayload").doesNotExist());
    }

    @Test
    void initializeReturnsOkForExistingPendingPayment() throws Exception {
        velocityOk();
        when(engine.initialize(any())).thenReturn(new InitializationResult(payment(PaymentStatus.PENDING), false));

        mockMvc.perform(post("/api/v1/payments/initialize")
                        .header("Authorization", bearer("u1", AuthenticatedUser.ROLE_USER))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"orderId": "O1", "email": "buyer@example.com"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Payment already initialized"));
    }

    @Test
    void initializeRejectsInvalidEmail() throws Exception {
        mockMvc.perform(post("/api/v1/payments/initialize")
                        .header("Authorization", bearer("u1", AuthenticatedUser.ROLE_USER))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"orderId": "O1", "email": "not-an-email"}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Valid email is required"))
                .andExpect(jsonPath("$.data.email").exists());
        verifyNoInteractions(engine);
    }

    @Test
    void initializeOfPaidOrderIsConflict() throws Exception {
        velocityOk();
        when(engine.initialize(any())).thenThrow(new PaymentException(ErrorCode.ALREADY_PAID));

        mockMvc.perform(post("/api/v1/payments/initialize")
                        .header("Authorization", bearer("u1", AuthenticatedUser.ROLE_USER))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"orderId": "O1", "email": "buyer@example.com"}
                                """))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.message").value("Order is already paid"));
    }

    @Test
    void initializeOverVelocityThresholdIsTooManyRequests() throws Exception {
        when(requestVelocityService.recordAndCheck(eq("u1"), any()))
                .thenReturn(new RequestVelocityService.VelocitySnapshot(6, 6, true));

        mockMvc.perform(post("/api/v1/payments/initialize")
                        .header("Authorization", bearer("u1", AuthenticatedUser.ROLE_USER))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"orderId": "O1", "email": "buyer@example.com"}
                                """))
                .andExpect(status().isTooManyRequests());
        verifyNoInteractions(engine);
    }

    @Test
    void velocityIsKeyedBySocketAddressNotForwardedHeader() throws Exception {
        velocityOk();
        when(engine.initialize(any())).thenReturn(new InitializationResult(payment(PaymentStatus.PENDING), true));

        mockMvc.perform(post("/api/v1/payments/initialize")
                        .header("Authorization", bearer("u1", AuthenticatedUser.ROLE_USER))
                        .header("X-Forwarded-For", "203.0.113.77")
                        .with(request -> {
                            request.setRemoteAddr("198.51.100.5");
                            return request;
                        })
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"orderId": "O1", "email": "buyer@example.com"}
                                """))
                .andExpect(status().isCreated());

        verify(requestVelocityService).recordAndCheck("u1", "198.51.100.5");
    }

    @Test
    void verifyReportsResolvedStatus() throws Exception {
        when(engine.verifyByPolling(REFERENCE, "u1")).thenReturn(payment(PaymentStatus.SUCCESS));

        mockMvc.perform(get("/api/v1/payments/verify/" + REFERENCE)
                        .header("Authorization", bearer("u1", AuthenticatedUser.ROLE_USER)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Payment success"))
                .andExpect(jsonPath("$.data.payment.status").value("SUCCESS"));
    }

    @Test
    void verifyRejectsShortReference() throws Exception {
        mockMvc.perform(get("/api/v1/payments/verify/abc")
                        .header("Authorization", bearer("u1", AuthenticatedUser.ROLE_USER)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Invalid reference format"));
        verifyNoInteractions(engine);
    }

    @Test
    void verifyGatewayFailureIsBadGateway() throws Exception {
        when(engine.verifyByPolling(REFERENCE, "u1"))
                .thenThrow(new PaymentException(ErrorCode.VERIFICATION_FAILED, "Payment verification failed"));

        mockMvc.perform(get("/api/v1/payments/verify/" + REFERENCE)
                        .header("Authorization", bearer("u1", AuthenticatedUser.ROLE_USER)))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.message").value("Payment verification failed"));
    }

    @Test
    void webhookWithBadSignatureIsBadRequest() throws Exception {
        String body = "{\"event\":\"charge.success\",\"data\":{\"reference\":\"" + REFERENCE + "\"}}";
        when(engine.handleNotification(body, "bad")).thenThrow(new PaymentException(ErrorCode.INVALID_SIGNATURE));

        mockMvc.perform(post("/api/v1/payments/webhook")
                        .header(PaymentController.SIGNATURE_HEADER, "bad")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Invalid signature"));
    }

    @Test
    void webhookIsAcknowledgedWithoutToken() throws Exception {
        String body = "{\"event\":\"charge.success\",\"data\":{\"reference\":\"" + REFERENCE + "\"}}";
        when(engine.handleNotification(body, "good")).thenReturn(NotificationOutcome.UNKNOWN_REFERENCE);

        mockMvc.perform(post("/api/v1/payments/webhook")
                        .header(PaymentController.SIGNATURE_HEADER, "good")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Webhook processed"));
    }

    @Test
    void historyReturnsPageOfCallersPayments() throws Exception {
        when(engine.history(eq("u1"), any(), eq(2), eq(1)))
                .thenReturn(new PageImpl<>(List.of(payment(PaymentStatus.SUCCESS)), PageRequest.of(1, 1), 3));

        mockMvc.perform(get("/api/v1/payments/history")
                        .param("page", "2")
                        .param("limit", "1")
                        .param("status", "success")
                        .param("startDate", "2024-01-01")
                        .header("Authorization", bearer("u1", AuthenticatedUser.ROLE_USER)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.results").value(1))
                .andExpect(jsonPath("$.pagination.page").value(2))
                .andExpect(jsonPath("$.pagination.total").value(3))
                .andExpect(jsonPath("$.pagination.pages").value(3))
                .andExpect(jsonPath("$.data.payments[0].reference").value(REFERENCE))
                .andExpect(jsonPath("$.data.payments[0].rawPayload").doesNotExist());

        ArgumentCaptor<PaymentSearchCriteria> criteria = ArgumentCaptor.forClass(PaymentSearchCriteria.class);
        verify(engine).history(eq("u1"), criteria.capture(), eq(2), eq(1));
        assertThat(criteria.getValue().getStatus()).isEqualTo(PaymentStatus.SUCCESS);
        assertThat(criteria.getValue().getStartDate()).isEqualTo(Instant.parse("2024-01-01T00:00:00Z"));
    }

    @Test
    void historyRejectsOversizedLimitAndBadDates() throws Exception {
        mockMvc.perform(get("/api/v1/payments/history")
                        .param("limit", "101")
                        .header("Authorization", bearer("u1", AuthenticatedUser.ROLE_USER)))
                .andExpect(status().isBadRequest());
        mockMvc.perform(get("/api/v1/payments/history")
                        .param("startDate", "yesterday")
                        .header("Authorization", bearer("u1", AuthenticatedUser.ROLE_USER)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("startDate must be an ISO-8601 date"));
        verifyNoInteractions(engine);
    }

    @Test
    void adminListingIsForbiddenForUsers() throws Exception {
        mockMvc.perform(get("/api/v1/payments/admin/all")
                        .header("Authorization", bearer("u1", AuthenticatedUser.ROLE_USER)))
                .andExpect(status().isForbidden());
        verifyNoInteractions(engine);
    }

    @Test
    void adminListingIncludesRawPayload() throws Exception {
        when(engine.listAll(any(), anyInt(), anyInt()))
                .thenReturn(new PageImpl<>(List.of(payment(PaymentStatus.FAILED)), PageRequest.of(0, 10), 1));

        mockMvc.perform(get("/api/v1/payments/admin/all")
                        .header("Authorization", bearer("admin-1", AuthenticatedUser.ROLE_ADMIN)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.payments[0].rawPayload").value("{\"gateway\":\"raw\"}"));
    }

    @Test
    void feesAreQuotedForAmount() throws Exception {
        mockMvc.perform(get("/api/v1/payments/fees")
                        .param("amount", "5000")
                        .header("Authorization", bearer("u1", AuthenticatedUser.ROLE_USER)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data").exists());
    }

    @Test
    void getByReferenceShowsRawPayloadToAdminOnly() throws Exception {
        when(engine.getByReference(REFERENCE, "u1", false)).thenReturn(payment(PaymentStatus.SUCCESS));
        when(engine.getByReference(REFERENCE, "admin-1", true)).thenReturn(payment(PaymentStatus.SUCCESS));

        mockMvc.perform(get("/api/v1/payments/" + REFERENCE)
                        .header("Authorization", bearer("u1", AuthenticatedUser.ROLE_USER)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.payment.rawPayload").doesNotExist());
        mockMvc.perform(get("/api/v1/payments/" + REFERENCE)
                        .header("Authorization", bearer("admin-1", AuthenticatedUser.ROLE_ADMIN)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.payment.rawPayload").exists());
    }
}
