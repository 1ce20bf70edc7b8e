package com.shop.payments;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shop.payments.domain.PaymentStatus;
import com.shop.payments.gateway.WebhookSignatureVerifier;
import com.shop.payments.persistence.entity.OrderEntity;
import com.shop.payments.persistence.entity.PaymentEntity;
import com.shop.payments.persistence.entity.ProductEntity;
import com.shop.payments.persistence.repository.OrderRepository;
import com.shop.payments.persistence.repository.PaymentRepository;
import com.shop.payments.persistence.repository.ProductRepository;
import com.shop.payments.security.AuthenticatedUser;
import com.shop.payments.security.JwtTokenProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.kafka.test.context.EmbeddedKafka;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.math.BigDecimal;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Integration test: checkout, payment initialization, verification and webhook against real
 * Postgres and Redis (Testcontainers) and Embedded Kafka, with the in-process mock gateway.
 * Skipped when no Docker daemon is available.
 */
@Tag("integration")
@SpringBootTest(classes = ShopPaymentsApplication.class, properties = {
        "shop.payments.gateway.mode=mock",
        "shop.payments.gateway.webhook-secret=integration-webhook-secret",
        "spring.jpa.hibernate.ddl-auto=create-drop"
})
@AutoConfigureMockMvc
@EmbeddedKafka(partitions = 1, topics = {"payment-events"},
        bootstrapServersProperty = "spring.kafka.bootstrap-servers")
@Testcontainers(disabledWithoutDocker = true)
class PaymentReconciliationIntegrationTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>(DockerImageName.parse("postgres:16-alpine"));

    @Container
    static GenericContainer<?> redis = new GenericContainer<>(DockerImageName.parse("redis:7-alpine"))
            .withExposedPorts(6379);

    @DynamicPropertySource
    static void infrastructureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.data.redis.host", redis::getHost);
        registry.add("spring.data.redis.port", () -> redis.getMappedPort(6379).toString());
    }

    @Autowired
    private MockMvc mockMvc;
    @Autowired
    private ObjectMapper objectMapper;
    @Autowired
    private JwtTokenProvider jwtTokenProvider;
    @Autowired
    private WebhookSignatureVerifier signatureVerifier;
    @Autowired
    private ProductRepository productRepository;
    @Autowired
    private OrderRepository orderRepository;
    @Autowired
    private PaymentRepository paymentRepository;

    private String productId;
    private String userToken;

    @BeforeEach
    void seedProduct() {
        productId = UUID.randomUUID().toString();
        productRepository.save(ProductEntity.builder()
                .id(productId).name("Desk lamp").price(new BigDecimal("2500.00")).stock(10).build());
        userToken = "Bearer " + jwtTokenProvider.createToken("buyer-" + productId, AuthenticatedUser.ROLE_USER);
    }

    private String createOrder(int quantity) throws Exception {
        String response = mockMvc.perform(post("/api/v1/orders")
                        .header("Authorization", userToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"orderItems\":[{\"product\":\"" + productId + "\",\"quantity\":" + quantity + "}]}"))
                .andExpect(status().isCreated())
                .andReturn().getResponse().getContentAsString();
        return objectMapper.readTree(response).path("data").path("order").path("id").asText();
    }

    private String initialize(String orderId, int expectedStatus) throws Exception {
        String response = mockMvc.perform(post("/api/v1/payments/initialize")
                        .header("Authorization", userToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"orderId\":\"" + orderId + "\",\"email\":\"buyer@example.com\"}"))
                .andExpect(status().is(expectedStatus))
                .andReturn().getResponse().getContentAsString();
        return objectMapper.readTree(response).path("data").path("reference").asText();
    }

    @Test
    @DisplayName("Checkout, initialize twice, verify: order paid once and stock reserved")
    void checkoutInitializeAndVerify() throws Exception {
        String orderId = createOrder(2);
        assertThat(productRepository.findById(productId)).get().extracting(ProductEntity::getStock).isEqualTo(8);

        String reference = initialize(orderId, 201);
        assertThat(reference).startsWith("ORDER-" + orderId + "-");
        assertThat(initialize(orderId, 200)).isEqualTo(reference);

        mockMvc.perform(get("/api/v1/payments/verify/" + reference).header("Authorization", userToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.payment.status").value("SUCCESS"));
        mockMvc.perform(get("/api/v1/payments/verify/" + reference).header("Authorization", userToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.payment.status").value("SUCCESS"));

        OrderEntity order = orderRepository.findById(orderId).orElseThrow();
        assertThat(order.isPaid()).isTrue();
        assertThat(order.getPaymentReference()).isEqualTo(reference);

        initialize(orderId, 409);
    }

    @Test
    @DisplayName("Signed webhook resolves payment; replay and bad signature change nothing")
    void webhookResolvesPayment() throws Exception {
        String orderId = createOrder(1);
        String reference = initialize(orderId, 201);
        String body = "{\"event\":\"charge.success\",\"data\":{\"reference\":\"" + reference
                + "\",\"status\":\"success\",\"amount\":250000,\"channel\":\"card\"}}";

        mockMvc.perform(post("/api/v1/payments/webhook")
                        .header("X-Signature", "deadbeef")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isBadRequest());
        assertThat(paymentRepository.findByReference(reference)).get()
                .extracting(PaymentEntity::getStatus).isEqualTo(PaymentStatus.PENDING);

        for (int i = 0; i < 2; i++) {
            mockMvc.perform(post("/api/v1/payments/webhook")
                            .header("X-Signature", signatureVerifier.sign(body))
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(body))
                    .andExpect(status().isOk());
        }

        assertThat(paymentRepository.findByReference(reference)).get()
                .extracting(PaymentEntity::getStatus).isEqualTo(PaymentStatus.SUCCESS);
        assertThat(orderRepository.findById(orderId)).get().extracting(OrderEntity::isPaid).isEqualTo(true);
    }

    @Test
    @DisplayName("Cancel restores stock and makes the order unpayable")
    void cancelRestoresStock() throws Exception {
        String orderId = createOrder(3);

        mockMvc.perform(put("/api/v1/orders/" + orderId + "/cancel").header("Authorization", userToken))
                .andExpect(status().isOk());
        mockMvc.perform(put("/api/v1/orders/" + orderId + "/cancel").header("Authorization", userToken))
                .andExpect(status().isConflict());

        assertThat(productRepository.findById(productId)).get().extracting(ProductEntity::getStock).isEqualTo(10);
        initialize(orderId, 409);

        JsonNode history = objectMapper.readTree(mockMvc.perform(get("/api/v1/payments/history")
                        .header("Authorization", userToken))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString());
        assertThat(history.path("results").asInt()).isZero();
    }
}
