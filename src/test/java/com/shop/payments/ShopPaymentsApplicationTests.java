package com.shop.payments;

import com.shop.payments.core.ReconciliationEngine;
import com.shop.payments.gateway.MockGatewayClient;
import com.shop.payments.gateway.PaymentGatewayClient;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.TestPropertySource;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Verifies that the application context wires up with the in-process gateway and an
 * in-memory database. Redis and Kafka clients connect lazily, so neither has to be running.
 */
@SpringBootTest(classes = ShopPaymentsApplication.class)
@TestPropertySource(properties = {
        "spring.datasource.url=jdbc:h2:mem:shop;MODE=PostgreSQL;DB_CLOSE_DELAY=-1",
        "spring.datasource.driver-class-name=org.h2.Driver",
        "spring.datasource.username=sa",
        "spring.datasource.password=",
        "spring.jpa.hibernate.ddl-auto=create-drop",
        "shop.payments.gateway.mode=mock",
        "shop.payments.gateway.webhook-secret=local-webhook-secret"
})
class ShopPaymentsApplicationTests {

    @Autowired
    private ReconciliationEngine engine;

    @Autowired
    private PaymentGatewayClient gateway;

    @Test
    void contextLoads() {
        assertThat(engine).isNotNull();
        assertThat(gateway).isInstanceOf(MockGatewayClient.class);
    }
}
