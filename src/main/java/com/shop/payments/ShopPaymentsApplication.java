package com.shop.payments;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the shop's order and payment service. Enables:
 * <ul>
 *   <li>Checkout and order management with stock reservation</li>
 *   <li>Payment initialization, verification polling and signed gateway webhooks</li>
 *   <li>Circuit breaker and retry around the gateway (Resilience4j)</li>
 *   <li>Redis cache of resolved payments and Kafka lifecycle events</li>
 *   <li>REST API and OpenAPI docs at /swagger-ui/index.html</li>
 * </ul>
 */
@SpringBootApplication
public class ShopPaymentsApplication {

    public static void main(String[] args) {
        SpringApplication.run(ShopPaymentsApplication.class, args);
    }
}
