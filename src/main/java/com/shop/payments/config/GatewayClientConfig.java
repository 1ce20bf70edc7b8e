package com.shop.payments.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

/**
 * HTTP client for the payment gateway. Connect and read timeouts are bounded so a slow
 * gateway surfaces as unavailable instead of hanging the request.
 */
@Configuration
public class GatewayClientConfig {

    @Bean(name = "gatewayRestTemplate")
    public RestTemplate gatewayRestTemplate(
            @Value("${shop.payments.gateway.connect-timeout-ms:5000}") int connectTimeoutMs,
            @Value("${shop.payments.gateway.read-timeout-ms:10000}") int readTimeoutMs) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(connectTimeoutMs);
        factory.setReadTimeout(readTimeoutMs);
        return new RestTemplate(factory);
    }
}
