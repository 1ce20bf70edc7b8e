package com.shop.payments.core;

import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.HexFormat;

/**
 * Builds payment references of the form {@code ORDER-{orderId}-{epochMillis}-{random}}.
 * The random part is 64 bits from {@link SecureRandom}, so references cannot be guessed
 * from the order id and time.
 */
@Component
public class ReferenceGenerator {

    static final String PREFIX = "ORDER-";

    private final SecureRandom random = new SecureRandom();

    public String generate(String orderId) {
        byte[] bytes = new byte[8];
        random.nextBytes(bytes);
        return PREFIX + orderId + "-" + System.currentTimeMillis() + "-" + HexFormat.of().formatHex(bytes);
    }
}
