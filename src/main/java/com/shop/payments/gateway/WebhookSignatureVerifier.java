package com.shop.payments.gateway;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;
import java.util.Locale;

/**
 * HMAC-SHA512 check of provider notifications. The digest is computed over the raw body
 * bytes and compared in constant time with the hex signature from the header.
 * Uses the webhook secret, or the charge secret key when no webhook secret is configured.
 */
@Slf4j
@Component
public class WebhookSignatureVerifier {

    static final String ALGORITHM = "HmacSHA512";

    private final byte[] secret;

    public WebhookSignatureVerifier(
            @Value("${shop.payments.gateway.webhook-secret:}") String webhookSecret,
            @Value("${shop.payments.gateway.secret-key:}") String secretKey) {
        String effective = StringUtils.hasText(webhookSecret) ? webhookSecret : secretKey;
        if (!StringUtils.hasText(effective)) {
            log.warn("No webhook secret or gateway secret key configured; every notification will be rejected");
        }
        this.secret = effective != null ? effective.getBytes(StandardCharsets.UTF_8) : new byte[0];
    }

    public boolean verify(String rawBody, String signatureHeader) {
        if (rawBody == null || !StringUtils.hasText(signatureHeader) || secret.length == 0) {
            return false;
        }
        byte[] expected = sign(rawBody).getBytes(StandardCharsets.US_ASCII);
        byte[] supplied = signatureHeader.trim().toLowerCase(Locale.ROOT).getBytes(StandardCharsets.US_ASCII);
        return MessageDigest.isEqual(expected, supplied);
    }

    /** Lower-case hex HMAC of the body. */
    public String sign(String rawBody) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secret, ALGORITHM));
            return HexFormat.of().formatHex(mac.doFinal(rawBody.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA512 unavailable", e);
        }
    }
}
