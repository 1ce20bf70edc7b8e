package com.shop.payments.core;

import com.shop.payments.domain.PaymentView;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.SerializationException;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;

/**
 * Read-through cache of payments that reached a terminal state. Terminal entries never
 * change, so a cached view is always current. Pending payments are never cached.
 * Redis problems are logged and treated as a miss; the database stays the source of truth.
 */
@Slf4j
@Service
public class ResolvedPaymentCache {

    static final String KEY_PREFIX = "payment:resolved:";

    private final RedisTemplate<String, PaymentView> redisTemplate;
    private final Duration ttl;

    public ResolvedPaymentCache(RedisTemplate<String, PaymentView> redisTemplate,
                                @Value("${shop.payments.cache.ttl-hours:24}") long ttlHours) {
        this.redisTemplate = redisTemplate;
        this.ttl = Duration.ofHours(ttlHours);
    }

    public Optional<PaymentView> get(String reference) {
        String key = KEY_PREFIX + reference;
        try {
            PaymentView cached = redisTemplate.opsForValue().get(key);
            if (cached != null && cached.isTerminal() && reference.equals(cached.getReference())) {
                log.debug("Resolved payment cache hit for reference={}", reference);
                return Optional.of(cached);
            }
            if (cached != null) {
                log.warn("Ignoring unusable cache entry for reference={} (status={})", reference, cached.getStatus());
            }
        } catch (SerializationException e) {
            log.error("Resolved payment cache entry unreadable for reference={}; falling back to database", reference, e);
        } catch (Exception e) {
            log.warn("Resolved payment cache read failed for reference={} (Redis unavailable): {}", reference, e.getMessage());
        }
        return Optional.empty();
    }

    public void store(PaymentView payment) {
        if (payment == null || !payment.isTerminal()) {
            return;
        }
        try {
            redisTemplate.opsForValue().set(KEY_PREFIX + payment.getReference(), payment, ttl);
            log.debug("Cached resolved payment reference={} status={}", payment.getReference(), payment.getStatus());
        } catch (Exception e) {
            log.warn("Failed to cache resolved payment reference={}: {}", payment.getReference(), e.getMessage());
        }
    }
}
