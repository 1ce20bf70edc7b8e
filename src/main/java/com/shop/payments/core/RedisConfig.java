package com.shop.payments.core;

import com.shop.payments.domain.PaymentView;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.StringRedisSerializer;

/**
 * Redis template for the resolved-payment cache. Values are stored with
 * {@link PaymentViewRedisSerializer} (plain JSON, no type information).
 */
@Configuration
public class RedisConfig {

    @Bean
    public RedisTemplate<String, PaymentView> paymentViewRedisTemplate(RedisConnectionFactory connectionFactory) {
        RedisTemplate<String, PaymentView> template = new RedisTemplate<>();
        template.setConnectionFactory(connectionFactory);
        template.setKeySerializer(new StringRedisSerializer());
        template.setValueSerializer(new PaymentViewRedisSerializer());
        template.setHashKeySerializer(new StringRedisSerializer());
        template.setHashValueSerializer(new PaymentViewRedisSerializer());
        template.afterPropertiesSet();
        return template;
    }
}
