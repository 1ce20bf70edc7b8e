package com.shop.payments.core;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.shop.payments.domain.PaymentView;
import org.springframework.data.redis.serializer.RedisSerializer;
import org.springframework.data.redis.serializer.SerializationException;

import java.nio.charset.StandardCharsets;

/**
 * Serializes {@link PaymentView} to and from JSON for Redis. No {@code @class} property, so
 * entries written by older builds still read back as long as field names are unchanged.
 */
public class PaymentViewRedisSerializer implements RedisSerializer<PaymentView> {

    private final ObjectMapper mapper;

    public PaymentViewRedisSerializer() {
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Override
    public byte[] serialize(PaymentView value) throws SerializationException {
        if (value == null) return null;
        try {
            return mapper.writeValueAsString(value).getBytes(StandardCharsets.UTF_8);
        } catch (Exception e) {
            throw new SerializationException("Could not serialize PaymentView", e);
        }
    }

    @Override
    public PaymentView deserialize(byte[] bytes) throws SerializationException {
        if (bytes == null || bytes.length == 0) return null;
        try {
            return mapper.readValue(new String(bytes, StandardCharsets.UTF_8), PaymentView.class);
        } catch (Exception e) {
            throw new SerializationException("Could not deserialize PaymentView", e);
        }
    }
}
