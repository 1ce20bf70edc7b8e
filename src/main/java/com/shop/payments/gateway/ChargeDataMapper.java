package com.shop.payments.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.shop.payments.domain.ChargeVerdict;

/**
 * Maps the provider's charge object ({@code data} of a verify response or of a
 * notification) to a {@link ChargeVerdict}. The body text the gateway sent is kept
 * unchanged as raw payload.
 */
public final class ChargeDataMapper {

    private ChargeDataMapper() {}

    public static ChargeVerdict toVerdict(JsonNode data, String rawBody) {
        return toVerdict(data, null, rawBody);
    }

    /**
     * @param statusOverride status to use instead of {@code data.status}, e.g. when the
     *                       notification event type already states the outcome
     * @param rawBody        the response or notification body exactly as received
     */
    public static ChargeVerdict toVerdict(JsonNode data, String statusOverride, String rawBody) {
        if (data == null || data.isNull() || data.isMissingNode()) {
            throw new IllegalArgumentException("charge data is missing");
        }
        JsonNode amount = data.path("amount");
        return ChargeVerdict.builder()
                .status(statusOverride != null ? statusOverride : text(data, "status"))
                .channel(text(data, "channel"))
                .gatewayMessage(text(data, "gateway_response"))
                .paidAtRaw(text(data, "paid_at"))
                .customerEmail(text(data.path("customer"), "email"))
                .amountMinor(amount.isIntegralNumber() ? Long.valueOf(amount.asLong()) : null)
                .gatewayTransactionId(text(data, "id"))
                .rawPayload(rawBody)
                .build();
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isMissingNode() || value.isNull() ? null : value.asText();
    }
}
