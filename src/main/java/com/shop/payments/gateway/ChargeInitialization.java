package com.shop.payments.gateway;

import lombok.Builder;
import lombok.Value;

/**
 * Authorization data returned by the provider when a charge is started.
 */
@Value
@Builder
public class ChargeInitialization {

    String authorizationUrl;
    String accessCode;
    String rawPayload;
}
