package com.shop.payments.gateway;

import com.shop.payments.domain.ChargeVerdict;

/**
 * What the reconciliation engine needs from the payment provider.
 * Implementations translate our calls into the provider's API and normalize its answers.
 * Transport problems surface as {@link GatewayUnavailableException}; requests the provider
 * refuses surface as {@link GatewayRejectedException}.
 */
public interface PaymentGatewayClient {

    /**
     * Name used for logs and for the circuit breaker instance.
     */
    default String getGatewayName() {
        return this.getClass().getSimpleName();
    }

    /**
     * Start a charge and get the checkout URL the customer must be sent to.
     *
     * @param request what to charge; amount is in the main currency unit
     * @return authorization data for the redirect
     * @throws GatewayUnavailableException on timeouts, connection errors and 5xx answers
     * @throws GatewayRejectedException    when the provider refuses the request
     */
    ChargeInitialization startCharge(ChargeRequest request);

    /**
     * Ask the provider for the current state of a charge.
     *
     * @throws GatewayUnavailableException on timeouts, connection errors and 5xx answers
     * @throws ReferenceNotFoundException  when the provider does not know the reference
     */
    ChargeVerdict fetchChargeStatus(String reference);

    /**
     * Check that a notification body was signed by the provider. Must be called before any
     * part of the body is trusted.
     *
     * @param rawBody         the request body exactly as received
     * @param signatureHeader value of the signature header, may be null
     */
    boolean verifyNotificationSignature(String rawBody, String signatureHeader);
}
