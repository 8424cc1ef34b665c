package com.tixgo.booking.service;

/**
 * Hosted checkout provider. Implementations throw MarketplaceException with kind
 * UNAVAILABLE when the provider cannot be reached or answers with an error.
 */
public interface CheckoutGateway {

    CheckoutSession createSession(CheckoutSessionRequest request);

    CheckoutSession retrieveSession(String sessionId);
}
