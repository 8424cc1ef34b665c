package com.tixgo.common.identity;

/**
 * Resolves the caller's verified email from a bearer credential.
 */
public interface IdentityVerifier {

    /**
     * @param authorizationHeader raw {@code Authorization} header value, {@code "Bearer <token>"}
     * @return verified email of the caller
     * @throws com.tixgo.common.exception.MarketplaceException with kind UNAUTHENTICATED
     *         when the header is missing, malformed or the token does not verify
     */
    String verify(String authorizationHeader);
}
