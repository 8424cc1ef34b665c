package com.tixgo.common.identity;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "tixgo.identity")
public class IdentityProperties {

    /**
     * JWK set used to verify token signatures.
     */
    private String jwkSetUri = "https://www.googleapis.com/service_accounts/v1/jwk/securetoken@system.gserviceaccount.com";

    /**
     * Expected {@code iss} claim. Empty disables the check.
     */
    private String issuer;

    /**
     * Expected {@code aud} claim. Empty disables the check.
     */
    private String audience;

    private String emailClaim = "email";
}
