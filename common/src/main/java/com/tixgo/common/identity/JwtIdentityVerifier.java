package com.tixgo.common.identity;

import com.tixgo.common.exception.ErrorKind;
import com.tixgo.common.exception.MarketplaceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtException;
import org.springframework.util.StringUtils;

@Slf4j
public class JwtIdentityVerifier implements IdentityVerifier {

    private static final String BEARER_PREFIX = "Bearer ";

    private final JwtDecoder jwtDecoder;
    private final String emailClaim;

    public JwtIdentityVerifier(JwtDecoder jwtDecoder, String emailClaim) {
        this.jwtDecoder = jwtDecoder;
        this.emailClaim = emailClaim;
    }

    @Override
    public String verify(String authorizationHeader) {
        if (!StringUtils.hasText(authorizationHeader)) {
            throw new MarketplaceException(ErrorKind.UNAUTHENTICATED, "Missing bearer token");
        }
        if (!authorizationHeader.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            throw new MarketplaceException(ErrorKind.UNAUTHENTICATED, "Authorization header must use the Bearer scheme");
        }

        String token = authorizationHeader.substring(BEARER_PREFIX.length()).trim();
        if (token.isEmpty()) {
            throw new MarketplaceException(ErrorKind.UNAUTHENTICATED, "Missing bearer token");
        }

        Jwt jwt;
        try {
            jwt = jwtDecoder.decode(token);
        } catch (JwtException e) {
            log.warn("Rejected bearer token: {}", e.getMessage());
            throw new MarketplaceException(ErrorKind.UNAUTHENTICATED, "Invalid or expired token", e);
        }

        String email = jwt.getClaimAsString(emailClaim);
        if (!StringUtils.hasText(email)) {
            throw new MarketplaceException(ErrorKind.UNAUTHENTICATED, "Token carries no email claim");
        }

        log.debug("Verified caller: {}", email);
        return email.toLowerCase();
    }
}
