package com.tixgo.common.identity;

import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.crypto.MACSigner;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import com.tixgo.common.exception.ErrorKind;
import com.tixgo.common.exception.MarketplaceException;
import org.junit.jupiter.api.Test;
import org.springframework.security.oauth2.jwt.BadJwtException;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.NimbusJwtDecoder;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Date;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class JwtIdentityVerifierTest {

    private static final byte[] SECRET = "0123456789abcdef0123456789abcdef".getBytes(StandardCharsets.UTF_8);

    private String signedToken(String email, Instant expiresAt) throws Exception {
        JWTClaimsSet.Builder claims = new JWTClaimsSet.Builder()
            .subject("uid-1")
            .issueTime(Date.from(Instant.now().minusSeconds(3600)))
            .expirationTime(Date.from(expiresAt));
        if (email != null) {
            claims.claim("email", email);
        }
        SignedJWT jwt = new SignedJWT(new JWSHeader(JWSAlgorithm.HS256), claims.build());
        jwt.sign(new MACSigner(SECRET));
        return jwt.serialize();
    }

    private JwtIdentityVerifier realVerifier() {
        SecretKey key = new SecretKeySpec(SECRET, "HmacSHA256");
        return new JwtIdentityVerifier(NimbusJwtDecoder.withSecretKey(key).build(), "email");
    }

    @Test
    void verify_ValidToken_ReturnsLowercasedEmail() throws Exception {
        String token = signedToken("Alice@Example.com", Instant.now().plusSeconds(600));

        assertEquals("alice@example.com", realVerifier().verify("Bearer " + token));
    }

    @Test
    void verify_ExpiredToken_Unauthenticated() throws Exception {
        String token = signedToken("alice@example.com", Instant.now().minusSeconds(600));

        MarketplaceException e = assertThrows(MarketplaceException.class,
            () -> realVerifier().verify("Bearer " + token));

        assertEquals(ErrorKind.UNAUTHENTICATED, e.getKind());
    }

    @Test
    void verify_TamperedToken_Unauthenticated() throws Exception {
        String token = signedToken("alice@example.com", Instant.now().plusSeconds(600));
        String tampered = token.substring(0, token.length() - 4) + "AAAA";

        MarketplaceException e = assertThrows(MarketplaceException.class,
            () -> realVerifier().verify("Bearer " + tampered));

        assertEquals(ErrorKind.UNAUTHENTICATED, e.getKind());
    }

    @Test
    void verify_NoEmailClaim_Unauthenticated() throws Exception {
        String token = signedToken(null, Instant.now().plusSeconds(600));

        MarketplaceException e = assertThrows(MarketplaceException.class,
            () -> realVerifier().verify("Bearer " + token));

        assertEquals(ErrorKind.UNAUTHENTICATED, e.getKind());
    }

    @Test
    void verify_MissingHeader_Unauthenticated() {
        JwtDecoder decoder = mock(JwtDecoder.class);
        JwtIdentityVerifier verifier = new JwtIdentityVerifier(decoder, "email");

        assertEquals(ErrorKind.UNAUTHENTICATED, assertThrows(MarketplaceException.class, () -> verifier.verify(null)).getKind());
        assertEquals(ErrorKind.UNAUTHENTICATED, assertThrows(MarketplaceException.class, () -> verifier.verify("Basic abc")).getKind());
        assertEquals(ErrorKind.UNAUTHENTICATED, assertThrows(MarketplaceException.class, () -> verifier.verify("Bearer  ")).getKind());
        verifyNoInteractions(decoder);
    }

    @Test
    void verify_DecoderRejects_Unauthenticated() {
        JwtDecoder decoder = mock(JwtDecoder.class);
        when(decoder.decode("bad")).thenThrow(new BadJwtException("Signed JWT rejected"));

        MarketplaceException e = assertThrows(MarketplaceException.class,
            () -> new JwtIdentityVerifier(decoder, "email").verify("Bearer bad"));

        assertEquals(ErrorKind.UNAUTHENTICATED, e.getKind());
    }

    @Test
    void verify_CustomEmailClaim() {
        JwtDecoder decoder = mock(JwtDecoder.class);
        Jwt jwt = Jwt.withTokenValue("tok")
            .header("alg", "RS256")
            .claim("upn", "bob@example.com")
            .build();
        when(decoder.decode("tok")).thenReturn(jwt);

        assertEquals("bob@example.com", new JwtIdentityVerifier(decoder, "upn").verify("bearer tok"));
    }
}
