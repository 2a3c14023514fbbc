package com.flairbit.calls.security;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSVerifier;
import com.nimbusds.jose.crypto.RSASSAVerifier;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.stereotype.Component;

import java.security.interfaces.RSAPublicKey;
import java.text.ParseException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Verifies FlairBit-issued RS256 user tokens for both the REST filter and STOMP CONNECT frames.
 * The subject must be the user id; a {@code roles} claim containing {@code ADMIN} grants the
 * administrative authority.
 */
@Component
public class FlairbitTokenVerifier {

    public static final String USER_AUTHORITY = "USER";

    private final RSAPublicKey flairbitPublicKey;
    private final String audience;
    private final Clock clock;

    public FlairbitTokenVerifier(RSAPublicKey flairbitPublicKey,
                                 @Value("${flairbit.auth.audience:}") String audience,
                                 Clock clock) {
        this.flairbitPublicKey = flairbitPublicKey;
        this.audience = audience;
        this.clock = clock;
    }

    public JWTClaimsSet verifyAndExtract(String token) {
        try {
            SignedJWT signedJWT = SignedJWT.parse(token);
            JWSVerifier verifier = new RSASSAVerifier(flairbitPublicKey);

            if (!signedJWT.verify(verifier)) {
                throw new SecurityException("Invalid Flairbit token signature");
            }

            JWTClaimsSet claims = signedJWT.getJWTClaimsSet();
            Date now = Date.from(clock.instant());
            if (Objects.isNull(claims.getExpirationTime()) || now.after(claims.getExpirationTime())) {
                throw new SecurityException("Token expired");
            }
            if (!audience.isBlank() && (Objects.isNull(claims.getAudience()) || !claims.getAudience().contains(audience))) {
                throw new SecurityException("Token not issued for " + audience);
            }
            return claims;
        } catch (ParseException | JOSEException e) {
            throw new SecurityException("Token verification failed: " + e.getMessage(), e);
        }
    }

    /**
     * @throws SecurityException when the token is invalid or its subject is not a user id
     */
    public UsernamePasswordAuthenticationToken authenticate(String token) {
        JWTClaimsSet claims = verifyAndExtract(token);
        String subject = claims.getSubject();
        try {
            UUID.fromString(Objects.requireNonNull(subject, "subject"));
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new SecurityException("Token subject is not a user id");
        }

        List<SimpleGrantedAuthority> authorities = new ArrayList<>();
        authorities.add(new SimpleGrantedAuthority(USER_AUTHORITY));
        try {
            List<String> roles = claims.getStringListClaim("roles");
            if (Objects.nonNull(roles) && roles.contains(CurrentActor.ADMIN_AUTHORITY)) {
                authorities.add(new SimpleGrantedAuthority(CurrentActor.ADMIN_AUTHORITY));
            }
        } catch (ParseException e) {
            throw new SecurityException("Malformed roles claim", e);
        }
        return new UsernamePasswordAuthenticationToken(subject, null, authorities);
    }
}
