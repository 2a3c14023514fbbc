package com.flairbit.calls.security;

import com.flairbit.calls.support.MutableClock;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.crypto.RSASSASigner;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.GrantedAuthority;

import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PrivateKey;
import java.security.interfaces.RSAPublicKey;
import java.time.Instant;
import java.util.Date;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FlairbitTokenVerifierTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private static KeyPair flairbit;
    private static KeyPair stranger;

    private final MutableClock clock = new MutableClock(NOW);

    @BeforeAll
    static void keys() throws Exception {
        KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
        generator.initialize(2048);
        flairbit = generator.generateKeyPair();
        stranger = generator.generateKeyPair();
    }

    private FlairbitTokenVerifier verifier() {
        return new FlairbitTokenVerifier((RSAPublicKey) flairbit.getPublic(), "FlairBit", clock);
    }

    private static String token(PrivateKey key, String subject, String audience, Instant expiry, List<String> roles) throws Exception {
        JWTClaimsSet.Builder claims = new JWTClaimsSet.Builder()
                .subject(subject)
                .audience(audience)
                .issueTime(Date.from(NOW))
                .expirationTime(Date.from(expiry));
        if (roles != null) claims.claim("roles", roles);
        SignedJWT jwt = new SignedJWT(new JWSHeader(JWSAlgorithm.RS256), claims.build());
        jwt.sign(new RSASSASigner(key));
        return jwt.serialize();
    }

    private static List<String> authorities(UsernamePasswordAuthenticationToken auth) {
        return auth.getAuthorities().stream().map(GrantedAuthority::getAuthority).toList();
    }

    @Test
    void userTokenAuthenticatesWithUserAuthority() throws Exception {
        UUID user = UUID.randomUUID();
        String token = token(flairbit.getPrivate(), user.toString(), "FlairBit", NOW.plusSeconds(300), null);

        UsernamePasswordAuthenticationToken auth = verifier().authenticate(token);

        assertThat(auth.getName()).isEqualTo(user.toString());
        assertThat(authorities(auth)).containsExactly(FlairbitTokenVerifier.USER_AUTHORITY);
    }

    @Test
    void adminRoleGrantsAdminAuthority() throws Exception {
        String token = token(flairbit.getPrivate(), UUID.randomUUID().toString(), "FlairBit", NOW.plusSeconds(300),
                List.of("SUPPORT", "ADMIN"));

        assertThat(authorities(verifier().authenticate(token)))
                .containsExactlyInAnyOrder(FlairbitTokenVerifier.USER_AUTHORITY, CurrentActor.ADMIN_AUTHORITY);
    }

    @Test
    void rejectsForeignSignature() throws Exception {
        String token = token(stranger.getPrivate(), UUID.randomUUID().toString(), "FlairBit", NOW.plusSeconds(300), null);

        assertThatThrownBy(() -> verifier().authenticate(token)).isInstanceOf(SecurityException.class);
    }

    @Test
    void rejectsExpiredToken() throws Exception {
        String token = token(flairbit.getPrivate(), UUID.randomUUID().toString(), "FlairBit", NOW.plusSeconds(60), null);
        clock.advanceSeconds(61);

        assertThatThrownBy(() -> verifier().authenticate(token))
                .isInstanceOf(SecurityException.class)
                .hasMessageContaining("expired");
    }

    @Test
    void rejectsOtherAudience() throws Exception {
        String token = token(flairbit.getPrivate(), UUID.randomUUID().toString(), "billing", NOW.plusSeconds(300), null);

        assertThatThrownBy(() -> verifier().authenticate(token)).isInstanceOf(SecurityException.class);
    }

    @Test
    void rejectsNonUserSubject() throws Exception {
        String token = token(flairbit.getPrivate(), "booking-service", "FlairBit", NOW.plusSeconds(300), null);

        assertThatThrownBy(() -> verifier().authenticate(token))
                .isInstanceOf(SecurityException.class)
                .hasMessageContaining("user id");
    }

    @Test
    void rejectsGarbage() {
        assertThatThrownBy(() -> verifier().authenticate("not-a-jwt")).isInstanceOf(SecurityException.class);
    }
}
