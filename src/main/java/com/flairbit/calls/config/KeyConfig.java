package com.flairbit.calls.config;

import com.nimbusds.jose.jwk.RSAKey;
import org.bouncycastle.asn1.pkcs.PrivateKeyInfo;
import org.bouncycastle.asn1.x509.SubjectPublicKeyInfo;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.bouncycastle.openssl.PEMKeyPair;
import org.bouncycastle.openssl.PEMParser;
import org.bouncycastle.openssl.jcajce.JcaPEMKeyConverter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.interfaces.RSAPrivateCrtKey;
import java.security.interfaces.RSAPrivateKey;
import java.security.interfaces.RSAPublicKey;
import java.security.spec.RSAPublicKeySpec;

/**
 * PEM keys: this service's signing key for service tokens and FlairBit's key for verifying
 * user tokens.
 */
@Configuration
public class KeyConfig {

    private final JcaPEMKeyConverter converter = new JcaPEMKeyConverter().setProvider(new BouncyCastleProvider());

    @Bean
    public RSAKey servicePrivateKey(@Value("${service.auth.private-key}") Resource resource,
                                    @Value("${service.auth.key-id}") String keyId) throws Exception {
        Object parsed = readPem(resource);

        PrivateKey privateKey;
        PublicKey publicKey;
        if (parsed instanceof PEMKeyPair pemKeyPair) {
            KeyPair keyPair = converter.getKeyPair(pemKeyPair);
            privateKey = keyPair.getPrivate();
            publicKey = keyPair.getPublic();
        } else if (parsed instanceof PrivateKeyInfo privateKeyInfo) {
            privateKey = converter.getPrivateKey(privateKeyInfo);
            RSAPrivateCrtKey crtKey = (RSAPrivateCrtKey) privateKey;
            publicKey = KeyFactory.getInstance("RSA")
                    .generatePublic(new RSAPublicKeySpec(crtKey.getModulus(), crtKey.getPublicExponent()));
        } else {
            throw new IllegalStateException("Unsupported private key PEM in " + resource.getDescription()
                    + ": " + (parsed == null ? "empty" : parsed.getClass().getSimpleName()));
        }

        return new RSAKey.Builder((RSAPublicKey) publicKey)
                .privateKey((RSAPrivateKey) privateKey)
                .keyID(keyId)
                .build();
    }

    @Bean
    public RSAPublicKey flairbitPublicKey(@Value("${flairbit.auth.public-key}") Resource resource) throws Exception {
        Object parsed = readPem(resource);
        if (!(parsed instanceof SubjectPublicKeyInfo publicKeyInfo)) {
            throw new IllegalStateException("Expected a public key PEM in " + resource.getDescription());
        }
        return (RSAPublicKey) converter.getPublicKey(publicKeyInfo);
    }

    private static Object readPem(Resource resource) throws IOException {
        try (PEMParser pemParser = new PEMParser(new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8))) {
            return pemParser.readObject();
        }
    }
}
