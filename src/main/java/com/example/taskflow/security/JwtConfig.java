package com.example.taskflow.security;

import com.example.taskflow.config.AuthProperties;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.jwk.JWKSet;
import com.nimbusds.jose.jwk.OctetSequenceKey;
import com.nimbusds.jose.jwk.source.ImmutableJWKSet;
import com.nimbusds.jose.jwk.source.JWKSource;
import com.nimbusds.jose.proc.SecurityContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtEncoder;
import org.springframework.security.oauth2.jwt.JwtValidators;
import org.springframework.security.oauth2.jwt.NimbusJwtDecoder;
import org.springframework.security.oauth2.jwt.NimbusJwtEncoder;

import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * HS256 encoder and decoder for the session token issued at login.
 * <p>
 * The configured secret is hashed to a fixed 32-byte key, so any non-blank
 * secret length works.
 */
@Configuration
public class JwtConfig {

    @Bean
    public JwtEncoder jwtEncoder(AuthProperties authProperties) {
        var jwk = new OctetSequenceKey.Builder(signingKey(authProperties.getJwtSecret()))
                .algorithm(JWSAlgorithm.HS256)
                .keyID("taskflow-hs256")
                .build();

        JWKSource<SecurityContext> jwkSource = new ImmutableJWKSet<>(new JWKSet(jwk));
        return new NimbusJwtEncoder(jwkSource);
    }

    @Bean
    public JwtDecoder jwtDecoder(AuthProperties authProperties) {
        var key = new SecretKeySpec(signingKey(authProperties.getJwtSecret()), "HmacSHA256");
        var decoder = NimbusJwtDecoder.withSecretKey(key).macAlgorithm(MacAlgorithm.HS256).build();
        decoder.setJwtValidator(JwtValidators.createDefaultWithIssuer(authProperties.getIssuer()));
        return decoder;
    }

    static byte[] signingKey(String secret) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("auth.jwt-secret is empty. Set JWT_SECRET_KEY.");
        }
        try {
            return MessageDigest.getInstance("SHA-256").digest(secret.trim().getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
