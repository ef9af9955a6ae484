package com.example.taskflow.security;

import com.example.taskflow.config.AuthProperties;
import com.example.taskflow.dto.LoginResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.JwsHeader;
import org.springframework.security.oauth2.jwt.JwtClaimsSet;
import org.springframework.security.oauth2.jwt.JwtEncoder;
import org.springframework.security.oauth2.jwt.JwtEncoderParameters;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Exchanges a verified Firebase identity for a TaskFlow session token
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuthService {

    private final FirebaseTokenVerifier tokenVerifier;
    private final JwtEncoder jwtEncoder;
    private final AuthProperties authProperties;
    private final Clock clock;

    public LoginResponse login(String firebaseToken) {
        var userId = tokenVerifier.verify(firebaseToken);
        var accessToken = issueAccessToken(userId);
        log.info("User {} logged in", userId);

        return LoginResponse.builder()
                .accessToken(accessToken)
                .userId(userId)
                .expiresIn(authProperties.getAccessTokenExpirySeconds())
                .build();
    }

    String issueAccessToken(String userId) {
        var now = clock.instant();
        var claims = JwtClaimsSet.builder()
                .issuer(authProperties.getIssuer())
                .issuedAt(now)
                .expiresAt(now.plusSeconds(authProperties.getAccessTokenExpirySeconds()))
                .subject(userId)
                .build();

        return jwtEncoder.encode(
                JwtEncoderParameters.from(JwsHeader.with(MacAlgorithm.HS256).build(), claims)
        ).getTokenValue();
    }
}
