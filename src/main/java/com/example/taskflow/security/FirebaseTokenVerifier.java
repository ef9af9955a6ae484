package com.example.taskflow.security;

import com.example.taskflow.exception.AuthenticationFailedException;
import com.example.taskflow.service.notification.FirebaseMessagingProvider;
import com.google.firebase.auth.FirebaseAuthException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Verifies Firebase ID tokens with the Firebase Admin SDK
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FirebaseTokenVerifier {

    private final FirebaseMessagingProvider firebaseProvider;

    /**
     * @return the Firebase uid the token was issued for
     * @throws AuthenticationFailedException if the token is invalid, expired or revoked
     */
    public String verify(String idToken) {
        try {
            var decoded = firebaseProvider.auth().verifyIdToken(idToken);
            return decoded.getUid();
        } catch (FirebaseAuthException e) {
            log.warn("Firebase token rejected: {} ({})", e.getMessage(), e.getAuthErrorCode());
            throw new AuthenticationFailedException("Invalid token", e);
        } catch (IllegalArgumentException e) {
            throw new AuthenticationFailedException("Invalid token", e);
        }
    }
}
