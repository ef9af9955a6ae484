package com.example.taskflow.security;

import com.example.taskflow.exception.AuthenticationFailedException;
import com.example.taskflow.service.notification.FirebaseMessagingProvider;
import com.google.firebase.auth.FirebaseAuth;
import com.google.firebase.auth.FirebaseAuthException;
import com.google.firebase.auth.FirebaseToken;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("FirebaseTokenVerifier Tests")
class FirebaseTokenVerifierTest {

    @Mock
    private FirebaseMessagingProvider firebaseProvider;

    @Mock
    private FirebaseAuth firebaseAuth;

    @InjectMocks
    private FirebaseTokenVerifier verifier;

    @BeforeEach
    void setUp() {
        when(firebaseProvider.auth()).thenReturn(firebaseAuth);
    }

    @Test
    @DisplayName("Should return the uid of a valid token")
    void shouldReturnUid() throws Exception {
        var token = mock(FirebaseToken.class);
        when(token.getUid()).thenReturn("uid-7");
        when(firebaseAuth.verifyIdToken("good")).thenReturn(token);

        assertThat(verifier.verify("good")).isEqualTo("uid-7");
    }

    @Test
    @DisplayName("Should map Firebase rejections to authentication failures")
    void shouldMapRejections() throws Exception {
        when(firebaseAuth.verifyIdToken("expired")).thenThrow(mock(FirebaseAuthException.class));

        assertThatThrownBy(() -> verifier.verify("expired"))
                .isInstanceOf(AuthenticationFailedException.class)
                .hasMessage("Invalid token");
    }

    @Test
    @DisplayName("Should map malformed input to authentication failures")
    void shouldMapMalformedInput() throws Exception {
        when(firebaseAuth.verifyIdToken("")).thenThrow(new IllegalArgumentException("ID token must not be null or empty"));

        assertThatThrownBy(() -> verifier.verify(""))
                .isInstanceOf(AuthenticationFailedException.class);
    }
}
