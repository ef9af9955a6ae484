package com.example.taskflow.service.notification;

import com.example.taskflow.config.FirebaseProperties;
import com.example.taskflow.exception.DeliveryException;
import com.google.auth.oauth2.GoogleCredentials;
import com.google.auth.oauth2.ServiceAccountCredentials;
import com.google.firebase.FirebaseApp;
import com.google.firebase.FirebaseOptions;
import com.google.firebase.auth.FirebaseAuth;
import com.google.firebase.messaging.FirebaseMessaging;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.FileInputStream;
import java.io.IOException;
import java.util.List;

/**
 * Lazily initializes the Firebase app and hands out its messaging and auth clients.
 * <p>
 * Credentials are taken, in order, from the service account file, the inline
 * service account properties, or Google application default credentials.
 * Initialization happens at most once per process.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FirebaseMessagingProvider {

    private final FirebaseProperties properties;

    private FirebaseApp app;

    /**
     * Initialize Firebase if needed and return the messaging client
     *
     * @throws DeliveryException if Firebase cannot be initialized
     */
    public FirebaseMessaging ensureInitialized() {
        return FirebaseMessaging.getInstance(app());
    }

    public FirebaseAuth auth() {
        return FirebaseAuth.getInstance(app());
    }

    synchronized FirebaseApp app() {
        if (app != null) {
            return app;
        }
        try {
            app = FirebaseApp.getApps().stream()
                    .filter(existing -> FirebaseApp.DEFAULT_APP_NAME.equals(existing.getName()))
                    .findFirst()
                    .orElse(null);
            if (app == null) {
                var options = FirebaseOptions.builder().setCredentials(loadCredentials());
                if (isSet(properties.getProjectId())) {
                    options.setProjectId(properties.getProjectId());
                }
                app = FirebaseApp.initializeApp(options.build());
                log.info("Firebase initialized for project {}", properties.getProjectId());
            }
            return app;
        } catch (IOException | IllegalStateException e) {
            log.error("Failed to initialize Firebase: {}", e.getMessage());
            throw new DeliveryException("Failed to initialize Firebase", e);
        }
    }

    private GoogleCredentials loadCredentials() throws IOException {
        if (isSet(properties.getCredentialsPath())) {
            log.info("Loading Firebase credentials from {}", properties.getCredentialsPath());
            try (var in = new FileInputStream(properties.getCredentialsPath())) {
                return GoogleCredentials.fromStream(in);
            }
        }
        if (properties.hasInlineServiceAccount()) {
            log.info("Loading Firebase credentials for {}", properties.getClientEmail());
            return ServiceAccountCredentials.fromPkcs8(
                    properties.getClientId(),
                    properties.getClientEmail(),
                    properties.getPrivateKey().replace("\\n", "\n"),
                    null,
                    List.of());
        }
        log.info("Loading Firebase credentials from application default credentials");
        return GoogleCredentials.getApplicationDefault();
    }

    private static boolean isSet(String value) {
        return value != null && !value.isBlank();
    }
}
