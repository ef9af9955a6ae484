package com.example.taskflow.config;

import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Firebase Admin SDK configuration.
 * <p>
 * Credentials are resolved from a service account file first, then from the
 * inline service account fields, then from Google application default credentials.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "firebase")
public class FirebaseProperties {

    private String credentialsPath;
    private String projectId;
    private String privateKey;
    private String clientEmail;
    private String clientId;

    /**
     * Upper bound for a single gateway call
     */
    @Min(1)
    private int sendTimeoutSeconds = 10;

    public boolean hasInlineServiceAccount() {
        return isSet(projectId) && isSet(privateKey) && isSet(clientEmail);
    }

    private static boolean isSet(String value) {
        return value != null && !value.isBlank();
    }
}
