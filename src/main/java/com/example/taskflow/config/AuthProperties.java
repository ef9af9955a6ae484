package com.example.taskflow.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "auth")
public class AuthProperties {

    @NotBlank
    private String jwtSecret;

    @NotBlank
    private String issuer = "taskflow-backend";

    @Min(60)
    private long accessTokenExpirySeconds = 3600;
}
