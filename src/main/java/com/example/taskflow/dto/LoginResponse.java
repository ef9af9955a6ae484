package com.example.taskflow.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LoginResponse {

    @Builder.Default
    private boolean success = true;

    @JsonProperty("access_token")
    private String accessToken;

    @JsonProperty("user_id")
    private String userId;

    @JsonProperty("expires_in")
    private long expiresIn;
}
