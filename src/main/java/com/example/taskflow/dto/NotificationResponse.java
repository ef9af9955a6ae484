package com.example.taskflow.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class NotificationResponse {

    @Builder.Default
    private boolean success = true;

    @JsonProperty("message_id")
    private String messageId;

    private String message;

    public static NotificationResponse sent(String messageId) {
        return NotificationResponse.builder().messageId(messageId).build();
    }

    public static NotificationResponse suppressed(String message) {
        return NotificationResponse.builder().message(message).build();
    }
}
