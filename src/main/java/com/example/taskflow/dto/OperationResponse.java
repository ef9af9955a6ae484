package com.example.taskflow.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OperationResponse {

    private boolean success;
    private String message;

    public static OperationResponse ok(String message) {
        return new OperationResponse(true, message);
    }
}
