package com.example.taskflow.controller;

import com.example.taskflow.dto.OperationResponse;
import com.example.taskflow.dto.PreferencesResponse;
import com.example.taskflow.dto.UpdatePreferencesRequest;
import com.example.taskflow.service.UserPreferencesService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/users/{userId}/preferences")
@Tag(name = "Preferences", description = "Per-user notification preferences")
public class UserPreferencesController {

    private final UserPreferencesService userPreferencesService;

    @GetMapping
    @Operation(summary = "Get preferences", description = "Returns stored preferences, creating defaults on first access")
    public PreferencesResponse getPreferences(@Parameter(description = "User ID") @PathVariable String userId) {
        return userPreferencesService.getPreferences(userId);
    }

    @PutMapping
    @Operation(summary = "Update preferences", description = "Merge the given keys into the user's preferences")
    public OperationResponse updatePreferences(@Parameter(description = "User ID") @PathVariable String userId,
                                               @RequestBody UpdatePreferencesRequest request) {
        userPreferencesService.updatePreferences(userId, request.getPreferences());
        return OperationResponse.ok("Preferences updated successfully");
    }
}
