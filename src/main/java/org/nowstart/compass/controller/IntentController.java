package org.nowstart.compass.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.nowstart.compass.data.dto.GoalDto;
import org.nowstart.compass.data.dto.GoalRequest;
import org.nowstart.compass.data.dto.UserProfileDto;
import org.nowstart.compass.data.dto.UserProfileRequest;
import org.nowstart.compass.service.IntentRecordService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/intent")
@RequiredArgsConstructor
@Tag(name = "Intent", description = "Profiles and goals produced by intent extraction")
public class IntentController {

    private final IntentRecordService intentRecordService;

    @PostMapping("/profiles")
    @Operation(summary = "Register profile", description = "Stores the user's risk profile. Profiles are immutable once registered.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Profile stored"),
            @ApiResponse(responseCode = "400", description = "Validation failed"),
            @ApiResponse(responseCode = "409", description = "Profile already registered with different content")
    })
    public ResponseEntity<UserProfileDto> registerProfile(
            @RequestHeader(UserHeaders.USER_ID) String userId,
            @RequestBody @Valid UserProfileRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED).body(intentRecordService.registerProfile(userId, request));
    }

    @PostMapping("/goals")
    @Operation(summary = "Register goal", description = "Starts a goal, or appends the next version of an existing one.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Goal version stored"),
            @ApiResponse(responseCode = "400", description = "Validation failed"),
            @ApiResponse(responseCode = "404", description = "Goal belongs to another user"),
            @ApiResponse(responseCode = "409", description = "Goal version written concurrently")
    })
    public ResponseEntity<GoalDto> registerGoal(
            @RequestHeader(UserHeaders.USER_ID) String userId,
            @RequestBody @Valid GoalRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED).body(intentRecordService.registerGoal(userId, request));
    }
}
