package org.nowstart.compass.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.nowstart.compass.data.dto.DecideRequest;
import org.nowstart.compass.data.dto.DecisionDto;
import org.nowstart.compass.data.dto.FeedbackDto;
import org.nowstart.compass.data.dto.FeedbackRequest;
import org.nowstart.compass.data.dto.OpenDecisionRequest;
import org.nowstart.compass.service.DecisionStateMachineService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/decisions")
@RequiredArgsConstructor
@Tag(name = "Decision", description = "Accept, modify or reject proposed strategies")
public class DecisionController {

    private final DecisionStateMachineService decisionStateMachineService;

    @PostMapping
    @Operation(summary = "Open decision", description = "Opens the decision of a proposable strategy version.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Decision proposed"),
            @ApiResponse(responseCode = "404", description = "Unknown strategy version"),
            @ApiResponse(responseCode = "409", description = "Strategy not proposable or already has a decision")
    })
    public ResponseEntity<DecisionDto> open(
            @RequestHeader(UserHeaders.USER_ID) String userId,
            @RequestBody @Valid OpenDecisionRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(decisionStateMachineService.open(userId, request.strategyId(), request.version()));
    }

    @GetMapping("/{decisionId}")
    @Operation(summary = "Get decision")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Found"),
            @ApiResponse(responseCode = "404", description = "Unknown decision")
    })
    public DecisionDto get(
            @RequestHeader(UserHeaders.USER_ID) String userId,
            @PathVariable String decisionId
    ) {
        return decisionStateMachineService.get(userId, decisionId);
    }

    @PostMapping("/{decisionId}/decide")
    @Operation(summary = "Decide", description = "Resolves a proposed decision. A decision is resolved exactly once.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Resolved"),
            @ApiResponse(responseCode = "400", description = "Validation failed"),
            @ApiResponse(responseCode = "404", description = "Unknown decision"),
            @ApiResponse(responseCode = "409", description = "Already resolved, or the strategy moved on"),
            @ApiResponse(responseCode = "422", description = "Modified strategy lacks market history")
    })
    public DecisionDto decide(
            @RequestHeader(UserHeaders.USER_ID) String userId,
            @PathVariable String decisionId,
            @RequestBody @Valid DecideRequest request
    ) {
        return decisionStateMachineService.decide(userId, decisionId, request);
    }

    @PostMapping("/{decisionId}/feedback")
    @Operation(summary = "Submit feedback", description = "Rates a resolved decision from 1 to 5.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Feedback stored"),
            @ApiResponse(responseCode = "404", description = "Unknown decision"),
            @ApiResponse(responseCode = "409", description = "Decision not resolved yet")
    })
    public ResponseEntity<FeedbackDto> submitFeedback(
            @RequestHeader(UserHeaders.USER_ID) String userId,
            @PathVariable String decisionId,
            @RequestBody @Valid FeedbackRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(decisionStateMachineService.submitFeedback(userId, decisionId, request));
    }
}
