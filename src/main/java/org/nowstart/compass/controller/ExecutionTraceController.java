package org.nowstart.compass.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.nowstart.compass.data.dto.EvaluationRequest;
import org.nowstart.compass.data.dto.ExecutionTraceDto;
import org.nowstart.compass.data.dto.PerformanceDto;
import org.nowstart.compass.data.dto.TraceEventRequest;
import org.nowstart.compass.service.ExecutionTraceService;
import org.nowstart.compass.service.PerformanceAggregatorService;
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
@RequestMapping("/api/traces")
@RequiredArgsConstructor
@Tag(name = "Execution trace", description = "Execution events and performance evaluations of accepted strategies")
public class ExecutionTraceController {

    private final ExecutionTraceService executionTraceService;
    private final PerformanceAggregatorService performanceAggregatorService;

    @GetMapping("/{traceId}")
    @Operation(summary = "Get trace", description = "The trace with its events in sequence order.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Found"),
            @ApiResponse(responseCode = "404", description = "Unknown trace")
    })
    public ExecutionTraceDto get(
            @RequestHeader(UserHeaders.USER_ID) String userId,
            @PathVariable String traceId
    ) {
        return executionTraceService.get(userId, traceId);
    }

    @PostMapping("/{traceId}/actions")
    @Operation(summary = "Append action")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Appended"),
            @ApiResponse(responseCode = "404", description = "Unknown trace"),
            @ApiResponse(responseCode = "409", description = "Stale sequence or completed trace")
    })
    public ResponseEntity<ExecutionTraceDto> appendAction(
            @RequestHeader(UserHeaders.USER_ID) String userId,
            @PathVariable String traceId,
            @RequestBody(required = false) TraceEventRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED).body(executionTraceService.appendAction(userId, traceId, request));
    }

    @PostMapping("/{traceId}/compensations")
    @Operation(summary = "Append compensation", description = "Corrects an earlier action. Allowed after completion.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Appended"),
            @ApiResponse(responseCode = "400", description = "compensatesSequence missing"),
            @ApiResponse(responseCode = "404", description = "Unknown trace or action"),
            @ApiResponse(responseCode = "409", description = "Stale sequence, or action already compensated")
    })
    public ResponseEntity<ExecutionTraceDto> appendCompensation(
            @RequestHeader(UserHeaders.USER_ID) String userId,
            @PathVariable String traceId,
            @RequestBody TraceEventRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED).body(executionTraceService.appendCompensation(userId, traceId, request));
    }

    @PostMapping("/{traceId}/complete")
    @Operation(summary = "Complete trace")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Completed"),
            @ApiResponse(responseCode = "404", description = "Unknown trace"),
            @ApiResponse(responseCode = "409", description = "Stale sequence or already completed")
    })
    public ResponseEntity<ExecutionTraceDto> complete(
            @RequestHeader(UserHeaders.USER_ID) String userId,
            @PathVariable String traceId,
            @RequestBody(required = false) TraceEventRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED).body(executionTraceService.complete(userId, traceId, request));
    }

    @PostMapping("/{traceId}/evaluations")
    @Operation(summary = "Evaluate", description = "Scores the trace against a realised market outcome and appends a performance record.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Performance recorded"),
            @ApiResponse(responseCode = "400", description = "Validation failed"),
            @ApiResponse(responseCode = "404", description = "Unknown trace"),
            @ApiResponse(responseCode = "409", description = "Evaluation with the same asOf exists")
    })
    public ResponseEntity<PerformanceDto> evaluate(
            @RequestHeader(UserHeaders.USER_ID) String userId,
            @PathVariable String traceId,
            @RequestBody @Valid EvaluationRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED).body(performanceAggregatorService.evaluate(userId, traceId, request));
    }

    @GetMapping("/{traceId}/evaluations")
    @Operation(summary = "Evaluation history", description = "All performance records of the trace ordered by asOf.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Found"),
            @ApiResponse(responseCode = "404", description = "Unknown trace")
    })
    public List<PerformanceDto> history(
            @RequestHeader(UserHeaders.USER_ID) String userId,
            @PathVariable String traceId
    ) {
        return performanceAggregatorService.history(userId, traceId);
    }
}
