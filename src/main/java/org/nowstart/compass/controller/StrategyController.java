package org.nowstart.compass.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.nowstart.compass.data.dto.ProposalDto;
import org.nowstart.compass.data.dto.ProposeRequest;
import org.nowstart.compass.data.dto.RankingDto;
import org.nowstart.compass.data.dto.RankingRequest;
import org.nowstart.compass.data.dto.StrategyDto;
import org.nowstart.compass.data.dto.StrategyLineageDto;
import org.nowstart.compass.data.dto.StrategyModification;
import org.nowstart.compass.service.AdvisoryWorkflowService;
import org.nowstart.compass.service.RankingService;
import org.nowstart.compass.service.StrategyLifecycleService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
@Tag(name = "Strategy", description = "Strategy proposal, versioning and ranking")
public class StrategyController {

    private final AdvisoryWorkflowService advisoryWorkflowService;
    private final StrategyLifecycleService strategyLifecycleService;
    private final RankingService rankingService;

    @PostMapping("/api/strategies/propose")
    @Operation(summary = "Propose strategy", description = "Generates, ranks and backtests hypotheses and stores the best one as version 1.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Strategy stored; proposable or backtest_failed"),
            @ApiResponse(responseCode = "400", description = "Validation failed"),
            @ApiResponse(responseCode = "404", description = "Unknown profile, goal or market context")
    })
    public ResponseEntity<ProposalDto> propose(
            @RequestHeader(UserHeaders.USER_ID) String userId,
            @RequestBody @Valid ProposeRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED).body(advisoryWorkflowService.propose(userId, request));
    }

    @PostMapping("/api/strategies/{strategyId}/versions/{version}/fork")
    @Operation(summary = "Fork strategy", description = "Creates the next version from the head version and re-runs its backtest.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "New version stored"),
            @ApiResponse(responseCode = "404", description = "Unknown strategy version"),
            @ApiResponse(responseCode = "409", description = "Version is not the head, or the next version was written concurrently")
    })
    public ResponseEntity<ProposalDto> fork(
            @RequestHeader(UserHeaders.USER_ID) String userId,
            @PathVariable String strategyId,
            @PathVariable int version,
            @RequestBody(required = false) @Valid StrategyModification modification
    ) {
        return ResponseEntity.status(HttpStatus.CREATED).body(advisoryWorkflowService.fork(userId, strategyId, version, modification));
    }

    @GetMapping("/api/strategies/{strategyId}")
    @Operation(summary = "Strategy lineage", description = "All versions of a strategy, oldest first.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Found"),
            @ApiResponse(responseCode = "404", description = "Unknown strategy")
    })
    public StrategyLineageDto lineage(
            @RequestHeader(UserHeaders.USER_ID) String userId,
            @PathVariable String strategyId
    ) {
        return strategyLifecycleService.lineage(userId, strategyId);
    }

    @GetMapping("/api/strategies/{strategyId}/versions/{version}")
    @Operation(summary = "Strategy version", description = "One version with its hypothesis, explainability trace and backtest.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Found"),
            @ApiResponse(responseCode = "404", description = "Unknown strategy version")
    })
    public StrategyDto getVersion(
            @RequestHeader(UserHeaders.USER_ID) String userId,
            @PathVariable String strategyId,
            @PathVariable int version
    ) {
        return strategyLifecycleService.toDto(strategyLifecycleService.get(userId, strategyId, version));
    }

    @PostMapping("/api/rankings")
    @Operation(summary = "Rank strategies", description = "Orders the given strategy versions with the active policy and the current learning snapshot.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Ranked"),
            @ApiResponse(responseCode = "404", description = "Unknown strategy version")
    })
    public RankingDto rank(
            @RequestHeader(UserHeaders.USER_ID) String userId,
            @RequestBody @Valid RankingRequest request
    ) {
        return rankingService.rank(userId, request);
    }
}
