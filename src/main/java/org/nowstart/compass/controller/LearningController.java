package org.nowstart.compass.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import org.nowstart.compass.data.dto.LearningMetricsDto;
import org.nowstart.compass.data.type.LearningScope;
import org.nowstart.compass.service.LearningMetricsService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/learning")
@RequiredArgsConstructor
@Tag(name = "Learning", description = "Aggregated learning metrics")
public class LearningController {

    private final LearningMetricsService learningMetricsService;

    @GetMapping("/{scopeType}/{scopeKey}")
    @Operation(summary = "Latest learning metrics", description = "scopeType is strategy_family or user_cohort.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Found"),
            @ApiResponse(responseCode = "400", description = "Unknown scope type"),
            @ApiResponse(responseCode = "404", description = "No metrics for the scope")
    })
    public LearningMetricsDto latest(@PathVariable String scopeType, @PathVariable String scopeKey) {
        LearningScope scope = LearningScope.valueOf(scopeType.trim().replace('-', '_').toUpperCase(Locale.ROOT));
        return learningMetricsService.latest(scope, scopeKey);
    }
}
