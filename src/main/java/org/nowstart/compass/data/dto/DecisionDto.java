package org.nowstart.compass.data.dto;

import java.time.Instant;
import org.nowstart.compass.data.type.DecisionState;

public record DecisionDto(
        String decisionId,
        String strategyId,
        int strategyVersion,
        String strategyFamily,
        DecisionState state,
        String parentDecisionId,
        String modifiedStrategyKey,
        String followUpDecisionId,
        String reasonCode,
        String traceId,
        Instant proposedAt,
        Instant decidedAt
) {
}
