package org.nowstart.compass.data.dto;

import java.time.Instant;
import java.util.List;

public record ExecutionTraceDto(
        String traceId,
        String decisionId,
        String originDecisionId,
        String strategyKey,
        String strategyFamily,
        Instant startedAt,
        Instant completedAt,
        List<ExecutionEventDto> events
) {
}
