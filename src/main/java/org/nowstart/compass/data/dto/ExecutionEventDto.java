package org.nowstart.compass.data.dto;

import java.time.Instant;
import java.util.Map;
import org.nowstart.compass.data.type.ExecutionEventType;

public record ExecutionEventDto(
        int sequence,
        ExecutionEventType type,
        Map<String, Object> payload,
        Integer compensatesSequence,
        Instant recordedAt
) {
}
