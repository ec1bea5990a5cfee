package org.nowstart.compass.data.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

public record OpenDecisionRequest(
        @NotBlank(message = "strategyId is required")
        String strategyId,
        @Min(value = 1, message = "version must be at least 1")
        int version
) {
}
