package org.nowstart.compass.data.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;

public record RankingRequest(
        @NotEmpty(message = "strategies are required")
        List<@Valid StrategyRef> strategies
) {

    public record StrategyRef(
            @NotBlank(message = "strategyId is required")
            String strategyId,
            @Min(value = 1, message = "version must be at least 1")
            int version
    ) {
    }
}
