package org.nowstart.compass.data.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Instant;

public record OutcomePoint(
        @NotNull(message = "timestamp is required")
        Instant timestamp,
        @Positive(message = "portfolioValue must be positive")
        double portfolioValue,
        @Positive(message = "benchmarkValue must be positive")
        double benchmarkValue
) {
}
