package org.nowstart.compass.data.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import org.nowstart.compass.data.type.DecisionOutcome;

/**
 * {@code modification} is required for {@code MODIFIED} and ignored otherwise.
 */
public record DecideRequest(
        @NotNull(message = "outcome is required")
        DecisionOutcome outcome,
        @Size(max = 255, message = "reasonCode must be at most 255 characters")
        String reasonCode,
        @Valid
        StrategyModification modification
) {
}
