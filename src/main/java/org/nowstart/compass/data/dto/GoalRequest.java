package org.nowstart.compass.data.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;

/**
 * Goal extracted from the user's stated intent. Without {@code goalId} a new goal is started;
 * with one, the next version of that goal is appended.
 */
public record GoalRequest(
        @Size(max = 128, message = "goalId must be at most 128 characters")
        String goalId,
        @NotBlank(message = "description is required")
        @Size(max = 1000, message = "description must be at most 1000 characters")
        String description,
        @DecimalMin(value = "0", inclusive = false, message = "targetAmount must be greater than zero")
        BigDecimal targetAmount,
        @Min(value = 1, message = "horizonMonths must be at least 1")
        int horizonMonths,
        @DecimalMin(value = "0", message = "maxDrawdownTolerance must be between 0 and 1")
        @DecimalMax(value = "1", message = "maxDrawdownTolerance must be between 0 and 1")
        double maxDrawdownTolerance
) {
}
