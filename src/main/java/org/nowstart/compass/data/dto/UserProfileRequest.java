package org.nowstart.compass.data.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import org.nowstart.compass.data.type.RiskTolerance;

public record UserProfileRequest(
        @NotBlank(message = "cohort is required")
        @Size(max = 100, message = "cohort must be at most 100 characters")
        String cohort,
        @NotNull(message = "riskTolerance is required")
        RiskTolerance riskTolerance,
        @DecimalMin(value = "0", message = "maxDrawdownTolerance must be between 0 and 1")
        @DecimalMax(value = "1", message = "maxDrawdownTolerance must be between 0 and 1")
        double maxDrawdownTolerance,
        @DecimalMin(value = "0", message = "lossAversionScore must be between 0 and 1")
        @DecimalMax(value = "1", message = "lossAversionScore must be between 0 and 1")
        double lossAversionScore,
        boolean explainableOnly
) {
}
