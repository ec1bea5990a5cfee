package org.nowstart.compass.data.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.Instant;
import java.util.List;

/**
 * Realised market outcome of an execution trace.
 *
 * @param outcome        portfolio and benchmark values over the evaluation period, at least two points
 * @param asOf           evaluation time; defaults to the last outcome point
 * @param feedbackRating user rating to blend into trust; defaults to the latest stored feedback
 */
public record EvaluationRequest(
        @NotNull(message = "outcome is required")
        @Size(min = 2, message = "outcome needs at least two points")
        List<@Valid OutcomePoint> outcome,
        Instant asOf,
        @Min(value = 1, message = "feedbackRating must be between 1 and 5")
        @Max(value = 5, message = "feedbackRating must be between 1 and 5")
        Integer feedbackRating
) {
}
