package org.nowstart.compass.data.dto;

import jakarta.validation.constraints.NotBlank;
import java.time.Instant;

/**
 * Omitted versions resolve to the latest goal version and the latest market snapshot.
 */
public record ProposeRequest(
        @NotBlank(message = "goalId is required")
        String goalId,
        Integer goalVersion,
        @NotBlank(message = "marketContextId is required")
        String marketContextId,
        Instant marketContextAsOf,
        Long seed
) {
}
