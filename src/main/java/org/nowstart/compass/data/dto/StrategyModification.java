package org.nowstart.compass.data.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import java.time.Instant;
import java.util.Map;

/**
 * Change requested on top of an existing strategy version.
 *
 * @param allocations       weight overrides by symbol; 0 removes the symbol
 * @param lookbackBars      replacement lookback, if any
 * @param marketContextId   market context to re-run the backtest against; defaults to the base one
 * @param marketContextAsOf snapshot of that context; defaults to its latest
 * @param note              free text kept on the new version
 */
public record StrategyModification(
        Map<@NotBlank String, @NotNull @DecimalMin("0") @DecimalMax("1") Double> allocations,
        @Positive(message = "lookbackBars must be positive")
        Integer lookbackBars,
        @Size(max = 128, message = "marketContextId must be at most 128 characters")
        String marketContextId,
        Instant marketContextAsOf,
        @Size(max = 1000, message = "note must be at most 1000 characters")
        String note
) {
}
