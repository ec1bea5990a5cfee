package org.nowstart.compass.data.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.Instant;
import java.util.List;
import org.nowstart.compass.strategy.core.MarketEvent;
import org.nowstart.compass.strategy.core.MarketSnapshot;
import org.nowstart.compass.strategy.core.PriceBar;
import org.nowstart.compass.strategy.core.ScoredSignal;

/**
 * Market snapshot as delivered by the ingestion service, pushed or pulled.
 */
public record MarketContextRequest(
        @NotBlank(message = "contextId is required")
        @Size(max = 128, message = "contextId must be at most 128 characters")
        String contextId,
        @NotNull(message = "asOf is required")
        Instant asOf,
        @NotEmpty(message = "symbols are required")
        List<String> symbols,
        String benchmarkSymbol,
        List<ScoredSignal> signals,
        List<MarketEvent> events,
        List<PriceBar> history
) {

    public MarketSnapshot toSnapshot() {
        return new MarketSnapshot(contextId, asOf, symbols, benchmarkSymbol, signals, events, history);
    }
}
