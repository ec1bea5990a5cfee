package org.nowstart.compass.strategy.core;

import java.time.Instant;
import java.util.List;

/**
 * Immutable market context: signals and price history as of one point in time.
 *
 * @param contextId       ingestion-side identifier
 * @param asOf            snapshot timestamp; together with {@code contextId} it identifies the snapshot
 * @param symbols         instruments covered by the snapshot
 * @param benchmarkSymbol instrument used as benchmark, may be null
 * @param signals         scored signals
 * @param events          notable market events
 * @param history         daily closes for the symbols and the benchmark
 */
public record MarketSnapshot(
        String contextId,
        Instant asOf,
        List<String> symbols,
        String benchmarkSymbol,
        List<ScoredSignal> signals,
        List<MarketEvent> events,
        List<PriceBar> history
) {

    public MarketSnapshot {
        if (contextId == null || contextId.isBlank()) {
            throw new IllegalArgumentException("contextId is required");
        }
        if (asOf == null) {
            throw new IllegalArgumentException("asOf is required");
        }
        symbols = symbols == null ? List.of() : List.copyOf(symbols);
        signals = signals == null ? List.of() : List.copyOf(signals);
        events = events == null ? List.of() : List.copyOf(events);
        history = history == null ? List.of() : List.copyOf(history);
    }

    public String recordKey() {
        return contextId + "@" + asOf;
    }

    public List<ScoredSignal> signalsFor(String symbol) {
        return signals.stream()
                .filter(signal -> symbol.equals(signal.symbol()))
                .toList();
    }
}
