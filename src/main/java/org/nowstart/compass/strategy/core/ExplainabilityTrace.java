package org.nowstart.compass.strategy.core;

import java.util.List;

/**
 * Human-readable account of which signals and time windows drove a backtest result.
 */
public record ExplainabilityTrace(
        String summary,
        List<TraceEntry> entries
) {

    public ExplainabilityTrace {
        if (summary == null || summary.isBlank()) {
            throw new IllegalArgumentException("trace summary is required");
        }
        entries = entries == null ? List.of() : List.copyOf(entries);
    }
}
