package org.nowstart.compass.strategy.core;

public record BacktestReport(
        BacktestMetrics metrics,
        ExplainabilityTrace trace
) {

    public BacktestReport {
        if (metrics == null || trace == null) {
            throw new IllegalArgumentException("metrics and trace are required");
        }
    }
}
