package org.nowstart.compass.strategy.core;

public record Allocation(
        String symbol,
        double weight
) {

    public Allocation {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("allocation symbol is required");
        }
        if (!Double.isFinite(weight) || weight < 0.0 || weight > 1.0) {
            throw new IllegalArgumentException("allocation weight for " + symbol + " must be in [0, 1]");
        }
    }
}
