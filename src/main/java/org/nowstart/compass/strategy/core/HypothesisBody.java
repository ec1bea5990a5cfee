package org.nowstart.compass.strategy.core;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * The investable content of a strategy hypothesis.
 *
 * <p>Allocations are kept sorted by symbol so that serialisation and backtests are stable. Whatever
 * is not allocated is held as cash.
 *
 * @param family       generator family that produced the hypothesis
 * @param allocations  target weights, sum at most 1
 * @param lookbackBars history the hypothesis should be tested against
 * @param rationale    human-readable reasons behind the allocation
 */
public record HypothesisBody(
        String family,
        List<Allocation> allocations,
        int lookbackBars,
        List<String> rationale
) {

    private static final double WEIGHT_TOLERANCE = 1e-9;

    public HypothesisBody {
        if (family == null || family.isBlank()) {
            throw new IllegalArgumentException("family is required");
        }
        if (lookbackBars <= 0) {
            throw new IllegalArgumentException("lookbackBars must be positive");
        }
        List<Allocation> sorted = new ArrayList<>(allocations == null ? List.of() : allocations);
        sorted.sort(Comparator.comparing(Allocation::symbol));
        allocations = List.copyOf(sorted);
        double total = allocations.stream().mapToDouble(Allocation::weight).sum();
        if (total > 1.0 + WEIGHT_TOLERANCE) {
            throw new IllegalArgumentException("allocations must not exceed 1.0, got " + total);
        }
        rationale = rationale == null ? List.of() : List.copyOf(rationale);
    }

    public static HypothesisBody of(String family, Map<String, Double> weights, int lookbackBars, List<String> rationale) {
        List<Allocation> allocations = weights.entrySet().stream()
                .filter(entry -> entry.getValue() != null && entry.getValue() > 0.0)
                .map(entry -> new Allocation(entry.getKey(), entry.getValue()))
                .toList();
        return new HypothesisBody(family, allocations, lookbackBars, rationale);
    }

    public double investedWeight() {
        return allocations.stream().mapToDouble(Allocation::weight).sum();
    }
}
