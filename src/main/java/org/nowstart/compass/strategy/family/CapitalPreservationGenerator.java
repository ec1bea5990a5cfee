package org.nowstart.compass.strategy.family;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import org.nowstart.compass.strategy.core.HypothesisBody;
import org.nowstart.compass.strategy.core.HypothesisCandidate;
import org.nowstart.compass.strategy.core.HypothesisContext;
import org.nowstart.compass.strategy.core.ScoredSignal;
import org.springframework.stereotype.Component;

/**
 * Invests half of the usual budget, scaled down further by the goal's drawdown tolerance, and only
 * in symbols with no risk or alert signal.
 */
@Component
public class CapitalPreservationGenerator implements HypothesisGenerator {

    public static final String FAMILY = "capital_preservation";

    private static final double BUDGET_SHARE = 0.5;
    private static final double REFERENCE_DRAWDOWN = 0.2;

    @Override
    public String family() {
        return FAMILY;
    }

    @Override
    public HypothesisCandidate generate(HypothesisContext context, int lookbackBars) {
        List<String> rationale = new ArrayList<>();
        List<String> safe = new ArrayList<>();
        for (String symbol : context.market().symbols()) {
            if (symbol.equals(context.market().benchmarkSymbol())) {
                continue;
            }
            boolean adverse = context.market().signalsFor(symbol).stream()
                    .anyMatch(signal -> signal.type() != null && signal.type().isAdverse());
            if (adverse) {
                rationale.add(symbol + " excluded: risk or alert signal present");
                continue;
            }
            safe.add(symbol);
        }

        if (safe.isEmpty()) {
            rationale.add("no symbol without adverse signals; holding cash");
            return new HypothesisCandidate(HypothesisBody.of(FAMILY, Map.of(), lookbackBars, rationale), 0.0);
        }

        double tolerance = context.maxDrawdownTolerance() > 0.0
                ? Math.min(1.0, context.maxDrawdownTolerance() / REFERENCE_DRAWDOWN)
                : 1.0;
        double budget = context.investableFraction() * BUDGET_SHARE * tolerance;
        double weight = budget / safe.size();
        Map<String, Double> weights = new TreeMap<>();
        safe.stream().sorted().forEach(symbol -> weights.put(symbol, weight));
        rationale.add(String.format(Locale.ROOT, "%d symbols without adverse signals at %.3f each", safe.size(), weight));

        double prior = context.market().signals().stream()
                .filter(signal -> weights.containsKey(signal.symbol()))
                .mapToDouble(ScoredSignal::confidence)
                .average()
                .orElse(0.0) * BUDGET_SHARE;
        return new HypothesisCandidate(HypothesisBody.of(FAMILY, weights, lookbackBars, rationale), prior);
    }
}
