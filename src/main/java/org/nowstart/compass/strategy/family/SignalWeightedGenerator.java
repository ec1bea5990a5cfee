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
 * Weights symbols by their net confidence-weighted signal score. Symbols whose net score is not
 * positive get nothing.
 */
@Component
public class SignalWeightedGenerator implements HypothesisGenerator {

    public static final String FAMILY = "signal_weighted";

    @Override
    public String family() {
        return FAMILY;
    }

    @Override
    public HypothesisCandidate generate(HypothesisContext context, int lookbackBars) {
        Map<String, Double> netScore = new TreeMap<>();
        for (String symbol : context.market().symbols()) {
            double score = context.market().signalsFor(symbol).stream()
                    .mapToDouble(ScoredSignal::weightedScore)
                    .sum();
            if (score > 0.0) {
                netScore.put(symbol, score);
            }
        }

        double budget = context.investableFraction();
        List<String> rationale = new ArrayList<>();
        if (netScore.isEmpty()) {
            rationale.add("no symbol has a net positive signal; holding cash");
            return new HypothesisCandidate(HypothesisBody.of(FAMILY, Map.of(), lookbackBars, rationale), 0.0);
        }

        double total = netScore.values().stream().mapToDouble(Double::doubleValue).sum();
        Map<String, Double> weights = new TreeMap<>();
        netScore.forEach((symbol, score) -> {
            double weight = budget * score / total;
            weights.put(symbol, weight);
            rationale.add(String.format(Locale.ROOT, "%s net signal %.3f -> weight %.3f", symbol, score, weight));
        });

        double prior = context.market().signals().stream()
                .filter(signal -> netScore.containsKey(signal.symbol()))
                .mapToDouble(ScoredSignal::confidence)
                .average()
                .orElse(0.0);
        return new HypothesisCandidate(HypothesisBody.of(FAMILY, weights, lookbackBars, rationale), prior);
    }
}
