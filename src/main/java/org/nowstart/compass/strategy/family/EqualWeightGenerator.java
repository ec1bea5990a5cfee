package org.nowstart.compass.strategy.family;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import org.nowstart.compass.strategy.core.HypothesisBody;
import org.nowstart.compass.strategy.core.HypothesisCandidate;
import org.nowstart.compass.strategy.core.HypothesisContext;
import org.springframework.stereotype.Component;

@Component
public class EqualWeightGenerator implements HypothesisGenerator {

    public static final String FAMILY = "equal_weight";

    @Override
    public String family() {
        return FAMILY;
    }

    @Override
    public HypothesisCandidate generate(HypothesisContext context, int lookbackBars) {
        List<String> symbols = context.market().symbols().stream()
                .filter(symbol -> !symbol.equals(context.market().benchmarkSymbol()))
                .distinct()
                .sorted()
                .toList();
        if (symbols.isEmpty()) {
            return new HypothesisCandidate(
                    HypothesisBody.of(FAMILY, Map.of(), lookbackBars, List.of("no investable symbols; holding cash")),
                    0.0
            );
        }

        double weight = context.investableFraction() / symbols.size();
        Map<String, Double> weights = new TreeMap<>();
        symbols.forEach(symbol -> weights.put(symbol, weight));
        String reason = String.format(Locale.ROOT, "%d symbols at %.3f each", symbols.size(), weight);
        return new HypothesisCandidate(HypothesisBody.of(FAMILY, weights, lookbackBars, List.of(reason)), 0.0);
    }
}
