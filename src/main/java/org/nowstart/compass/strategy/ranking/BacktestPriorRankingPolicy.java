package org.nowstart.compass.strategy.ranking;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Component;

/**
 * Ignores learning metrics and orders by the candidate's own prior. Useful as a baseline while no
 * outcomes have been evaluated yet.
 */
@Component
public class BacktestPriorRankingPolicy implements StrategyRankingPolicy {

    public static final String NAME = "backtest-prior";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<RankedCandidate> rank(List<RankingCandidate> candidates, LearningSnapshot snapshot) {
        List<RankingCandidate> sorted = new ArrayList<>(candidates);
        sorted.sort(Comparator.comparingDouble((RankingCandidate c) -> Double.isFinite(c.prior()) ? -c.prior() : 0.0)
                .thenComparing(RankingCandidate::candidateKey));
        List<RankedCandidate> ranked = new ArrayList<>(sorted.size());
        for (int i = 0; i < sorted.size(); i++) {
            RankingCandidate candidate = sorted.get(i);
            ranked.add(new RankedCandidate(
                    candidate,
                    i + 1,
                    candidate.prior(),
                    String.format(Locale.ROOT, "prior=%.4f", candidate.prior())
            ));
        }
        return List.copyOf(ranked);
    }
}
