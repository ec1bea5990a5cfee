package org.nowstart.compass.strategy.ranking;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import org.nowstart.compass.data.property.RankingProperties;
import org.springframework.cloud.context.config.annotation.RefreshScope;
import org.springframework.stereotype.Component;

/**
 * Weighted sum of the family's latest learning metrics plus a small share of the candidate prior.
 * Families without metrics score on their prior alone.
 */
@Component
@RefreshScope
@RequiredArgsConstructor
public class WeightedLearningRankingPolicy implements StrategyRankingPolicy {

    public static final String NAME = "weighted-learning";

    private final RankingProperties rankingProperties;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<RankedCandidate> rank(List<RankingCandidate> candidates, LearningSnapshot snapshot) {
        LearningSnapshot resolved = snapshot == null ? LearningSnapshot.EMPTY : snapshot;
        List<Scored> scored = new ArrayList<>();
        for (RankingCandidate candidate : candidates) {
            scored.add(score(candidate, resolved));
        }
        scored.sort(Comparator.comparingDouble((Scored s) -> -s.score())
                .thenComparing(s -> s.candidate().candidateKey()));

        List<RankedCandidate> ranked = new ArrayList<>(scored.size());
        for (int i = 0; i < scored.size(); i++) {
            Scored item = scored.get(i);
            ranked.add(new RankedCandidate(item.candidate(), i + 1, item.score(), item.explanation()));
        }
        return List.copyOf(ranked);
    }

    private Scored score(RankingCandidate candidate, LearningSnapshot snapshot) {
        double prior = rankingProperties.priorWeight() * sanitize(candidate.prior());
        return snapshot.family(candidate.family())
                .map(learning -> {
                    double learned = rankingProperties.alphaWeight() * learning.meanAlpha()
                            - rankingProperties.drawdownWeight() * learning.meanDrawdown()
                            + rankingProperties.trustWeight() * learning.meanTrust()
                            + rankingProperties.acceptanceWeight() * learning.meanAcceptance();
                    double score = sanitize(learned) + prior;
                    String explanation = String.format(
                            Locale.ROOT,
                            "learned=%.4f (alpha=%.4f drawdown=%.4f trust=%.4f acceptance=%.4f n=%d v%d) prior=%.4f",
                            learned,
                            learning.meanAlpha(),
                            learning.meanDrawdown(),
                            learning.meanTrust(),
                            learning.meanAcceptance(),
                            learning.sampleCount(),
                            learning.snapshotVersion(),
                            prior
                    );
                    return new Scored(candidate, score, explanation);
                })
                .orElseGet(() -> new Scored(
                        candidate,
                        prior,
                        String.format(Locale.ROOT, "no learning metrics; prior=%.4f", prior)
                ));
    }

    private double sanitize(double value) {
        return Double.isFinite(value) ? value : 0.0;
    }

    private record Scored(
            RankingCandidate candidate,
            double score,
            String explanation
    ) {
    }
}
