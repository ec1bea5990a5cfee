package org.nowstart.compass.strategy.ranking;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.nowstart.compass.data.property.RankingProperties;

class WeightedLearningRankingPolicyTest {

    private final WeightedLearningRankingPolicy policy = new WeightedLearningRankingPolicy(
            new RankingProperties("weighted-learning", 1.0, 0.5, 0.3, 0.2, 0.1)
    );

    @Test
    void rank_prefersFamiliesWithBetterLearnedOutcomes() {
        LearningSnapshot snapshot = new LearningSnapshot(3L, Instant.EPOCH, Map.of(
                "equal_weight", new FamilyLearning("equal_weight", 2L, 0.05, 0.10, 0.9, 0.8, 12),
                "signal_weighted", new FamilyLearning("signal_weighted", 5L, -0.02, 0.30, 0.4, 0.2, 8)
        ));
        List<RankingCandidate> candidates = List.of(
                new RankingCandidate("signal_weighted", "signal_weighted", 0.9),
                new RankingCandidate("equal_weight", "equal_weight", 0.0)
        );

        List<RankedCandidate> ranked = policy.rank(candidates, snapshot);

        assertThat(ranked).extracting(item -> item.candidate().candidateKey())
                .containsExactly("equal_weight", "signal_weighted");
        assertThat(ranked.get(0).rank()).isEqualTo(1);
        assertThat(ranked.get(0).score()).isCloseTo(0.05 - 0.05 + 0.27 + 0.16, within(1e-12));
        assertThat(ranked.get(0).explanation()).contains("n=12").contains("v2");
    }

    @Test
    void rank_fallsBackToPriorWithoutLearning() {
        List<RankingCandidate> candidates = List.of(
                new RankingCandidate("b", "equal_weight", 0.2),
                new RankingCandidate("a", "signal_weighted", 0.6)
        );

        List<RankedCandidate> ranked = policy.rank(candidates, LearningSnapshot.EMPTY);

        assertThat(ranked).extracting(item -> item.candidate().candidateKey()).containsExactly("a", "b");
        assertThat(ranked.get(0).score()).isCloseTo(0.06, within(1e-12));
        assertThat(ranked.get(1).explanation()).startsWith("no learning metrics");
    }

    @Test
    void rank_breaksTiesByCandidateKey() {
        List<RankingCandidate> candidates = List.of(
                new RankingCandidate("zeta", "equal_weight", 0.0),
                new RankingCandidate("alpha", "equal_weight", 0.0)
        );

        List<RankedCandidate> ranked = policy.rank(candidates, null);

        assertThat(ranked).extracting(item -> item.candidate().candidateKey()).containsExactly("alpha", "zeta");
    }

    @Test
    void backtestPrior_ordersByPriorOnly() {
        LearningSnapshot snapshot = new LearningSnapshot(1L, Instant.EPOCH, Map.of(
                "equal_weight", new FamilyLearning("equal_weight", 1L, 1.0, 0.0, 1.0, 1.0, 3)
        ));
        List<RankedCandidate> ranked = new BacktestPriorRankingPolicy().rank(List.of(
                new RankingCandidate("equal_weight", "equal_weight", 0.1),
                new RankingCandidate("signal_weighted", "signal_weighted", 0.4)
        ), snapshot);

        assertThat(ranked).extracting(item -> item.candidate().candidateKey())
                .containsExactly("signal_weighted", "equal_weight");
    }
}
