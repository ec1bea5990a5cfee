package org.nowstart.compass.strategy.ranking;

import java.util.List;

/**
 * Pluggable ordering of strategy candidates.
 *
 * <p>Implementations read the snapshot and never modify learning metrics. They must be
 * deterministic for a given candidate list and snapshot.
 */
public interface StrategyRankingPolicy {

    /**
     * Returns the name the policy is selected by in {@code compass.ranking.policy}.
     */
    String name();

    /**
     * Orders the candidates best first.
     */
    List<RankedCandidate> rank(List<RankingCandidate> candidates, LearningSnapshot snapshot);
}
