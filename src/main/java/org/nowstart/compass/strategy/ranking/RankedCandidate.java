package org.nowstart.compass.strategy.ranking;

public record RankedCandidate(
        RankingCandidate candidate,
        int rank,
        double score,
        String explanation
) {
}
