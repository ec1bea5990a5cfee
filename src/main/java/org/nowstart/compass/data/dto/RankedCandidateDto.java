package org.nowstart.compass.data.dto;

import org.nowstart.compass.strategy.ranking.RankedCandidate;

public record RankedCandidateDto(
        int rank,
        String candidateKey,
        String family,
        double score,
        String explanation
) {

    public static RankedCandidateDto from(RankedCandidate ranked) {
        return new RankedCandidateDto(
                ranked.rank(),
                ranked.candidate().candidateKey(),
                ranked.candidate().family(),
                ranked.score(),
                ranked.explanation()
        );
    }
}
