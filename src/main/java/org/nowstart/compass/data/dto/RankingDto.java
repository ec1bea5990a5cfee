package org.nowstart.compass.data.dto;

import java.time.Instant;
import java.util.List;

public record RankingDto(
        String policy,
        String learningSnapshotRef,
        Instant learningRefreshedAt,
        List<RankedCandidateDto> ranking
) {
}
