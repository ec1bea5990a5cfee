package org.nowstart.compass.data.dto;

import java.util.List;

/**
 * Outcome of a proposal: the new strategy, the decision opened on it (null when the backtest
 * failed) and how the generated candidates were ranked.
 */
public record ProposalDto(
        StrategyDto strategy,
        DecisionDto decision,
        List<RankedCandidateDto> ranking
) {
}
