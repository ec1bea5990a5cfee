package org.nowstart.compass.service;

import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.nowstart.compass.data.dto.DecisionDto;
import org.nowstart.compass.data.dto.ProposalDto;
import org.nowstart.compass.data.dto.ProposeRequest;
import org.nowstart.compass.data.dto.RankedCandidateDto;
import org.nowstart.compass.data.dto.StrategyDto;
import org.nowstart.compass.data.dto.StrategyModification;
import org.nowstart.compass.data.entity.StrategyRecord;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Proposal entry point: proposes a strategy and, when it is proposable, opens its decision in the
 * same transaction so a surfaced strategy always has a checkpoint waiting.
 */
@Service
@RequiredArgsConstructor
public class AdvisoryWorkflowService {

    private final StrategyLifecycleService strategyLifecycleService;
    private final DecisionStateMachineService decisionStateMachineService;

    @Transactional
    public ProposalDto propose(String userId, ProposeRequest request) {
        StrategyLifecycleService.Proposal proposal = strategyLifecycleService.propose(userId, request);
        return new ProposalDto(
                strategyLifecycleService.toDto(proposal.strategy()),
                openIfProposable(proposal.strategy()),
                proposal.ranking().stream().map(RankedCandidateDto::from).toList()
        );
    }

    /**
     * Forks a strategy outside a decision, typically to retry a failed backtest with a richer
     * market context, and opens a decision on the fork when it is proposable.
     */
    @Transactional
    public ProposalDto fork(String userId, String strategyId, int version, StrategyModification modification) {
        StrategyRecord forked = strategyLifecycleService.fork(userId, strategyId, version, modification);
        StrategyDto strategy = strategyLifecycleService.toDto(forked);
        return new ProposalDto(strategy, openIfProposable(forked), List.of());
    }

    private DecisionDto openIfProposable(StrategyRecord strategy) {
        if (!strategy.isProposable()) {
            return null;
        }
        return decisionStateMachineService.toDto(
                decisionStateMachineService.openFor(strategy, null, UUID.randomUUID().toString())
        );
    }
}
