package org.nowstart.compass.service;

import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.Set;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.compass.data.dto.DecideRequest;
import org.nowstart.compass.data.dto.DecisionDto;
import org.nowstart.compass.data.dto.FeedbackDto;
import org.nowstart.compass.data.dto.FeedbackRequest;
import org.nowstart.compass.data.entity.Decision;
import org.nowstart.compass.data.entity.DecisionResolution;
import org.nowstart.compass.data.entity.ExecutionTrace;
import org.nowstart.compass.data.entity.StrategyRecord;
import org.nowstart.compass.data.entity.UserFeedback;
import org.nowstart.compass.data.exception.InvalidTransitionException;
import org.nowstart.compass.data.exception.RecordNotFoundException;
import org.nowstart.compass.data.type.DecisionOutcome;
import org.nowstart.compass.data.type.DecisionState;
import org.nowstart.compass.repository.DecisionRepository;
import org.nowstart.compass.repository.DecisionResolutionRepository;
import org.nowstart.compass.repository.UserFeedbackRepository;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * The human checkpoint between a proposable strategy and its execution.
 *
 * <p>A decision is opened {@code PROPOSED} and resolved exactly once. The resolution is a record
 * of its own keyed by the decision id, so of two concurrent resolutions only the first insert
 * succeeds and the other one fails as an invalid transition.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DecisionStateMachineService {

    private final DecisionRepository decisionRepository;
    private final DecisionResolutionRepository decisionResolutionRepository;
    private final UserFeedbackRepository userFeedbackRepository;
    private final StrategyLifecycleService strategyLifecycleService;
    private final ExecutionTraceService executionTraceService;
    private final Clock clock;

    @Transactional
    public DecisionDto open(String userId, String strategyId, int version) {
        StrategyRecord strategy = strategyLifecycleService.get(userId, strategyId, version);
        return toDto(openFor(strategy, null, UUID.randomUUID().toString()));
    }

    /**
     * Opens the decision of a strategy version. Only proposable versions can be decided on, and
     * each version gets at most one decision.
     */
    @Transactional
    public Decision openFor(StrategyRecord strategy, String parentDecisionId, String decisionId) {
        String version = String.valueOf(strategy.getVersion());
        if (!strategy.isProposable()) {
            throw new InvalidTransitionException(
                    strategy.getStrategyId(),
                    version,
                    "Strategy " + strategy.getRecordKey() + " is " + strategy.getStatus() + " and cannot be decided on"
            );
        }
        if (decisionRepository.findByStrategyKey(strategy.getRecordKey()).isPresent()) {
            throw new InvalidTransitionException(strategy.getStrategyId(), version, "Strategy " + strategy.getRecordKey() + " already has a decision");
        }

        Decision decision = Decision.builder()
                .decisionId(decisionId)
                .strategyKey(strategy.getRecordKey())
                .strategyId(strategy.getStrategyId())
                .strategyVersion(strategy.getVersion())
                .strategyFamily(strategy.getFamily())
                .userId(strategy.getUserId())
                .parentDecisionId(parentDecisionId)
                .proposedAt(clock.instant())
                .build();
        try {
            decisionRepository.saveAndFlush(decision);
        } catch (DataIntegrityViolationException exception) {
            throw new InvalidTransitionException(strategy.getStrategyId(), version, "Strategy " + strategy.getRecordKey() + " already has a decision");
        }
        log.info(
                "event=decision_opened decision_id={} strategy={} parent_decision_id={} user_id={}",
                decisionId,
                strategy.getRecordKey(),
                parentDecisionId,
                strategy.getUserId()
        );
        return decision;
    }

    /**
     * Resolves a proposed decision.
     *
     * <ul>
     *     <li>{@code ACCEPTED} starts the decision's execution trace.</li>
     *     <li>{@code MODIFIED} forks the strategy and, when the fork's backtest succeeds, opens a
     *     new decision on it. A failed fork is stored as {@code BACKTEST_FAILED} without one.</li>
     *     <li>{@code REJECTED} only records the reason.</li>
     * </ul>
     */
    @Transactional
    public DecisionDto decide(String userId, String decisionId, DecideRequest request) {
        Decision decision = getScoped(userId, decisionId);
        if (decisionResolutionRepository.existsById(decisionId)) {
            throw new InvalidTransitionException(decisionId, null, "Decision " + decisionId + " is already resolved");
        }

        DecisionOutcome outcome = request.outcome();
        DecisionResolution.DecisionResolutionBuilder resolution = DecisionResolution.builder()
                .decisionId(decisionId)
                .outcome(outcome)
                .userId(decision.getUserId())
                .strategyFamily(decision.getStrategyFamily())
                .reasonCode(request.reasonCode())
                .decidedAt(clock.instant());

        switch (outcome) {
            case ACCEPTED -> {
                resolve(resolution.build());
                executionTraceService.start(decision, originOf(decision));
            }
            case REJECTED -> resolve(resolution.build());
            case MODIFIED -> {
                if (request.modification() == null) {
                    throw new IllegalArgumentException("modification is required to modify a decision");
                }
                resolve(resolution
                        .modifiedStrategyKey(StrategyRecord.key(decision.getStrategyId(), decision.getStrategyVersion() + 1))
                        .build());
                StrategyRecord fork = strategyLifecycleService.fork(
                        userId,
                        decision.getStrategyId(),
                        decision.getStrategyVersion(),
                        request.modification()
                );
                if (fork.isProposable()) {
                    openFor(fork, decisionId, UUID.randomUUID().toString());
                } else {
                    log.warn(
                            "event=decision_modified_fork_not_proposable decision_id={} strategy={} status={} failure_code={}",
                            decisionId,
                            fork.getRecordKey(),
                            fork.getStatus(),
                            fork.getFailureCode()
                    );
                }
            }
            default -> throw new IllegalArgumentException("Unsupported outcome " + outcome);
        }

        log.info(
                "event=decision_resolved decision_id={} outcome={} strategy={} family={} reason_code={}",
                decisionId,
                outcome,
                decision.getStrategyKey(),
                decision.getStrategyFamily(),
                request.reasonCode()
        );
        return toDto(decision);
    }

    /**
     * Records the user's rating of a resolved decision. Ratings can be given repeatedly; the
     * latest one counts.
     */
    @Transactional
    public FeedbackDto submitFeedback(String userId, String decisionId, FeedbackRequest request) {
        Decision decision = getScoped(userId, decisionId);
        if (!decisionResolutionRepository.existsById(decisionId)) {
            throw new InvalidTransitionException(decisionId, null, "Decision " + decisionId + " is not resolved yet");
        }
        UserFeedback feedback = UserFeedback.builder()
                .feedbackId(UUID.randomUUID())
                .decisionId(decision.getDecisionId())
                .userId(userId)
                .rating(request.rating())
                .comment(request.comment())
                .submittedAt(clock.instant())
                .build();
        userFeedbackRepository.save(feedback);
        log.info("event=feedback_submitted decision_id={} user_id={} rating={}", decisionId, userId, request.rating());
        return FeedbackDto.from(feedback);
    }

    public DecisionDto get(String userId, String decisionId) {
        return toDto(getScoped(userId, decisionId));
    }

    public Decision getScoped(String userId, String decisionId) {
        return decisionRepository.findById(decisionId)
                .filter(decision -> decision.getUserId().equals(userId))
                .orElseThrow(() -> new RecordNotFoundException("Decision", decisionId, null));
    }

    public DecisionDto toDto(Decision decision) {
        DecisionResolution resolution = decisionResolutionRepository.findById(decision.getDecisionId()).orElse(null);
        String traceId = executionTraceService.findByDecision(decision.getDecisionId())
                .map(ExecutionTrace::getTraceId)
                .orElse(null);
        Instant decidedAt = resolution == null ? null : resolution.getDecidedAt();
        String followUpDecisionId = resolution == null || resolution.getModifiedStrategyKey() == null
                ? null
                : decisionRepository.findByStrategyKey(resolution.getModifiedStrategyKey())
                        .map(Decision::getDecisionId)
                        .orElse(null);
        return new DecisionDto(
                decision.getDecisionId(),
                decision.getStrategyId(),
                decision.getStrategyVersion(),
                decision.getStrategyFamily(),
                DecisionState.of(resolution == null ? null : resolution.getOutcome()),
                decision.getParentDecisionId(),
                resolution == null ? null : resolution.getModifiedStrategyKey(),
                followUpDecisionId,
                resolution == null ? null : resolution.getReasonCode(),
                traceId,
                decision.getProposedAt(),
                decidedAt
        );
    }

    private void resolve(DecisionResolution resolution) {
        try {
            decisionResolutionRepository.saveAndFlush(resolution);
        } catch (DataIntegrityViolationException exception) {
            throw new InvalidTransitionException(resolution.getDecisionId(), null, "Decision " + resolution.getDecisionId() + " was resolved concurrently");
        }
    }

    // first decision of a modify chain
    private String originOf(Decision decision) {
        Decision current = decision;
        Set<String> seen = new HashSet<>();
        while (current.getParentDecisionId() != null && seen.add(current.getDecisionId())) {
            current = decisionRepository.findById(current.getParentDecisionId()).orElse(current);
        }
        return current.getDecisionId();
    }
}
