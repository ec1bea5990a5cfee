package org.nowstart.compass.service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.compass.data.dto.EvaluationRequest;
import org.nowstart.compass.data.dto.PerformanceDto;
import org.nowstart.compass.data.entity.DecisionResolution;
import org.nowstart.compass.data.entity.ExecutionTrace;
import org.nowstart.compass.data.entity.PortfolioPerformance;
import org.nowstart.compass.data.entity.UserFeedback;
import org.nowstart.compass.data.entity.UserProfile;
import org.nowstart.compass.data.exception.ConcurrentRecordModificationException;
import org.nowstart.compass.data.property.ScoringProperties;
import org.nowstart.compass.repository.DecisionResolutionRepository;
import org.nowstart.compass.repository.PortfolioPerformanceRepository;
import org.nowstart.compass.repository.UserFeedbackRepository;
import org.nowstart.compass.repository.UserProfileRepository;
import org.springframework.cloud.context.config.annotation.RefreshScope;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Evaluates execution traces against realised market outcomes.
 *
 * <p>Every evaluation is a new record; a trace's evaluations form a series ordered by
 * {@code asOf} no matter in which order they arrive. Two evaluations of one trace at the same
 * {@code asOf} conflict.
 */
@Slf4j
@Service
@RefreshScope
@RequiredArgsConstructor
public class PerformanceAggregatorService {

    private static final String UNKNOWN_COHORT = "unassigned";

    private final PortfolioPerformanceRepository portfolioPerformanceRepository;
    private final DecisionResolutionRepository decisionResolutionRepository;
    private final UserFeedbackRepository userFeedbackRepository;
    private final UserProfileRepository userProfileRepository;
    private final ExecutionTraceService executionTraceService;
    private final PerformanceScorer performanceScorer;
    private final ScoringProperties scoringProperties;
    private final ApplicationEventPublisher applicationEventPublisher;
    private final Clock clock;

    @Transactional
    public PerformanceDto evaluate(String userId, String traceId, EvaluationRequest request) {
        ExecutionTrace trace = executionTraceService.getScoped(userId, traceId);
        PerformanceScorer.OutcomeReturns returns = performanceScorer.returns(request.outcome());
        Instant asOf = request.asOf() == null ? returns.periodEnd() : request.asOf();

        Integer rating = request.feedbackRating() != null
                ? request.feedbackRating()
                : latestRating(trace);
        List<DecisionResolution> familyResolutions = decisionResolutionRepository.findByStrategyFamilyOrderByDecidedAtDesc(
                trace.getStrategyFamily(),
                PageRequest.of(0, scoringProperties.trustWindow())
        );
        List<DecisionResolution> recentResolutions = decisionResolutionRepository.findByUserIdOrderByDecidedAtDesc(
                userId,
                PageRequest.of(0, scoringProperties.acceptanceWindow())
        );
        String cohort = userProfileRepository.findById(userId)
                .map(UserProfile::getCohort)
                .orElse(UNKNOWN_COHORT);

        PortfolioPerformance performance = PortfolioPerformance.builder()
                .performanceId(UUID.randomUUID())
                .traceId(traceId)
                .strategyFamily(trace.getStrategyFamily())
                .userId(userId)
                .userCohort(cohort)
                .alpha(returns.alpha())
                .drawdown(returns.drawdown())
                .trustScore(performanceScorer.trust(familyResolutions, rating))
                .acceptanceRate(performanceScorer.acceptance(recentResolutions))
                .totalReturn(returns.totalReturn())
                .benchmarkReturn(returns.benchmarkReturn())
                .periodStart(returns.periodStart())
                .periodEnd(returns.periodEnd())
                .feedbackRating(rating)
                .asOf(asOf)
                .build();
        try {
            portfolioPerformanceRepository.saveAndFlush(performance);
        } catch (DataIntegrityViolationException exception) {
            throw new ConcurrentRecordModificationException(traceId, asOf.toString(), "Trace " + traceId + " already has an evaluation as of " + asOf);
        }

        log.info(
                "event=evaluation_recorded trace_id={} family={} cohort={} as_of={} alpha={} drawdown={} trust={} acceptance={} recorded_at={}",
                traceId,
                performance.getStrategyFamily(),
                cohort,
                asOf,
                performance.getAlpha(),
                performance.getDrawdown(),
                performance.getTrustScore(),
                performance.getAcceptanceRate(),
                clock.instant()
        );
        applicationEventPublisher.publishEvent(new PerformanceRecordedEvent(traceId, performance.getStrategyFamily(), cohort, asOf));
        return PerformanceDto.from(performance);
    }

    /**
     * All evaluations of a trace in non-decreasing {@code asOf} order.
     */
    public List<PerformanceDto> history(String userId, String traceId) {
        executionTraceService.getScoped(userId, traceId);
        return portfolioPerformanceRepository.findByTraceIdOrderByAsOfAsc(traceId).stream()
                .map(PerformanceDto::from)
                .toList();
    }

    private Integer latestRating(ExecutionTrace trace) {
        Integer rating = userFeedbackRepository.findTopByDecisionIdOrderBySubmittedAtDesc(trace.getDecisionId())
                .map(UserFeedback::getRating)
                .orElse(null);
        if (rating != null || trace.getOriginDecisionId() == null || trace.getOriginDecisionId().equals(trace.getDecisionId())) {
            return rating;
        }
        return userFeedbackRepository.findTopByDecisionIdOrderBySubmittedAtDesc(trace.getOriginDecisionId())
                .map(UserFeedback::getRating)
                .orElse(null);
    }
}
