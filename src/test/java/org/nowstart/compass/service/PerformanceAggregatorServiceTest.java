package org.nowstart.compass.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.nowstart.compass.data.dto.EvaluationRequest;
import org.nowstart.compass.data.dto.OutcomePoint;
import org.nowstart.compass.data.dto.PerformanceDto;
import org.nowstart.compass.data.entity.DecisionResolution;
import org.nowstart.compass.data.entity.ExecutionTrace;
import org.nowstart.compass.data.entity.PortfolioPerformance;
import org.nowstart.compass.data.entity.UserFeedback;
import org.nowstart.compass.data.entity.UserProfile;
import org.nowstart.compass.data.exception.ConcurrentRecordModificationException;
import org.nowstart.compass.data.exception.RecordNotFoundException;
import org.nowstart.compass.data.property.ScoringProperties;
import org.nowstart.compass.data.type.DecisionOutcome;
import org.nowstart.compass.data.type.RiskTolerance;
import org.nowstart.compass.repository.DecisionResolutionRepository;
import org.nowstart.compass.repository.PortfolioPerformanceRepository;
import org.nowstart.compass.repository.UserFeedbackRepository;
import org.nowstart.compass.repository.UserProfileRepository;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;

@ExtendWith(MockitoExtension.class)
class PerformanceAggregatorServiceTest {

    private static final String USER_ID = "user-1";
    private static final String TRACE_ID = "trace-1";
    private static final Instant T0 = Instant.parse("2024-06-01T00:00:00Z");
    private static final Instant T1 = Instant.parse("2024-06-08T00:00:00Z");

    @Mock
    private PortfolioPerformanceRepository portfolioPerformanceRepository;
    @Mock
    private DecisionResolutionRepository decisionResolutionRepository;
    @Mock
    private UserFeedbackRepository userFeedbackRepository;
    @Mock
    private UserProfileRepository userProfileRepository;
    @Mock
    private ExecutionTraceService executionTraceService;
    @Mock
    private ApplicationEventPublisher applicationEventPublisher;

    private PerformanceAggregatorService performanceAggregatorService;

    @BeforeEach
    void setUp() {
        ScoringProperties scoringProperties = new ScoringProperties(0.5, 0.2, 20, 200);
        performanceAggregatorService = new PerformanceAggregatorService(
                portfolioPerformanceRepository,
                decisionResolutionRepository,
                userFeedbackRepository,
                userProfileRepository,
                executionTraceService,
                new PerformanceScorer(scoringProperties),
                scoringProperties,
                applicationEventPublisher,
                Clock.fixed(T1, ZoneOffset.UTC)
        );
        lenient().when(executionTraceService.getScoped(USER_ID, TRACE_ID)).thenReturn(trace());
    }

    @Test
    void evaluate_recordsObjectivesAndPublishesEvent() {
        when(userProfileRepository.findById(USER_ID)).thenReturn(Optional.of(profile()));
        when(userFeedbackRepository.findTopByDecisionIdOrderBySubmittedAtDesc("d-2")).thenReturn(Optional.empty());
        when(userFeedbackRepository.findTopByDecisionIdOrderBySubmittedAtDesc("d-1")).thenReturn(Optional.of(feedback(5)));

        PerformanceDto result = performanceAggregatorService.evaluate(USER_ID, TRACE_ID, request(null, null));

        ArgumentCaptor<PortfolioPerformance> captor = ArgumentCaptor.forClass(PortfolioPerformance.class);
        verify(portfolioPerformanceRepository).saveAndFlush(captor.capture());
        PortfolioPerformance saved = captor.getValue();
        assertThat(saved.getUserCohort()).isEqualTo("cohort-a");
        assertThat(saved.getStrategyFamily()).isEqualTo("signal_weighted");
        assertThat(saved.getFeedbackRating()).isEqualTo(5);
        assertThat(saved.getTrustScore()).isEqualTo(1.0);
        assertThat(saved.getAcceptanceRate()).isZero();
        assertThat(saved.getAsOf()).isEqualTo(T1);
        assertThat(result.alpha()).isCloseTo(0.05, within(1e-12));
        assertThat(result.drawdown()).isZero();
        verify(applicationEventPublisher).publishEvent(new PerformanceRecordedEvent(TRACE_ID, "signal_weighted", "cohort-a", T1));
    }

    @Test
    void evaluate_requestRatingAndAsOfTakePrecedence() {
        Instant asOf = T1.plusSeconds(3600);

        PerformanceDto result = performanceAggregatorService.evaluate(USER_ID, TRACE_ID, request(asOf, 1));

        assertThat(result.asOf()).isEqualTo(asOf);
        assertThat(result.feedbackRating()).isEqualTo(1);
        assertThat(result.trustScore()).isCloseTo(0.8, within(1e-12));
        verify(userFeedbackRepository, never()).findTopByDecisionIdOrderBySubmittedAtDesc(any());
        verify(applicationEventPublisher).publishEvent(new PerformanceRecordedEvent(TRACE_ID, "signal_weighted", "unassigned", asOf));
    }

    @Test
    void evaluate_duplicateAsOfConflictsAndPublishesNothing() {
        when(portfolioPerformanceRepository.saveAndFlush(any(PortfolioPerformance.class)))
                .thenThrow(new DataIntegrityViolationException("duplicate evaluation"));

        assertThatThrownBy(() -> performanceAggregatorService.evaluate(USER_ID, TRACE_ID, request(null, 3)))
                .isInstanceOfSatisfying(ConcurrentRecordModificationException.class, exception -> {
                    assertThat(exception.getEntityId()).isEqualTo(TRACE_ID);
                    assertThat(exception.getEntityVersion()).isEqualTo(T1.toString());
                });
        verify(applicationEventPublisher, never()).publishEvent(any(Object.class));
    }

    @Test
    void evaluate_earlierAsOfArrivingLateIsStoredAlongsideLaterOne() {
        Map<String, PortfolioPerformance> stored = new LinkedHashMap<>();
        when(portfolioPerformanceRepository.saveAndFlush(any(PortfolioPerformance.class))).thenAnswer(invocation -> {
            PortfolioPerformance performance = invocation.getArgument(0);
            if (stored.putIfAbsent(performance.getTraceId() + "@" + performance.getAsOf(), performance) != null) {
                throw new DataIntegrityViolationException("duplicate evaluation");
            }
            return performance;
        });
        Instant later = T1.plusSeconds(86_400);

        PerformanceDto first = performanceAggregatorService.evaluate(USER_ID, TRACE_ID, request(later, 4));
        PerformanceDto second = performanceAggregatorService.evaluate(USER_ID, TRACE_ID, request(T1, 2));

        assertThat(stored).containsOnlyKeys(TRACE_ID + "@" + later, TRACE_ID + "@" + T1);
        assertThat(first.performanceId()).isNotEqualTo(second.performanceId());
        PortfolioPerformance laterRecord = stored.get(TRACE_ID + "@" + later);
        assertThat(laterRecord.getAsOf()).isEqualTo(later);
        assertThat(laterRecord.getFeedbackRating()).isEqualTo(4);
        assertThat(stored.get(TRACE_ID + "@" + T1).getFeedbackRating()).isEqualTo(2);
    }

    @Test
    void evaluate_trustUsesOnlyTheConfiguredNumberOfFamilyResolutions() {
        when(decisionResolutionRepository.findByStrategyFamilyOrderByDecidedAtDesc("signal_weighted", PageRequest.of(0, 200)))
                .thenReturn(List.of(resolution(DecisionOutcome.REJECTED), resolution(DecisionOutcome.ACCEPTED)));

        PerformanceDto result = performanceAggregatorService.evaluate(USER_ID, TRACE_ID, request(null, null));

        assertThat(result.trustScore()).isCloseTo(0.5, within(1e-12));
        verify(decisionResolutionRepository).findByStrategyFamilyOrderByDecidedAtDesc("signal_weighted", PageRequest.of(0, 200));
        verify(decisionResolutionRepository).findByUserIdOrderByDecidedAtDesc(USER_ID, PageRequest.of(0, 20));
    }

    @Test
    void evaluate_unknownTraceIsNotFound() {
        when(executionTraceService.getScoped("user-2", TRACE_ID)).thenThrow(new RecordNotFoundException("ExecutionTrace", TRACE_ID, null));

        assertThatThrownBy(() -> performanceAggregatorService.evaluate("user-2", TRACE_ID, request(null, null)))
                .isInstanceOf(RecordNotFoundException.class);
        verify(portfolioPerformanceRepository, never()).saveAndFlush(any());
    }

    @Test
    void history_returnsSeriesInAsOfOrder() {
        PortfolioPerformance early = performance(T0);
        PortfolioPerformance late = performance(T1);
        when(portfolioPerformanceRepository.findByTraceIdOrderByAsOfAsc(TRACE_ID)).thenReturn(List.of(early, late));

        List<PerformanceDto> history = performanceAggregatorService.history(USER_ID, TRACE_ID);

        assertThat(history).extracting(PerformanceDto::asOf).containsExactly(T0, T1);
        verify(executionTraceService).getScoped(USER_ID, TRACE_ID);
    }

    private EvaluationRequest request(Instant asOf, Integer rating) {
        return new EvaluationRequest(
                List.of(new OutcomePoint(T0, 100.0, 100.0), new OutcomePoint(T1, 110.0, 105.0)),
                asOf,
                rating
        );
    }

    private ExecutionTrace trace() {
        return ExecutionTrace.builder()
                .traceId(TRACE_ID)
                .decisionId("d-2")
                .originDecisionId("d-1")
                .strategyKey("s-1@2")
                .strategyFamily("signal_weighted")
                .userId(USER_ID)
                .startedAt(T0)
                .build();
    }

    private UserProfile profile() {
        return UserProfile.builder()
                .userId(USER_ID)
                .cohort("cohort-a")
                .riskTolerance(RiskTolerance.MODERATE)
                .build();
    }

    private UserFeedback feedback(int rating) {
        return UserFeedback.builder()
                .feedbackId(UUID.randomUUID())
                .decisionId("d-1")
                .userId(USER_ID)
                .rating(rating)
                .submittedAt(T0)
                .build();
    }

    private DecisionResolution resolution(DecisionOutcome outcome) {
        return DecisionResolution.builder()
                .decisionId(UUID.randomUUID().toString())
                .outcome(outcome)
                .userId("user-9")
                .strategyFamily("signal_weighted")
                .decidedAt(T0)
                .build();
    }

    private PortfolioPerformance performance(Instant asOf) {
        return PortfolioPerformance.builder()
                .performanceId(UUID.randomUUID())
                .traceId(TRACE_ID)
                .strategyFamily("signal_weighted")
                .userId(USER_ID)
                .userCohort("cohort-a")
                .asOf(asOf)
                .build();
    }
}
