package org.nowstart.compass.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.nowstart.compass.data.entity.LearningMetrics;
import org.nowstart.compass.data.entity.PortfolioPerformance;
import org.nowstart.compass.data.exception.ConcurrentRecordModificationException;
import org.nowstart.compass.data.exception.RecordNotFoundException;
import org.nowstart.compass.data.property.LearningProperties;
import org.nowstart.compass.data.type.LearningScope;
import org.nowstart.compass.repository.LearningMetricsRepository;
import org.nowstart.compass.repository.PortfolioPerformanceRepository;
import org.springframework.dao.DataIntegrityViolationException;

@ExtendWith(MockitoExtension.class)
class LearningMetricsServiceTest {

    private static final Instant NOW = Instant.parse("2024-06-20T00:00:00Z");
    private static final String FAMILY = "signal_weighted";

    @Mock
    private PortfolioPerformanceRepository portfolioPerformanceRepository;
    @Mock
    private LearningMetricsRepository learningMetricsRepository;

    private LearningMetricsService learningMetricsService;
    private Instant windowStart;
    private Instant windowEnd;

    @BeforeEach
    void setUp() {
        learningMetricsService = new LearningMetricsService(
                portfolioPerformanceRepository,
                learningMetricsRepository,
                new LearningProperties(Duration.ofDays(30), Duration.ofSeconds(30)),
                Clock.fixed(NOW, ZoneOffset.UTC)
        );
        windowStart = learningMetricsService.windowStart(NOW);
        windowEnd = windowStart.plus(Duration.ofDays(30));
    }

    @Test
    void windowStart_bucketsByWindowLength() {
        assertThat(windowStart).isBeforeOrEqualTo(NOW);
        assertThat(windowEnd).isAfter(NOW);
        assertThat(windowStart.toEpochMilli() % Duration.ofDays(30).toMillis()).isZero();
        assertThat(learningMetricsService.windowStart(windowEnd.minusMillis(1))).isEqualTo(windowStart);
        assertThat(learningMetricsService.windowStart(windowEnd)).isEqualTo(windowEnd);
    }

    @Test
    void recompute_usesLatestEvaluationOfEachTrace() {
        when(portfolioPerformanceRepository.findByStrategyFamilyAndAsOfGreaterThanEqualAndAsOfLessThan(FAMILY, windowStart, windowEnd))
                .thenReturn(List.of(
                        performance("trace-1", NOW.minusSeconds(60), 0.30, 0.05),
                        performance("trace-1", NOW.minusSeconds(3600), 0.10, 0.20),
                        performance("trace-2", NOW.minusSeconds(600), 0.10, 0.15)
                ));
        when(learningMetricsRepository.findTopByScopeTypeAndScopeKeyAndWindowStartOrderBySnapshotVersionDesc(
                LearningScope.STRATEGY_FAMILY, FAMILY, windowStart)).thenReturn(Optional.empty());

        Optional<LearningMetrics> result = learningMetricsService.recompute(LearningScope.STRATEGY_FAMILY, FAMILY, NOW);

        assertThat(result).isPresent();
        LearningMetrics metrics = result.get();
        assertThat(metrics.getSampleCount()).isEqualTo(2);
        assertThat(metrics.getMeanAlpha()).isCloseTo(0.20, within(1e-12));
        assertThat(metrics.getMeanDrawdown()).isCloseTo(0.10, within(1e-12));
        assertThat(metrics.getSnapshotVersion()).isEqualTo(1L);
        assertThat(metrics.getAlphaDelta()).isCloseTo(0.20, within(1e-12));
        assertThat(metrics.getComputedAt()).isEqualTo(NOW);
        assertThat(metrics.getRecordKey()).isEqualTo("STRATEGY_FAMILY:" + FAMILY + ":" + windowStart + "@1");
        verify(learningMetricsRepository).saveAndFlush(metrics);
    }

    @Test
    void recompute_appendsNextVersionWithDeltas() {
        when(portfolioPerformanceRepository.findByUserCohortAndAsOfGreaterThanEqualAndAsOfLessThan("cohort-a", windowStart, windowEnd))
                .thenReturn(List.of(performance("trace-1", NOW, 0.30, 0.10)));
        when(learningMetricsRepository.findTopByScopeTypeAndScopeKeyAndWindowStartOrderBySnapshotVersionDesc(
                LearningScope.USER_COHORT, "cohort-a", windowStart))
                .thenReturn(Optional.of(metrics(LearningScope.USER_COHORT, "cohort-a", 3L, 0.10, 1, NOW)));

        LearningMetrics metrics = learningMetricsService.recompute(LearningScope.USER_COHORT, "cohort-a", NOW).orElseThrow();

        assertThat(metrics.getSnapshotVersion()).isEqualTo(4L);
        assertThat(metrics.getAlphaDelta()).isCloseTo(0.20, within(1e-12));
    }

    @Test
    void recompute_writesNothingWhenUnchanged() {
        LearningMetrics head = metrics(LearningScope.STRATEGY_FAMILY, FAMILY, 2L, 0.30, 1, NOW);
        when(portfolioPerformanceRepository.findByStrategyFamilyAndAsOfGreaterThanEqualAndAsOfLessThan(FAMILY, windowStart, windowEnd))
                .thenReturn(List.of(performance("trace-1", NOW, 0.30, 0.10)));
        when(learningMetricsRepository.findTopByScopeTypeAndScopeKeyAndWindowStartOrderBySnapshotVersionDesc(
                LearningScope.STRATEGY_FAMILY, FAMILY, windowStart)).thenReturn(Optional.of(head));

        Optional<LearningMetrics> result = learningMetricsService.recompute(LearningScope.STRATEGY_FAMILY, FAMILY, NOW);

        assertThat(result).containsSame(head);
        verify(learningMetricsRepository, never()).saveAndFlush(any());
    }

    @Test
    void recompute_emptyWindowYieldsNothing() {
        when(portfolioPerformanceRepository.findByStrategyFamilyAndAsOfGreaterThanEqualAndAsOfLessThan(FAMILY, windowStart, windowEnd))
                .thenReturn(List.of());

        assertThat(learningMetricsService.recompute(LearningScope.STRATEGY_FAMILY, FAMILY, NOW)).isEmpty();
        verify(learningMetricsRepository, never()).saveAndFlush(any());
    }

    @Test
    void recompute_lostVersionRaceIsConcurrentModification() {
        when(portfolioPerformanceRepository.findByStrategyFamilyAndAsOfGreaterThanEqualAndAsOfLessThan(FAMILY, windowStart, windowEnd))
                .thenReturn(List.of(performance("trace-1", NOW, 0.30, 0.10)));
        when(learningMetricsRepository.findTopByScopeTypeAndScopeKeyAndWindowStartOrderBySnapshotVersionDesc(
                LearningScope.STRATEGY_FAMILY, FAMILY, windowStart)).thenReturn(Optional.empty());
        when(learningMetricsRepository.saveAndFlush(any(LearningMetrics.class)))
                .thenThrow(new DataIntegrityViolationException("duplicate version"));

        assertThatThrownBy(() -> learningMetricsService.recompute(LearningScope.STRATEGY_FAMILY, FAMILY, NOW))
                .isInstanceOf(ConcurrentRecordModificationException.class);
    }

    @Test
    void recentScopes_listsEachScopeAndWindowOnce() {
        when(portfolioPerformanceRepository.findByAsOfGreaterThanEqual(eq(windowStart.minus(Duration.ofDays(30)))))
                .thenReturn(List.of(
                        performance("trace-1", NOW, 0.1, 0.1),
                        performance("trace-2", NOW.minusSeconds(60), 0.1, 0.1)
                ));

        List<LearningMetricsService.ScopeWindow> scopes = learningMetricsService.recentScopes();

        assertThat(scopes).containsExactly(
                new LearningMetricsService.ScopeWindow(LearningScope.STRATEGY_FAMILY, FAMILY, windowStart),
                new LearningMetricsService.ScopeWindow(LearningScope.USER_COHORT, "cohort-a", windowStart)
        );
    }

    @Test
    void latest_failsWhenScopeHasNoMetrics() {
        when(learningMetricsRepository.findTopByScopeTypeAndScopeKeyOrderByWindowStartDescSnapshotVersionDesc(LearningScope.USER_COHORT, "nobody"))
                .thenReturn(Optional.empty());

        assertThatThrownBy(() -> learningMetricsService.latest(LearningScope.USER_COHORT, "nobody"))
                .isInstanceOf(RecordNotFoundException.class);
    }

    @Test
    void latest_returnsHeadMetrics() {
        when(learningMetricsRepository.findTopByScopeTypeAndScopeKeyOrderByWindowStartDescSnapshotVersionDesc(LearningScope.STRATEGY_FAMILY, FAMILY))
                .thenReturn(Optional.of(metrics(LearningScope.STRATEGY_FAMILY, FAMILY, 5L, 0.2, 4, NOW)));

        assertThat(learningMetricsService.latest(LearningScope.STRATEGY_FAMILY, FAMILY).snapshotVersion()).isEqualTo(5L);
    }

    private PortfolioPerformance performance(String traceId, Instant asOf, double alpha, double drawdown) {
        return PortfolioPerformance.builder()
                .performanceId(UUID.randomUUID())
                .traceId(traceId)
                .strategyFamily(FAMILY)
                .userId("user-1")
                .userCohort("cohort-a")
                .alpha(alpha)
                .drawdown(drawdown)
                .trustScore(0.8)
                .acceptanceRate(0.5)
                .asOf(asOf)
                .build();
    }

    static LearningMetrics metrics(LearningScope scope, String key, long version, double meanAlpha, int samples, Instant computedAt) {
        return LearningMetrics.builder()
                .recordKey(scope + ":" + key + "@" + version)
                .scopeType(scope)
                .scopeKey(key)
                .windowStart(Instant.EPOCH)
                .windowEnd(Instant.EPOCH.plus(Duration.ofDays(30)))
                .snapshotVersion(version)
                .meanAlpha(meanAlpha)
                .meanDrawdown(0.10)
                .meanTrust(0.8)
                .meanAcceptance(0.5)
                .sampleCount(samples)
                .computedAt(computedAt)
                .build();
    }
}
