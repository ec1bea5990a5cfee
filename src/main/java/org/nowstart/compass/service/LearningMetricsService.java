package org.nowstart.compass.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.compass.data.dto.LearningMetricsDto;
import org.nowstart.compass.data.entity.LearningMetrics;
import org.nowstart.compass.data.entity.PortfolioPerformance;
import org.nowstart.compass.data.exception.ConcurrentRecordModificationException;
import org.nowstart.compass.data.exception.RecordNotFoundException;
import org.nowstart.compass.data.property.LearningProperties;
import org.nowstart.compass.data.type.LearningScope;
import org.nowstart.compass.repository.LearningMetricsRepository;
import org.nowstart.compass.repository.PortfolioPerformanceRepository;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Aggregates performance records into versioned learning metrics per scope and time window.
 *
 * <p>Each trace contributes only its latest evaluation, so an evaluation that arrives late with
 * an earlier {@code asOf} never displaces a later one. A recompute that yields the same numbers
 * as the head version writes nothing.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LearningMetricsService {

    private final PortfolioPerformanceRepository portfolioPerformanceRepository;
    private final LearningMetricsRepository learningMetricsRepository;
    private final LearningProperties learningProperties;
    private final Clock clock;

    public Instant windowStart(Instant asOf) {
        long windowMillis = learningProperties.window().toMillis();
        return Instant.ofEpochMilli(Math.floorDiv(asOf.toEpochMilli(), windowMillis) * windowMillis);
    }

    /**
     * Recomputes the metrics of the window containing {@code asOf} and appends a new snapshot
     * version when they changed.
     *
     * @return the head snapshot after the recompute, empty when the window has no records
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Optional<LearningMetrics> recompute(LearningScope scopeType, String scopeKey, Instant asOf) {
        Duration window = learningProperties.window();
        Instant start = windowStart(asOf);
        Instant end = start.plus(window);

        List<PortfolioPerformance> records = scopeType == LearningScope.STRATEGY_FAMILY
                ? portfolioPerformanceRepository.findByStrategyFamilyAndAsOfGreaterThanEqualAndAsOfLessThan(scopeKey, start, end)
                : portfolioPerformanceRepository.findByUserCohortAndAsOfGreaterThanEqualAndAsOfLessThan(scopeKey, start, end);
        Collection<PortfolioPerformance> latest = latestPerTrace(records);
        if (latest.isEmpty()) {
            return Optional.empty();
        }

        int count = latest.size();
        double meanAlpha = latest.stream().mapToDouble(PortfolioPerformance::getAlpha).sum() / count;
        double meanDrawdown = latest.stream().mapToDouble(PortfolioPerformance::getDrawdown).sum() / count;
        double meanTrust = latest.stream().mapToDouble(PortfolioPerformance::getTrustScore).sum() / count;
        double meanAcceptance = latest.stream().mapToDouble(PortfolioPerformance::getAcceptanceRate).sum() / count;

        Optional<LearningMetrics> previous = learningMetricsRepository
                .findTopByScopeTypeAndScopeKeyAndWindowStartOrderBySnapshotVersionDesc(scopeType, scopeKey, start);
        if (previous.isPresent() && unchanged(previous.get(), count, meanAlpha, meanDrawdown, meanTrust, meanAcceptance)) {
            return previous;
        }

        long version = previous.map(LearningMetrics::getSnapshotVersion).orElse(0L) + 1;
        LearningMetrics metrics = LearningMetrics.builder()
                .recordKey(LearningMetrics.key(scopeType, scopeKey, start, version))
                .scopeType(scopeType)
                .scopeKey(scopeKey)
                .windowStart(start)
                .windowEnd(end)
                .snapshotVersion(version)
                .meanAlpha(meanAlpha)
                .meanDrawdown(meanDrawdown)
                .meanTrust(meanTrust)
                .meanAcceptance(meanAcceptance)
                .sampleCount(count)
                .alphaDelta(meanAlpha - previous.map(LearningMetrics::getMeanAlpha).orElse(0.0))
                .drawdownDelta(meanDrawdown - previous.map(LearningMetrics::getMeanDrawdown).orElse(0.0))
                .trustDelta(meanTrust - previous.map(LearningMetrics::getMeanTrust).orElse(0.0))
                .acceptanceDelta(meanAcceptance - previous.map(LearningMetrics::getMeanAcceptance).orElse(0.0))
                .computedAt(clock.instant())
                .build();
        try {
            learningMetricsRepository.saveAndFlush(metrics);
        } catch (DataIntegrityViolationException exception) {
            throw new ConcurrentRecordModificationException(
                    scopeType + ":" + scopeKey,
                    String.valueOf(version),
                    "Learning metrics " + metrics.getRecordKey() + " were written concurrently"
            );
        }
        log.info(
                "event=learning_metrics_recomputed scope={} key={} window_start={} version={} samples={} mean_alpha={} mean_drawdown={} mean_trust={} mean_acceptance={}",
                scopeType,
                scopeKey,
                start,
                version,
                count,
                meanAlpha,
                meanDrawdown,
                meanTrust,
                meanAcceptance
        );
        return Optional.of(metrics);
    }

    /**
     * Scopes with evaluations in the current or the previous window, one entry per scope and
     * window.
     */
    @Transactional(readOnly = true)
    public List<ScopeWindow> recentScopes() {
        Instant from = windowStart(clock.instant()).minus(learningProperties.window());
        TreeSet<ScopeWindow> scopes = new TreeSet<>();
        for (PortfolioPerformance record : portfolioPerformanceRepository.findByAsOfGreaterThanEqual(from)) {
            Instant start = windowStart(record.getAsOf());
            scopes.add(new ScopeWindow(LearningScope.STRATEGY_FAMILY, record.getStrategyFamily(), start));
            if (record.getUserCohort() != null) {
                scopes.add(new ScopeWindow(LearningScope.USER_COHORT, record.getUserCohort(), start));
            }
        }
        return List.copyOf(scopes);
    }

    public LearningMetricsDto latest(LearningScope scopeType, String scopeKey) {
        return learningMetricsRepository.findTopByScopeTypeAndScopeKeyOrderByWindowStartDescSnapshotVersionDesc(scopeType, scopeKey)
                .map(LearningMetricsDto::from)
                .orElseThrow(() -> new RecordNotFoundException("LearningMetrics", scopeType + ":" + scopeKey, null));
    }

    private Collection<PortfolioPerformance> latestPerTrace(List<PortfolioPerformance> records) {
        Map<String, PortfolioPerformance> byTrace = new HashMap<>();
        for (PortfolioPerformance record : records) {
            byTrace.merge(record.getTraceId(), record, (left, right) -> right.getAsOf().isAfter(left.getAsOf()) ? right : left);
        }
        return byTrace.values();
    }

    private boolean unchanged(
            LearningMetrics previous,
            int count,
            double meanAlpha,
            double meanDrawdown,
            double meanTrust,
            double meanAcceptance
    ) {
        return previous.getSampleCount() == count
                && Double.compare(previous.getMeanAlpha(), meanAlpha) == 0
                && Double.compare(previous.getMeanDrawdown(), meanDrawdown) == 0
                && Double.compare(previous.getMeanTrust(), meanTrust) == 0
                && Double.compare(previous.getMeanAcceptance(), meanAcceptance) == 0;
    }

    public record ScopeWindow(
            LearningScope scopeType,
            String scopeKey,
            Instant windowStart
    ) implements Comparable<ScopeWindow> {

        @Override
        public int compareTo(ScopeWindow other) {
            int byScope = scopeType.compareTo(other.scopeType);
            if (byScope != 0) {
                return byScope;
            }
            int byKey = scopeKey.compareTo(other.scopeKey);
            return byKey != 0 ? byKey : windowStart.compareTo(other.windowStart);
        }
    }
}
