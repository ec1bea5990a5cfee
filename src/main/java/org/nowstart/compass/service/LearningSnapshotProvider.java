package org.nowstart.compass.service;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.compass.data.entity.LearningMetrics;
import org.nowstart.compass.data.type.LearningScope;
import org.nowstart.compass.repository.LearningMetricsRepository;
import org.nowstart.compass.strategy.ranking.FamilyLearning;
import org.nowstart.compass.strategy.ranking.LearningSnapshot;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Holds the learning snapshot that proposals and rankings read.
 *
 * <p>The snapshot is rebuilt only by {@link #refresh()}, so readers never see a half-applied
 * aggregation and the snapshot's age is bounded by the refresh interval.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LearningSnapshotProvider {

    private final LearningMetricsRepository learningMetricsRepository;
    private final Clock clock;
    private final AtomicReference<LearningSnapshot> current = new AtomicReference<>(LearningSnapshot.EMPTY);

    public LearningSnapshot current() {
        return current.get();
    }

    /**
     * Rebuilds the snapshot from the latest stored metrics of every strategy family.
     */
    @Transactional(readOnly = true)
    public LearningSnapshot refresh() {
        List<LearningMetrics> all = learningMetricsRepository.findByScopeType(LearningScope.STRATEGY_FAMILY);
        Map<String, LearningMetrics> latestByFamily = new HashMap<>();
        Comparator<LearningMetrics> recency = Comparator.comparing(LearningMetrics::getWindowStart)
                .thenComparingLong(LearningMetrics::getSnapshotVersion);
        for (LearningMetrics metrics : all) {
            latestByFamily.merge(metrics.getScopeKey(), metrics, (left, right) -> recency.compare(left, right) >= 0 ? left : right);
        }

        Map<String, FamilyLearning> byFamily = new HashMap<>();
        long version = 0L;
        for (LearningMetrics metrics : latestByFamily.values()) {
            byFamily.put(metrics.getScopeKey(), new FamilyLearning(
                    metrics.getScopeKey(),
                    metrics.getSnapshotVersion(),
                    metrics.getMeanAlpha(),
                    metrics.getMeanDrawdown(),
                    metrics.getMeanTrust(),
                    metrics.getMeanAcceptance(),
                    metrics.getSampleCount()
            ));
            if (metrics.getComputedAt() != null) {
                version = Math.max(version, metrics.getComputedAt().toEpochMilli());
            }
        }

        Instant refreshedAt = clock.instant();
        LearningSnapshot snapshot = new LearningSnapshot(version, refreshedAt, byFamily);
        LearningSnapshot previous = current.getAndSet(snapshot);
        if (previous.version() != snapshot.version()) {
            log.info("event=learning_snapshot_refreshed version={} families={} refreshed_at={}", snapshot.version(), byFamily.size(), refreshedAt);
        }
        return snapshot;
    }
}
