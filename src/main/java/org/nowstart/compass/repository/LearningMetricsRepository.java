package org.nowstart.compass.repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.nowstart.compass.data.entity.LearningMetrics;
import org.nowstart.compass.data.type.LearningScope;
import org.springframework.data.jpa.repository.JpaRepository;

public interface LearningMetricsRepository extends JpaRepository<LearningMetrics, String> {

    Optional<LearningMetrics> findTopByScopeTypeAndScopeKeyAndWindowStartOrderBySnapshotVersionDesc(
            LearningScope scopeType,
            String scopeKey,
            Instant windowStart
    );

    Optional<LearningMetrics> findTopByScopeTypeAndScopeKeyOrderByWindowStartDescSnapshotVersionDesc(
            LearningScope scopeType,
            String scopeKey
    );

    List<LearningMetrics> findByScopeType(LearningScope scopeType);
}
