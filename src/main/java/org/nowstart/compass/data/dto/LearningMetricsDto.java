package org.nowstart.compass.data.dto;

import java.time.Instant;
import org.nowstart.compass.data.entity.LearningMetrics;
import org.nowstart.compass.data.type.LearningScope;

public record LearningMetricsDto(
        LearningScope scopeType,
        String scopeKey,
        Instant windowStart,
        Instant windowEnd,
        long snapshotVersion,
        double meanAlpha,
        double meanDrawdown,
        double meanTrust,
        double meanAcceptance,
        int sampleCount,
        double alphaDelta,
        double drawdownDelta,
        double trustDelta,
        double acceptanceDelta,
        Instant computedAt
) {

    public static LearningMetricsDto from(LearningMetrics metrics) {
        return new LearningMetricsDto(
                metrics.getScopeType(),
                metrics.getScopeKey(),
                metrics.getWindowStart(),
                metrics.getWindowEnd(),
                metrics.getSnapshotVersion(),
                metrics.getMeanAlpha(),
                metrics.getMeanDrawdown(),
                metrics.getMeanTrust(),
                metrics.getMeanAcceptance(),
                metrics.getSampleCount(),
                metrics.getAlphaDelta(),
                metrics.getDrawdownDelta(),
                metrics.getTrustDelta(),
                metrics.getAcceptanceDelta(),
                metrics.getComputedAt()
        );
    }
}
