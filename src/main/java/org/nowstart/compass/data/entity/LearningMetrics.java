package org.nowstart.compass.data.entity;

import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import java.time.Instant;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;
import org.nowstart.compass.data.type.LearningScope;

/**
 * A versioned snapshot of aggregated learning metrics for one scope and time window.
 */
@Entity
@Immutable
@Getter
@Builder
@AllArgsConstructor
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class LearningMetrics extends AppendOnlyRecord<String> {

    @Id
    private String recordKey;

    @Enumerated(EnumType.STRING)
    private LearningScope scopeType;

    private String scopeKey;

    private Instant windowStart;

    private Instant windowEnd;

    private long snapshotVersion;

    private double meanAlpha;

    private double meanDrawdown;

    private double meanTrust;

    private double meanAcceptance;

    private int sampleCount;

    private double alphaDelta;

    private double drawdownDelta;

    private double trustDelta;

    private double acceptanceDelta;

    private Instant computedAt;

    public static String key(LearningScope scopeType, String scopeKey, Instant windowStart, long snapshotVersion) {
        return scopeType + ":" + scopeKey + ":" + windowStart + "@" + snapshotVersion;
    }

    @Override
    public String getId() {
        return recordKey;
    }
}
