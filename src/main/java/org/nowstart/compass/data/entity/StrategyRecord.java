package org.nowstart.compass.data.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;
import org.nowstart.compass.data.type.StrategyStatus;

/**
 * One version of a strategy hypothesis. The key {@code strategyId@version} is the compare-and-set
 * point of the version chain.
 */
@Entity
@Immutable
@Table(
        name = "strategy",
        uniqueConstraints = @UniqueConstraint(columnNames = {"strategyId", "version"})
)
@Getter
@Builder
@AllArgsConstructor
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class StrategyRecord extends AppendOnlyRecord<String> {

    @Id
    private String recordKey;

    private String strategyId;

    private int version;

    private Integer supersedesVersion;

    private String userId;

    private String goalId;

    private int goalVersion;

    private String marketContextKey;

    private String family;

    @Column(columnDefinition = "TEXT")
    private String hypothesisBody;

    @Column(columnDefinition = "TEXT")
    private String explainabilityTrace;

    private String backtestResultKey;

    @Enumerated(EnumType.STRING)
    private StrategyStatus status;

    private String failureCode;

    @Column(length = 1000)
    private String failureDetail;

    private String learningSnapshotRef;

    private String rankingPolicy;

    @Column(length = 1000)
    private String note;

    public static String key(String strategyId, int version) {
        return strategyId + "@" + version;
    }

    public boolean isProposable() {
        return status == StrategyStatus.PROPOSABLE && backtestResultKey != null;
    }

    @Override
    public String getId() {
        return recordKey;
    }
}
