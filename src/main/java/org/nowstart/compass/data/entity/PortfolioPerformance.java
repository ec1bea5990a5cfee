package org.nowstart.compass.data.entity;

import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import java.util.UUID;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

/**
 * One evaluation of an execution trace. A trace accumulates a series of these ordered by
 * {@code asOf}; none is ever replaced.
 */
@Entity
@Immutable
@Table(uniqueConstraints = @UniqueConstraint(columnNames = {"traceId", "asOf"}))
@Getter
@Builder
@AllArgsConstructor
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class PortfolioPerformance extends AppendOnlyRecord<UUID> {

    @Id
    private UUID performanceId;

    private String traceId;

    private String strategyFamily;

    private String userId;

    private String userCohort;

    private double alpha;

    private double drawdown;

    private double trustScore;

    private double acceptanceRate;

    private double totalReturn;

    private double benchmarkReturn;

    private Instant periodStart;

    private Instant periodEnd;

    private Integer feedbackRating;

    private Instant asOf;

    @Override
    public UUID getId() {
        return performanceId;
    }
}
