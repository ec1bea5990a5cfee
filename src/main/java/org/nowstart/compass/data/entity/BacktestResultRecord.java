package org.nowstart.compass.data.entity;

import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

/**
 * Backtest of exactly one strategy version; shares the strategy's record key.
 */
@Entity
@Immutable
@Table(name = "backtest_result")
@Getter
@Builder
@AllArgsConstructor
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class BacktestResultRecord extends AppendOnlyRecord<String> {

    @Id
    private String strategyKey;

    private String strategyId;

    private int strategyVersion;

    private double expectedReturn;

    private double maxDrawdown;

    private double confidence;

    private double expectedReturnLow;

    private double expectedReturnHigh;

    private int barsUsed;

    private Instant windowStart;

    private Instant windowEnd;

    private long seed;

    private Instant computedAt;

    @Override
    public String getId() {
        return strategyKey;
    }
}
