package org.nowstart.compass.data.dto;

import java.time.Instant;
import org.nowstart.compass.data.type.StrategyStatus;
import org.nowstart.compass.strategy.core.ExplainabilityTrace;
import org.nowstart.compass.strategy.core.HypothesisBody;

/**
 * A strategy version as shown to its owner. {@code trace} and {@code backtest} are null only for
 * versions whose backtest failed.
 */
public record StrategyDto(
        String strategyId,
        int version,
        Integer supersedesVersion,
        String goalId,
        int goalVersion,
        String marketContextKey,
        String family,
        HypothesisBody hypothesis,
        ExplainabilityTrace trace,
        BacktestResultDto backtest,
        StrategyStatus status,
        String failureCode,
        String failureDetail,
        String learningSnapshotRef,
        String rankingPolicy,
        String note,
        Instant createdAt
) {
}
