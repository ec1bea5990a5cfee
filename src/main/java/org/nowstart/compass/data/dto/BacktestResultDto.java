package org.nowstart.compass.data.dto;

import java.time.Instant;
import org.nowstart.compass.data.entity.BacktestResultRecord;

public record BacktestResultDto(
        double expectedReturn,
        double maxDrawdown,
        double confidence,
        double expectedReturnLow,
        double expectedReturnHigh,
        int barsUsed,
        Instant windowStart,
        Instant windowEnd,
        long seed,
        Instant computedAt
) {

    public static BacktestResultDto from(BacktestResultRecord result) {
        return new BacktestResultDto(
                result.getExpectedReturn(),
                result.getMaxDrawdown(),
                result.getConfidence(),
                result.getExpectedReturnLow(),
                result.getExpectedReturnHigh(),
                result.getBarsUsed(),
                result.getWindowStart(),
                result.getWindowEnd(),
                result.getSeed(),
                result.getComputedAt()
        );
    }
}
