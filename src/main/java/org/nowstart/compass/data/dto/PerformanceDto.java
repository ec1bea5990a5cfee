package org.nowstart.compass.data.dto;

import java.time.Instant;
import java.util.UUID;
import org.nowstart.compass.data.entity.PortfolioPerformance;

public record PerformanceDto(
        UUID performanceId,
        String traceId,
        String strategyFamily,
        double alpha,
        double drawdown,
        double trustScore,
        double acceptanceRate,
        double totalReturn,
        double benchmarkReturn,
        Instant periodStart,
        Instant periodEnd,
        Integer feedbackRating,
        Instant asOf
) {

    public static PerformanceDto from(PortfolioPerformance performance) {
        return new PerformanceDto(
                performance.getPerformanceId(),
                performance.getTraceId(),
                performance.getStrategyFamily(),
                performance.getAlpha(),
                performance.getDrawdown(),
                performance.getTrustScore(),
                performance.getAcceptanceRate(),
                performance.getTotalReturn(),
                performance.getBenchmarkReturn(),
                performance.getPeriodStart(),
                performance.getPeriodEnd(),
                performance.getFeedbackRating(),
                performance.getAsOf()
        );
    }
}
