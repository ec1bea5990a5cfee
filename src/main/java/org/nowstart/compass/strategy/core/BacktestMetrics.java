package org.nowstart.compass.strategy.core;

import java.time.Instant;

/**
 * @param expectedReturn     annualised mean daily portfolio return
 * @param maxDrawdown        worst peak-to-trough loss of the equity curve, as a positive fraction
 * @param confidence         data coverage based confidence in [0, 0.95]
 * @param expectedReturnLow  5th percentile of the bootstrapped expected return
 * @param expectedReturnHigh 95th percentile of the bootstrapped expected return
 * @param barsUsed           aligned bars in the evaluation window
 * @param windowStart        first bar of the window
 * @param windowEnd          last bar of the window
 * @param seed               seed of the bootstrap sampler
 */
public record BacktestMetrics(
        double expectedReturn,
        double maxDrawdown,
        double confidence,
        double expectedReturnLow,
        double expectedReturnHigh,
        int barsUsed,
        Instant windowStart,
        Instant windowEnd,
        long seed
) {
}
