package org.nowstart.compass.strategy.core;

import org.nowstart.compass.data.type.RiskTolerance;

/**
 * Everything a hypothesis generator may look at: the user's risk attributes, the goal and the
 * market snapshot.
 */
public record HypothesisContext(
        String userId,
        RiskTolerance riskTolerance,
        double lossAversionScore,
        int horizonMonths,
        double maxDrawdownTolerance,
        MarketSnapshot market
) {

    private static final int TRADING_DAYS_PER_MONTH = 21;

    /**
     * Share of capital the user's risk attributes allow to be invested.
     */
    public double investableFraction() {
        double base = riskTolerance == null ? RiskTolerance.MODERATE.investedFraction() : riskTolerance.investedFraction();
        double aversion = Math.max(0.0, Math.min(1.0, lossAversionScore));
        return base * (1.0 - 0.5 * aversion);
    }

    public int horizonBars(int maxLookbackBars) {
        int bars = Math.max(1, horizonMonths) * TRADING_DAYS_PER_MONTH;
        return Math.min(bars, maxLookbackBars);
    }
}
