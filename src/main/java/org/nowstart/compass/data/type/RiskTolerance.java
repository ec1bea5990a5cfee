package org.nowstart.compass.data.type;

public enum RiskTolerance {
    CONSERVATIVE(0.4),
    MODERATE(0.7),
    AGGRESSIVE(0.95);

    private final double investedFraction;

    RiskTolerance(double investedFraction) {
        this.investedFraction = investedFraction;
    }

    /**
     * Share of capital a hypothesis may allocate before loss aversion is applied.
     */
    public double investedFraction() {
        return investedFraction;
    }
}
