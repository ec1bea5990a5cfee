package org.nowstart.compass.data.type;

public enum StrategyStatus {
    PROPOSABLE,
    BACKTEST_FAILED
}
