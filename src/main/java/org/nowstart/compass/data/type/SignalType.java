package org.nowstart.compass.data.type;

public enum SignalType {
    TREND,
    OPPORTUNITY,
    RISK,
    ALERT;

    /**
     * Risk and alert signals argue against holding the symbol.
     */
    public boolean isAdverse() {
        return this == RISK || this == ALERT;
    }
}
