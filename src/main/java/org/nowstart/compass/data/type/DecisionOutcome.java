package org.nowstart.compass.data.type;

public enum DecisionOutcome {
    ACCEPTED,
    MODIFIED,
    REJECTED
}
