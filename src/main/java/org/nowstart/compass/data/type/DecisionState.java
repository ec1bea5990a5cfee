package org.nowstart.compass.data.type;

public enum DecisionState {
    PROPOSED,
    ACCEPTED,
    MODIFIED,
    REJECTED;

    public boolean isTerminal() {
        return this != PROPOSED;
    }

    public static DecisionState of(DecisionOutcome outcome) {
        if (outcome == null) {
            return PROPOSED;
        }
        return switch (outcome) {
            case ACCEPTED -> ACCEPTED;
            case MODIFIED -> MODIFIED;
            case REJECTED -> REJECTED;
        };
    }
}
