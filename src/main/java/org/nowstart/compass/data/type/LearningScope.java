package org.nowstart.compass.data.type;

public enum LearningScope {
    STRATEGY_FAMILY,
    USER_COHORT
}
