package org.nowstart.compass.data.type;

public enum ExecutionEventType {
    ACTION,
    COMPENSATION,
    COMPLETION
}
