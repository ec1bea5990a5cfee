package org.nowstart.compass.strategy.core;

/**
 * Value type of a {@link TraceEntry}. Checked when the entry is created.
 */
public enum TraceValueType {
    NUMBER(Number.class),
    TEXT(String.class);

    private final Class<?> valueType;

    TraceValueType(Class<?> valueType) {
        this.valueType = valueType;
    }

    public boolean supports(Object value) {
        return valueType.isInstance(value);
    }
}
