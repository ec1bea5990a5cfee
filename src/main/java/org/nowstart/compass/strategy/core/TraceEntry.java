package org.nowstart.compass.strategy.core;

/**
 * One explainability fact recorded by a backtest.
 *
 * <p>Keys are stable and machine-readable ({@code window.start}, {@code contribution.NVDA},
 * {@code signal.NVDA}); labels are for display.
 *
 * @param key   stable identifier
 * @param label display label
 * @param type  value type
 * @param unit  unit for numeric values, empty otherwise
 * @param value the value itself
 */
public record TraceEntry(
        String key,
        String label,
        TraceValueType type,
        String unit,
        Object value
) {

    public TraceEntry {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("trace key is required");
        }
        if (type == null || value == null || !type.supports(value)) {
            throw new IllegalArgumentException("trace entry " + key + " has an invalid value");
        }
        label = (label == null || label.isBlank()) ? key : label;
        unit = unit == null ? "" : unit;
    }

    public static TraceEntry number(String key, String label, String unit, double value) {
        return new TraceEntry(key, label, TraceValueType.NUMBER, unit, value);
    }

    public static TraceEntry text(String key, String label, String value) {
        return new TraceEntry(key, label, TraceValueType.TEXT, "", value == null ? "" : value);
    }
}
