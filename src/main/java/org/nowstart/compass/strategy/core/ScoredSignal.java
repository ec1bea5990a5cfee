package org.nowstart.compass.strategy.core;

import org.nowstart.compass.data.type.SignalType;

/**
 * One filtered market signal as delivered by the ingestion pipeline.
 *
 * @param symbol     instrument the signal refers to
 * @param type       trend, opportunity, risk or alert
 * @param label      display label, for example the focus area it came from
 * @param score      signed strength in [-1, 1]
 * @param confidence ingestion confidence in [0, 1]
 */
public record ScoredSignal(
        String symbol,
        SignalType type,
        String label,
        double score,
        double confidence
) {

    /**
     * Strength after direction and confidence are applied; adverse signals count negative.
     */
    public double weightedScore() {
        double magnitude = Math.abs(score) * confidence;
        return type != null && type.isAdverse() ? -magnitude : score * confidence;
    }
}
