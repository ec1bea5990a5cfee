package org.nowstart.compass.strategy.core;

import java.time.Instant;

public record MarketEvent(
        String eventType,
        String description,
        Instant timestamp
) {
}
