package org.nowstart.compass.strategy.core;

import java.time.Instant;

public record PriceBar(
        Instant timestamp,
        String symbol,
        double close
) {
}
