package org.nowstart.compass.data.dto;

import java.time.Instant;
import java.util.List;
import org.nowstart.compass.strategy.core.MarketSnapshot;

public record MarketContextDto(
        String contextId,
        Instant asOf,
        String recordKey,
        String source,
        List<String> symbols,
        String benchmarkSymbol,
        int signalCount,
        int eventCount,
        int barCount
) {

    public static MarketContextDto from(MarketSnapshot snapshot, String source) {
        return new MarketContextDto(
                snapshot.contextId(),
                snapshot.asOf(),
                snapshot.recordKey(),
                source,
                snapshot.symbols(),
                snapshot.benchmarkSymbol(),
                snapshot.signals().size(),
                snapshot.events().size(),
                snapshot.history().size()
        );
    }
}
