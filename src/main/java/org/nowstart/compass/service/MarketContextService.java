package org.nowstart.compass.service;

import java.time.Instant;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.compass.data.dto.MarketContextDto;
import org.nowstart.compass.data.dto.MarketContextRequest;
import org.nowstart.compass.data.entity.MarketContext;
import org.nowstart.compass.data.exception.ConcurrentRecordModificationException;
import org.nowstart.compass.data.exception.RecordNotFoundException;
import org.nowstart.compass.repository.MarketContextRepository;
import org.nowstart.compass.repository.MarketDataFeignClient;
import org.nowstart.compass.strategy.core.MarketSnapshot;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Stores market snapshots pushed by, or pulled from, the market-data ingestion service.
 * A snapshot is identified by {@code contextId@asOf} and never changes once stored.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MarketContextService {

    static final String SOURCE_PUSH = "push";
    static final String SOURCE_IMPORT = "import";

    private final MarketContextRepository marketContextRepository;
    private final MarketDataFeignClient marketDataFeignClient;
    private final JsonPayloadMapper jsonPayloadMapper;

    @Transactional
    public MarketContextDto register(MarketContextRequest request) {
        return store(request.toSnapshot(), SOURCE_PUSH);
    }

    /**
     * Pulls the latest snapshot of a context from the ingestion service and stores it.
     */
    @Transactional
    public MarketContextDto importLatest(String contextId) {
        MarketContextRequest response = marketDataFeignClient.getLatestSnapshot(contextId);
        if (response == null) {
            throw new RecordNotFoundException("MarketContext", contextId, null);
        }
        if (!contextId.equals(response.contextId())) {
            throw new IllegalStateException("Market data service returned context " + response.contextId() + " for " + contextId);
        }
        return store(response.toSnapshot(), SOURCE_IMPORT);
    }

    /**
     * Loads a stored snapshot; {@code asOf == null} selects the latest one.
     */
    public MarketSnapshot getSnapshot(String contextId, Instant asOf) {
        MarketContext context = (asOf == null
                ? marketContextRepository.findTopByContextIdOrderByAsOfDesc(contextId)
                : marketContextRepository.findById(contextId + "@" + asOf))
                .orElseThrow(() -> new RecordNotFoundException("MarketContext", contextId, asOf == null ? null : asOf.toString()));
        return jsonPayloadMapper.read(context.getPayload(), MarketSnapshot.class);
    }

    public MarketSnapshot getSnapshot(String recordKey) {
        MarketContext context = marketContextRepository.findById(recordKey)
                .orElseThrow(() -> new RecordNotFoundException("MarketContext", recordKey, null));
        return jsonPayloadMapper.read(context.getPayload(), MarketSnapshot.class);
    }

    private MarketContextDto store(MarketSnapshot snapshot, String source) {
        String payload = jsonPayloadMapper.write(snapshot);
        MarketContext existing = marketContextRepository.findById(snapshot.recordKey()).orElse(null);
        if (existing != null) {
            if (!existing.getPayload().equals(payload)) {
                throw new ConcurrentRecordModificationException(
                        snapshot.contextId(),
                        snapshot.asOf().toString(),
                        "Market context " + snapshot.recordKey() + " is already stored with different content"
                );
            }
            return MarketContextDto.from(snapshot, existing.getSource());
        }

        MarketContext context = MarketContext.builder()
                .recordKey(snapshot.recordKey())
                .contextId(snapshot.contextId())
                .asOf(snapshot.asOf())
                .source(source)
                .payload(payload)
                .build();
        try {
            marketContextRepository.saveAndFlush(context);
        } catch (DataIntegrityViolationException exception) {
            throw new ConcurrentRecordModificationException(
                    snapshot.contextId(),
                    snapshot.asOf().toString(),
                    "Market context " + snapshot.recordKey() + " was stored concurrently"
            );
        }
        log.info(
                "event=market_context_stored context_id={} as_of={} source={} symbols={} signals={} bars={}",
                snapshot.contextId(),
                snapshot.asOf(),
                source,
                snapshot.symbols().size(),
                snapshot.signals().size(),
                snapshot.history().size()
        );
        return MarketContextDto.from(snapshot, source);
    }
}
