package org.nowstart.compass.strategy.ranking;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only, versioned view of the learning metrics handed to ranking policies.
 *
 * <p>Policies only ever see a snapshot, never the live aggregate, so a proposal's dependency on
 * learning state is explicit and its staleness is bounded by {@link #refreshedAt()}.
 */
public record LearningSnapshot(
        long version,
        Instant refreshedAt,
        Map<String, FamilyLearning> byFamily
) {

    public static final LearningSnapshot EMPTY = new LearningSnapshot(0L, Instant.EPOCH, Map.of());

    public LearningSnapshot {
        byFamily = byFamily == null ? Map.of() : Map.copyOf(byFamily);
    }

    public Optional<FamilyLearning> family(String family) {
        return Optional.ofNullable(byFamily.get(family));
    }

    public String reference() {
        return "learning@" + version;
    }
}
