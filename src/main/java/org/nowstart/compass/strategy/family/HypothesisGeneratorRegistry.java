package org.nowstart.compass.strategy.family;

import jakarta.annotation.PostConstruct;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class HypothesisGeneratorRegistry {

    private final List<HypothesisGenerator> generators;
    private Map<String, HypothesisGenerator> generatorsByFamily = Map.of();

    @PostConstruct
    public void init() {
        Map<String, HypothesisGenerator> byFamily = new TreeMap<>();
        for (HypothesisGenerator generator : generators) {
            String family = normalize(generator.family());
            HypothesisGenerator previous = byFamily.put(family, generator);
            if (previous != null) {
                throw new IllegalStateException("Duplicate hypothesis generator registered for family=" + family);
            }
        }
        generatorsByFamily = Map.copyOf(byFamily);
    }

    public HypothesisGenerator getRequired(String family) {
        HypothesisGenerator generator = generatorsByFamily.get(normalize(family));
        if (generator == null) {
            throw new IllegalStateException("No hypothesis generator registered for family=" + family);
        }
        return generator;
    }

    /**
     * Returns all generators ordered by family key.
     */
    public List<HypothesisGenerator> all() {
        return new TreeMap<>(generatorsByFamily).values().stream().toList();
    }

    private String normalize(String family) {
        if (family == null || family.isBlank()) {
            throw new IllegalArgumentException("family is required");
        }
        return family.trim().toLowerCase(Locale.ROOT);
    }
}
