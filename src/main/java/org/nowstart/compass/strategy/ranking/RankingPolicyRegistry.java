package org.nowstart.compass.strategy.ranking;

import jakarta.annotation.PostConstruct;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.nowstart.compass.data.property.RankingProperties;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class RankingPolicyRegistry {

    private final List<StrategyRankingPolicy> policies;
    private final RankingProperties rankingProperties;
    private Map<String, StrategyRankingPolicy> policiesByName = Map.of();

    @PostConstruct
    public void init() {
        Map<String, StrategyRankingPolicy> byName = new HashMap<>();
        for (StrategyRankingPolicy policy : policies) {
            String name = normalize(policy.name());
            StrategyRankingPolicy previous = byName.put(name, policy);
            if (previous != null) {
                throw new IllegalStateException("Duplicate ranking policy registered for name=" + name);
            }
        }
        policiesByName = Map.copyOf(byName);
        active();
    }

    /**
     * Returns the policy selected by configuration; fails when none is registered under that name.
     */
    public StrategyRankingPolicy active() {
        return getRequired(rankingProperties.policy());
    }

    public StrategyRankingPolicy getRequired(String name) {
        StrategyRankingPolicy policy = policiesByName.get(normalize(name));
        if (policy == null) {
            throw new IllegalStateException("No ranking policy registered for name=" + name);
        }
        return policy;
    }

    private String normalize(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("ranking policy name is required");
        }
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
