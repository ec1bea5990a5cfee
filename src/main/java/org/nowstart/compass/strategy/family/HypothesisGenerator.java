package org.nowstart.compass.strategy.family;

import org.nowstart.compass.strategy.core.HypothesisCandidate;
import org.nowstart.compass.strategy.core.HypothesisContext;

/**
 * A family of strategy hypotheses.
 *
 * <p>Implementations must be deterministic: the same context always produces the same candidate.
 */
public interface HypothesisGenerator {

    /**
     * Returns the stable family key (for example {@code signal_weighted}).
     */
    String family();

    /**
     * Builds this family's candidate for the given user, goal and market context.
     */
    HypothesisCandidate generate(HypothesisContext context, int lookbackBars);
}
