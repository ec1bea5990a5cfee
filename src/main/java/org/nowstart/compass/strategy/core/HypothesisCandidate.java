package org.nowstart.compass.strategy.core;

/**
 * A generated hypothesis before it is ranked or backtested.
 *
 * @param body  the hypothesis
 * @param prior the generator's own strength estimate, used by ranking policies as a tie-breaker
 */
public record HypothesisCandidate(
        HypothesisBody body,
        double prior
) {
}
