package org.nowstart.compass.strategy.ranking;

/**
 * Anything that can be ranked: a generated hypothesis or a stored strategy version.
 *
 * @param candidateKey unique, stable key used as the final tie-breaker
 * @param family       strategy family the learning metrics are looked up by
 * @param prior        the candidate's own strength (backtest or generator estimate)
 */
public record RankingCandidate(
        String candidateKey,
        String family,
        double prior
) {
}
