package org.nowstart.compass.strategy.ranking;

/**
 * Latest learning metrics of one strategy family, as seen by ranking policies.
 */
public record FamilyLearning(
        String family,
        long snapshotVersion,
        double meanAlpha,
        double meanDrawdown,
        double meanTrust,
        double meanAcceptance,
        int sampleCount
) {
}
