package org.nowstart.compass.service;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.nowstart.compass.data.dto.OutcomePoint;
import org.nowstart.compass.data.entity.DecisionResolution;
import org.nowstart.compass.data.property.ScoringProperties;
import org.nowstart.compass.data.type.DecisionOutcome;
import org.springframework.cloud.context.config.annotation.RefreshScope;
import org.springframework.stereotype.Component;

/**
 * The four performance objectives. Pure functions of their inputs; nothing here reads storage.
 */
@Component
@RefreshScope
@RequiredArgsConstructor
public class PerformanceScorer {

    private static final int MIN_RATING = 1;
    private static final int MAX_RATING = 5;

    private final ScoringProperties scoringProperties;

    public OutcomeReturns returns(List<OutcomePoint> outcome) {
        if (outcome == null || outcome.size() < 2) {
            throw new IllegalArgumentException("market outcome needs at least two points");
        }
        List<OutcomePoint> ordered = outcome.stream()
                .sorted(Comparator.comparing(OutcomePoint::timestamp))
                .toList();
        OutcomePoint first = ordered.get(0);
        OutcomePoint last = ordered.get(ordered.size() - 1);

        double totalReturn = last.portfolioValue() / first.portfolioValue() - 1.0;
        double benchmarkReturn = last.benchmarkValue() / first.benchmarkValue() - 1.0;

        double peak = first.portfolioValue();
        double drawdown = 0.0;
        for (OutcomePoint point : ordered) {
            peak = Math.max(peak, point.portfolioValue());
            drawdown = Math.max(drawdown, (peak - point.portfolioValue()) / peak);
        }
        return new OutcomeReturns(
                totalReturn,
                benchmarkReturn,
                totalReturn - benchmarkReturn,
                drawdown,
                first.timestamp(),
                last.timestamp()
        );
    }

    /**
     * {@code 1 - rejectionRate - modifiedWeight * modificationRate} over the family's resolved
     * decisions, optionally blended with a 1..5 feedback rating, clamped to [0, 1].
     */
    public double trust(List<DecisionResolution> familyResolutions, Integer feedbackRating) {
        double base = 1.0;
        if (familyResolutions != null && !familyResolutions.isEmpty()) {
            double total = familyResolutions.size();
            long rejected = count(familyResolutions, DecisionOutcome.REJECTED);
            long modified = count(familyResolutions, DecisionOutcome.MODIFIED);
            base = 1.0 - rejected / total - scoringProperties.modifiedWeight() * (modified / total);
        }
        if (feedbackRating != null) {
            int rating = Math.max(MIN_RATING, Math.min(MAX_RATING, feedbackRating));
            double feedback = (rating - MIN_RATING) / (double) (MAX_RATING - MIN_RATING);
            base = (1.0 - scoringProperties.feedbackWeight()) * base + scoringProperties.feedbackWeight() * feedback;
        }
        return clamp(base);
    }

    /**
     * Accepted share of the given resolved decisions; 0 when there are none.
     */
    public double acceptance(List<DecisionResolution> recentResolutions) {
        if (recentResolutions == null || recentResolutions.isEmpty()) {
            return 0.0;
        }
        return count(recentResolutions, DecisionOutcome.ACCEPTED) / (double) recentResolutions.size();
    }

    private long count(List<DecisionResolution> resolutions, DecisionOutcome outcome) {
        return resolutions.stream().filter(resolution -> resolution.getOutcome() == outcome).count();
    }

    private double clamp(double value) {
        if (!Double.isFinite(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    public record OutcomeReturns(
            double totalReturn,
            double benchmarkReturn,
            double alpha,
            double drawdown,
            Instant periodStart,
            Instant periodEnd
    ) {
    }
}
