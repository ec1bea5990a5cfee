package org.nowstart.compass.data.property;

import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "compass.backtest")
public record BacktestProperties(
        // minimum aligned bars any backtest needs, regardless of goal horizon
        @Positive @DefaultValue("60") int minHistoryBars,
        // longest lookback a hypothesis may request
        @Positive @DefaultValue("756") int maxLookbackBars,
        // annualisation factor for daily returns
        @Positive @DefaultValue("252") int tradingDaysPerYear,
        // bootstrap resamples for the expected return interval (0 disables)
        @PositiveOrZero @DefaultValue("200") int bootstrapSamples,
        // seed used when the caller does not supply one
        @DefaultValue("42") long defaultSeed
) {
}
