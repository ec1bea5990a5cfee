package org.nowstart.compass.data.property;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "compass.ranking")
public record RankingProperties(
        // name of the active ranking policy
        @NotBlank @DefaultValue("weighted-learning") String policy,
        @PositiveOrZero @DefaultValue("1.0") double alphaWeight,
        @PositiveOrZero @DefaultValue("0.5") double drawdownWeight,
        @PositiveOrZero @DefaultValue("0.3") double trustWeight,
        @PositiveOrZero @DefaultValue("0.2") double acceptanceWeight,
        // weight of the candidate's own backtest or generator signal
        @PositiveOrZero @DefaultValue("0.1") double priorWeight
) {
}
