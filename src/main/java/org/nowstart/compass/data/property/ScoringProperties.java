package org.nowstart.compass.data.property;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "compass.scoring")
public record ScoringProperties(
        // how much a modification counts against trust relative to a rejection
        @PositiveOrZero @DecimalMax("1.0") @DefaultValue("0.5") double modifiedWeight,
        // share of the trust score taken from the user's feedback rating
        @PositiveOrZero @DecimalMax("1.0") @DefaultValue("0.2") double feedbackWeight,
        // number of most recent resolved decisions used for the acceptance rate
        @Positive @DefaultValue("20") int acceptanceWindow,
        // number of most recent resolutions of a strategy family used for its trust score
        @Positive @DefaultValue("200") int trustWindow
) {
}
