package org.nowstart.compass.data.property;

import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "compass.learning")
public record LearningProperties(
        // aggregation bucket for learning metrics
        @NotNull @DefaultValue("30d") Duration window,
        // how often the ranking snapshot is rebuilt; upper bound on its staleness
        @NotNull @DefaultValue("30s") Duration refreshInterval
) {
}
