package org.nowstart.compass.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;
import org.nowstart.compass.data.property.RankingProperties;
import org.nowstart.compass.data.property.ScoringProperties;
import org.nowstart.compass.service.PerformanceScorer;
import org.nowstart.compass.strategy.ranking.WeightedLearningRankingPolicy;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.cloud.autoconfigure.RefreshAutoConfiguration;
import org.springframework.cloud.context.scope.refresh.RefreshScope;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

class RefreshScopedBeansContextTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(
                    RefreshScopeTestConfig.class,
                    PropertiesTestConfig.class,
                    PerformanceScorer.class,
                    WeightedLearningRankingPolicy.class
            )
            .withConfiguration(AutoConfigurations.of(RefreshAutoConfiguration.class));

    @Test
    void contextLoadsWithDefaults() {
        contextRunner.run(context -> {
            assertThat(context).hasNotFailed();
            assertThat(context.getBean(PerformanceScorer.class).trust(List.of(), null)).isEqualTo(1.0);
            assertThat(context.getBean(RankingProperties.class).policy()).isEqualTo("weighted-learning");
            assertThat(context.getBean(ScoringProperties.class).acceptanceWindow()).isEqualTo(20);
            assertThat(context.getBean(ScoringProperties.class).trustWindow()).isEqualTo(200);
        });
    }

    @Test
    void bindsOverriddenWeights() {
        contextRunner
                .withPropertyValues("compass.scoring.modified-weight=0.25", "compass.ranking.prior-weight=0.0")
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    assertThat(context.getBean(ScoringProperties.class).modifiedWeight()).isEqualTo(0.25);
                    assertThat(context.getBean(RankingProperties.class).priorWeight()).isZero();
                });
    }

    @Test
    void rejectsOutOfRangeWeights() {
        contextRunner
                .withPropertyValues("compass.scoring.feedback-weight=1.5")
                .run(context -> assertThat(context).hasFailed());
    }

    @Configuration(proxyBeanMethods = false)
    static class RefreshScopeTestConfig {

        @Bean
        RefreshScope refreshScope() {
            return new RefreshScope();
        }
    }

    @Configuration(proxyBeanMethods = false)
    @EnableConfigurationProperties({ScoringProperties.class, RankingProperties.class})
    static class PropertiesTestConfig {
    }
}
