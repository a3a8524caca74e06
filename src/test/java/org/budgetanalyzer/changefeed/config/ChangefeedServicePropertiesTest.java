package org.budgetanalyzer.changefeed.config;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import org.budgetanalyzer.changefeed.domain.PositionTimeSource;

@DisplayName("ChangefeedServiceProperties Binding Tests")
class ChangefeedServicePropertiesTest {

  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner().withUserConfiguration(ChangefeedServiceConfig.class);

  @Test
  @DisplayName("binds defaults when nothing is configured")
  void bindsDefaults() {
    contextRunner.run(
        context -> {
          assertThat(context).hasNotFailed();
          var properties = context.getBean(ChangefeedServiceProperties.class);
          assertThat(properties.getPromotion().getBatchSize()).isEqualTo(500);
          assertThat(properties.getPromotion().getPositionTimeSource())
              .isEqualTo(PositionTimeSource.PROMOTION_INSTANT);
          assertThat(properties.getRead().getMaxWaitMs()).isEqualTo(30_000);
        });
  }

  @Test
  @DisplayName("binds kebab-case overrides")
  void bindsOverrides() {
    contextRunner
        .withPropertyValues(
            "changefeed-service.promotion.batch-size=50",
            "changefeed-service.promotion.position-time-source=TIME_HINT",
            "changefeed-service.read.long-poll-interval-ms=25")
        .run(
            context -> {
              var properties = context.getBean(ChangefeedServiceProperties.class);
              assertThat(properties.getPromotion().getBatchSize()).isEqualTo(50);
              assertThat(properties.getPromotion().getPositionTimeSource())
                  .isEqualTo(PositionTimeSource.TIME_HINT);
              assertThat(properties.getRead().getLongPollIntervalMs()).isEqualTo(25);
            });
  }

  @Test
  @DisplayName("fails startup when batch-size exceeds max-batch-size")
  void failsWhenBatchSizeExceedsMax() {
    contextRunner
        .withPropertyValues(
            "changefeed-service.promotion.batch-size=6000",
            "changefeed-service.promotion.max-batch-size=5000")
        .run(
            context ->
                assertThat(context)
                    .hasFailed()
                    .getFailure()
                    .hasStackTraceContaining("batch-size must not exceed max-batch-size"));
  }

  @Test
  @DisplayName("fails startup when default-page-size exceeds max-page-size")
  void failsWhenDefaultPageSizeExceedsMax() {
    contextRunner
        .withPropertyValues(
            "changefeed-service.read.default-page-size=200",
            "changefeed-service.read.max-page-size=100")
        .run(
            context ->
                assertThat(context)
                    .hasFailed()
                    .getFailure()
                    .hasStackTraceContaining("default-page-size must not exceed max-page-size"));
  }
}
