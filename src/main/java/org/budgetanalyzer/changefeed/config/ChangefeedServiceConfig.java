package org.budgetanalyzer.changefeed.config;

import java.time.Clock;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Main configuration class for the Changefeed Service.
 *
 * <p>Binds {@link ChangefeedServiceProperties} and provides the UTC {@link Clock} that position
 * minting, staging defaults and backfill validation read time from. Tests replace the clock with a
 * fixed one.
 */
@Configuration
@EnableConfigurationProperties(ChangefeedServiceProperties.class)
public class ChangefeedServiceConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
