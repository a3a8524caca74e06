package org.budgetanalyzer.changefeed;

import org.junit.jupiter.api.Test;

import org.budgetanalyzer.changefeed.base.AbstractIntegrationTest;

/**
 * Smoke test to verify the Spring Boot application context loads against PostgreSQL with all
 * Flyway migrations applied.
 */
class ChangefeedServiceApplicationTests extends AbstractIntegrationTest {

  @Test
  void contextLoads() {
    // If this test passes, the context loaded and the schema matches the entities' queries
  }
}
