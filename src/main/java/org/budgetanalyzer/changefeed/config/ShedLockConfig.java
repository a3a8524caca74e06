package org.budgetanalyzer.changefeed.config;

import javax.sql.DataSource;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import net.javacrumbs.shedlock.core.LockProvider;
import net.javacrumbs.shedlock.provider.jdbctemplate.JdbcTemplateLockProvider;
import net.javacrumbs.shedlock.spring.annotation.EnableSchedulerLock;

/**
 * ShedLock configuration for the promotion job.
 *
 * <p>With several instances running, ShedLock lets one of them drive background promotion at a
 * time; the others skip the tick. This only saves work: promotion of a shard is serialized by the
 * shard's own row lock, so overlapping runs (for example after {@code lockAtMostFor} expires on a
 * slow run) stay correct.
 *
 * <p>Locks live in the {@code shedlock} table of the service's PostgreSQL database, created by
 * Flyway:
 *
 * <pre>
 * CREATE TABLE shedlock (
 *   name VARCHAR(64) PRIMARY KEY,
 *   lock_until TIMESTAMP NOT NULL,
 *   locked_at TIMESTAMP NOT NULL,
 *   locked_by VARCHAR(255) NOT NULL
 * );
 * </pre>
 *
 * @see net.javacrumbs.shedlock.spring.annotation.SchedulerLock
 */
@Configuration
@EnableSchedulerLock(defaultLockAtMostFor = "5m")
public class ShedLockConfig {

  /**
   * Creates a JDBC-based lock provider backed by the application's data source.
   *
   * @param dataSource The application's data source (auto-configured by Spring)
   * @return LockProvider instance for ShedLock
   */
  @Bean
  public LockProvider lockProvider(DataSource dataSource) {
    return new JdbcTemplateLockProvider(dataSource);
  }
}
