package org.budgetanalyzer.changefeed.config;

import org.springframework.boot.autoconfigure.task.TaskSchedulingProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.lang.NonNull;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;

/**
 * Configuration for scheduled tasks.
 *
 * <p>Provides a dedicated thread pool for {@code @Scheduled} methods, which in this service is the
 * background promotion job. Pool size, thread name prefix and shutdown behavior come from the
 * {@code spring.task.scheduling} properties in application.yml.
 *
 * <p>On shutdown the scheduler waits for a running promotion batch to finish. A batch that is cut
 * off anyway rolls back entirely and is promoted again by the next run.
 */
@Configuration
@EnableScheduling
public class SchedulingConfig implements SchedulingConfigurer {

  private final TaskSchedulingProperties taskSchedulingProperties;

  public SchedulingConfig(TaskSchedulingProperties taskSchedulingProperties) {
    this.taskSchedulingProperties = taskSchedulingProperties;
  }

  /**
   * Task scheduler for scheduled background jobs.
   *
   * @return The configured task scheduler
   */
  @Bean
  @NonNull
  public TaskScheduler taskScheduler() {
    var scheduler = new ThreadPoolTaskScheduler();

    scheduler.setPoolSize(taskSchedulingProperties.getPool().getSize());

    var shutdown = taskSchedulingProperties.getShutdown();
    scheduler.setWaitForTasksToCompleteOnShutdown(shutdown.isAwaitTermination());
    if (shutdown.getAwaitTerminationPeriod() != null) {
      scheduler.setAwaitTerminationSeconds((int) shutdown.getAwaitTerminationPeriod().getSeconds());
    }

    scheduler.setThreadNamePrefix(taskSchedulingProperties.getThreadNamePrefix());
    scheduler.initialize();

    return scheduler;
  }

  @Override
  public void configureTasks(@NonNull ScheduledTaskRegistrar taskRegistrar) {
    taskRegistrar.setTaskScheduler(taskScheduler());
  }
}
