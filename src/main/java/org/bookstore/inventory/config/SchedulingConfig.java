package org.bookstore.inventory.config;

import org.springframework.boot.autoconfigure.task.TaskSchedulingProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.lang.NonNull;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;

/**
 * Configuration for scheduled tasks.
 *
 * <p>One {@code taskScheduler} pool runs both the {@code @Scheduled} global low-stock sweep and the
 * per-user triggers armed by {@code ScheduledJobRunner}. CSV exports run on Spring Boot's
 * auto-configured {@code applicationTaskExecutor} through {@code @Async}.
 *
 * <p><b>Configuration:</b> pool size, thread name prefix and shutdown behavior come from {@code
 * spring.task.scheduling} in application.yml.
 */
@Configuration
@EnableScheduling
@EnableAsync
public class SchedulingConfig implements SchedulingConfigurer {

  private final TaskSchedulingProperties taskSchedulingProperties;

  public SchedulingConfig(TaskSchedulingProperties taskSchedulingProperties) {
    this.taskSchedulingProperties = taskSchedulingProperties;
  }

  /**
   * Task scheduler shared by scheduled and dynamically registered jobs.
   *
   * @return The configured task scheduler
   */
  @Bean
  @NonNull
  public TaskScheduler taskScheduler() {
    var scheduler = new ThreadPoolTaskScheduler();

    var pool = taskSchedulingProperties.getPool();
    scheduler.setPoolSize(pool.getSize());

    var shutdown = taskSchedulingProperties.getShutdown();
    scheduler.setWaitForTasksToCompleteOnShutdown(shutdown.isAwaitTermination());
    if (shutdown.getAwaitTerminationPeriod() != null) {
      scheduler.setAwaitTerminationSeconds((int) shutdown.getAwaitTerminationPeriod().getSeconds());
    }

    scheduler.setThreadNamePrefix(taskSchedulingProperties.getThreadNamePrefix());
    scheduler.setRemoveOnCancelPolicy(true);
    scheduler.initialize();

    return scheduler;
  }

  @Override
  public void configureTasks(@NonNull ScheduledTaskRegistrar taskRegistrar) {
    taskRegistrar.setTaskScheduler(taskScheduler());
  }
}
