package io.b2mash.toil.config;

import io.b2mash.toil.exception.InfrastructureException;
import java.util.Map;
import org.slf4j.MDC;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Background worker pool and retry policy for TOIL accrual jobs. Accrual never runs on a request
 * thread; the post-commit listener hands jobs to {@code toilAccrualExecutor}.
 */
@Configuration
@EnableConfigurationProperties(ToilProperties.class)
public class AccrualExecutorConfiguration {

  public static final String ACCRUAL_EXECUTOR = "toilAccrualExecutor";

  @Bean(name = ACCRUAL_EXECUTOR)
  public ThreadPoolTaskExecutor toilAccrualExecutor(ToilProperties properties) {
    var accrual = properties.accrual();
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(accrual.workerPoolSize());
    executor.setMaxPoolSize(accrual.workerPoolSize());
    executor.setQueueCapacity(accrual.queueCapacity());
    executor.setThreadNamePrefix("toil-accrual-");
    executor.setTaskDecorator(mdcPropagatingDecorator());
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(30);
    executor.initialize();
    return executor;
  }

  @Bean
  public RetryTemplate accrualRetryTemplate(ToilProperties properties) {
    var accrual = properties.accrual();
    return RetryTemplate.builder()
        .maxAttempts(accrual.maxAttempts())
        .exponentialBackoff(
            accrual.initialBackoff().toMillis(),
            accrual.backoffMultiplier(),
            accrual.maxBackoff().toMillis())
        .retryOn(InfrastructureException.class)
        .build();
  }

  // Carries requestId/userId from the committing request into the worker's log lines
  private static TaskDecorator mdcPropagatingDecorator() {
    return runnable -> {
      Map<String, String> context = MDC.getCopyOfContextMap();
      return () -> {
        if (context != null) {
          MDC.setContextMap(context);
        }
        try {
          runnable.run();
        } finally {
          MDC.clear();
        }
      };
    };
  }
}
