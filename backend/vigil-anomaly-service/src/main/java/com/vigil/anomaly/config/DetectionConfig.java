package com.vigil.anomaly.config;

import com.vigil.detection.AnomalyDetector;
import java.time.Clock;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class DetectionConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public AnomalyDetector anomalyDetector(Clock clock) {
    return new AnomalyDetector(clock);
  }

  // Bulk alert creation during a detection pass; each alert is an independent task.
  @Bean(name = "alertExecutor")
  public ThreadPoolTaskExecutor alertExecutor(
      @Value("${vigil.alerts.executor.core-size:4}") int coreSize,
      @Value("${vigil.alerts.executor.max-size:8}") int maxSize,
      @Value("${vigil.alerts.executor.queue-capacity:500}") int queueCapacity) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(coreSize);
    executor.setMaxPoolSize(maxSize);
    executor.setQueueCapacity(queueCapacity);
    executor.setThreadNamePrefix("alert-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.initialize();
    return executor;
  }
}
