package dev.archivist.config;

import dev.archivist.retrieval.RetrievalProperties;
import java.time.Clock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Provides the retrieval worker pool and a system {@link Clock} for injectable time access. */
@Configuration
public class RetrievalConfig {

  /**
   * Worker pool running vector retrieval, keyword retrieval and reranking concurrently.
   *
   * @param properties retrieval settings providing the pool size
   * @return an initialized executor with {@code retrieval-} threads
   */
  @Bean(name = "retrievalExecutor")
  public ThreadPoolTaskExecutor retrievalExecutor(RetrievalProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.poolSize());
    executor.setMaxPoolSize(properties.poolSize());
    executor.setQueueCapacity(properties.poolSize() * 16);
    executor.setThreadNamePrefix("retrieval-");
    executor.setWaitForTasksToCompleteOnShutdown(false);
    executor.initialize();
    return executor;
  }

  @Bean
  @ConditionalOnMissingBean
  public Clock clock() {
    return Clock.systemDefaultZone();
  }
}
