package dev.athenaeum.search;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Fixed-size pool that runs one task per queried source. */
@Configuration
public class SearchExecutionConfig {

  @Bean(destroyMethod = "shutdownNow")
  public ExecutorService searchExecutor(SearchProperties properties) {
    return Executors.newFixedThreadPool(properties.getExecutorThreads());
  }
}
