package dev.campfire.job;

import java.time.Duration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestClient;

/**
 * Configures the HTTP client for the extraction collaborator and the bounded executor jobs are
 * dispatched on.
 *
 * <p>Timeouts and pool size are externalized via {@code campfire.extractor.*} properties.
 */
@Configuration
public class ExtractorConfig {

  /**
   * Creates a JSON {@link RestClient} targeting the extraction collaborator.
   *
   * @param builder Spring-provided builder with common defaults
   * @param properties base URL and timeouts
   * @return a named REST client bean for injection into {@link ExtractorClient}
   */
  @Bean
  public RestClient extractorRestClient(
      RestClient.Builder builder, ExtractorProperties properties) {
    var requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(Duration.ofMillis(properties.connectTimeoutMs()));
    requestFactory.setReadTimeout(Duration.ofMillis(properties.readTimeoutMs()));

    return builder
        .baseUrl(properties.baseUrl())
        .requestFactory(requestFactory)
        .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
        .build();
  }

  @Bean
  public ThreadPoolTaskExecutor extractionDispatchExecutor(ExtractorProperties properties) {
    var executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.dispatchThreads());
    executor.setMaxPoolSize(properties.dispatchThreads());
    executor.setThreadNamePrefix("extraction-dispatch-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(30);
    return executor;
  }
}
