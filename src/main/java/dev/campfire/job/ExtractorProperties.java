package dev.campfire.job;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "campfire.extractor")
public record ExtractorProperties(
    String baseUrl,
    String callbackBaseUrl,
    int connectTimeoutMs,
    int readTimeoutMs,
    int dispatchThreads,
    Retry retry) {

  public record Retry(int maxAttempts, long delayMs, double multiplier) {}
}
