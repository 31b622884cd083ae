package dev.campfire.discovery;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Discovery queue tuning bound from {@code campfire.discovery.*}.
 *
 * <p>{@code min-confidence}: analyses below this confidence are rejected without review (default
 * 0.5).
 */
@Configuration
@ConfigurationProperties(prefix = "campfire.discovery")
public class DiscoveryProperties {

  private double minConfidence = 0.5;

  @PostConstruct
  void validate() {
    if (minConfidence < 0.0 || minConfidence > 1.0) {
      throw new IllegalStateException(
          "campfire.discovery.min-confidence must be in [0.0, 1.0], got: " + minConfidence);
    }
  }

  public double getMinConfidence() {
    return minConfidence;
  }

  public void setMinConfidence(double minConfidence) {
    this.minConfidence = minConfidence;
  }
}
