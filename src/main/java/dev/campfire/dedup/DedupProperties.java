package dev.campfire.dedup;

import jakarta.annotation.PostConstruct;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Deduplication settings bound from {@code campfire.dedup.*}.
 *
 * <ul>
 *   <li>{@code survivor-policy} - {@link SurvivorPolicy} applied to every group (default
 *       FIRST_CREATED)
 *   <li>{@code batch-size} - candidates per batch when the caller gives none (1-500, default 200)
 *   <li>{@code sweep-interval} - delay between scheduled sweeps over all kinds
 *   <li>{@code placeholder-latitude}, {@code placeholder-longitude} - the city-centre point
 *       geocoders fall back to; locations within {@link #PLACEHOLDER_TOLERANCE} degrees of it are
 *       treated as ungeocoded
 * </ul>
 */
@Configuration
@ConfigurationProperties(prefix = "campfire.dedup")
public class DedupProperties {

  public static final double PLACEHOLDER_TOLERANCE = 0.001;
  static final int MAX_BATCH_SIZE = 500;

  private SurvivorPolicy survivorPolicy = SurvivorPolicy.FIRST_CREATED;
  private int batchSize = 200;
  private Duration sweepInterval = Duration.ofHours(1);
  private double placeholderLatitude = 45.5152;
  private double placeholderLongitude = -122.6784;

  @PostConstruct
  void validate() {
    if (batchSize < 1 || batchSize > MAX_BATCH_SIZE) {
      throw new IllegalStateException(
          "campfire.dedup.batch-size must be in [1, %d], got: %d"
              .formatted(MAX_BATCH_SIZE, batchSize));
    }
    if (placeholderLatitude < -90 || placeholderLatitude > 90) {
      throw new IllegalStateException(
          "campfire.dedup.placeholder-latitude must be in [-90, 90], got: " + placeholderLatitude);
    }
    if (placeholderLongitude < -180 || placeholderLongitude > 180) {
      throw new IllegalStateException(
          "campfire.dedup.placeholder-longitude must be in [-180, 180], got: "
              + placeholderLongitude);
    }
  }

  public SurvivorPolicy getSurvivorPolicy() {
    return survivorPolicy;
  }

  public void setSurvivorPolicy(SurvivorPolicy survivorPolicy) {
    this.survivorPolicy = survivorPolicy;
  }

  public int getBatchSize() {
    return batchSize;
  }

  public void setBatchSize(int batchSize) {
    this.batchSize = batchSize;
  }

  public Duration getSweepInterval() {
    return sweepInterval;
  }

  public void setSweepInterval(Duration sweepInterval) {
    this.sweepInterval = sweepInterval;
  }

  public double getPlaceholderLatitude() {
    return placeholderLatitude;
  }

  public void setPlaceholderLatitude(double placeholderLatitude) {
    this.placeholderLatitude = placeholderLatitude;
  }

  public double getPlaceholderLongitude() {
    return placeholderLongitude;
  }

  public void setPlaceholderLongitude(double placeholderLongitude) {
    this.placeholderLongitude = placeholderLongitude;
  }
}
