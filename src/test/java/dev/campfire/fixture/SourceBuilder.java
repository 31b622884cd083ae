package dev.campfire.fixture;

import dev.campfire.source.Source;
import java.util.UUID;
import org.jspecify.annotations.Nullable;

/**
 * Lightweight test builder for the {@link Source} JPA entity. Provides sensible defaults so tests
 * only override what they care about. Health counters and the lease are written by reflection,
 * since production code only moves them through job outcomes and the lease queries.
 *
 * <pre>{@code
 * Source source = new SourceBuilder().totalRuns(10).successfulRuns(9).build();
 * }</pre>
 */
public final class SourceBuilder {

  private @Nullable UUID id = UUID.randomUUID();
  private String name = "Camp Sunshine";
  private String url = "https://campsunshine.example.com/summer";
  private String domain = "campsunshine.example.com";
  private @Nullable UUID organizationId;
  private @Nullable UUID cityId;
  private boolean active = true;
  private int scrapeFrequencyHours = 24;
  private @Nullable Integer extractionTimeoutSeconds;
  private int totalRuns;
  private int successfulRuns;
  private int consecutiveFailures;
  private int consecutiveNotFound;
  private int consecutiveZeroResults;
  private boolean needsRegeneration;
  private @Nullable UUID runningJobId;

  public SourceBuilder id(@Nullable UUID id) {
    this.id = id;
    return this;
  }

  public SourceBuilder name(String name) {
    this.name = name;
    return this;
  }

  public SourceBuilder url(String url) {
    this.url = url;
    return this;
  }

  public SourceBuilder domain(String domain) {
    this.domain = domain;
    return this;
  }

  public SourceBuilder organizationId(UUID organizationId) {
    this.organizationId = organizationId;
    return this;
  }

  public SourceBuilder cityId(UUID cityId) {
    this.cityId = cityId;
    return this;
  }

  public SourceBuilder inactive() {
    this.active = false;
    return this;
  }

  public SourceBuilder scrapeFrequencyHours(int scrapeFrequencyHours) {
    this.scrapeFrequencyHours = scrapeFrequencyHours;
    return this;
  }

  public SourceBuilder extractionTimeoutSeconds(Integer extractionTimeoutSeconds) {
    this.extractionTimeoutSeconds = extractionTimeoutSeconds;
    return this;
  }

  public SourceBuilder totalRuns(int totalRuns) {
    this.totalRuns = totalRuns;
    return this;
  }

  public SourceBuilder successfulRuns(int successfulRuns) {
    this.successfulRuns = successfulRuns;
    return this;
  }

  public SourceBuilder consecutiveFailures(int consecutiveFailures) {
    this.consecutiveFailures = consecutiveFailures;
    return this;
  }

  public SourceBuilder consecutiveNotFound(int consecutiveNotFound) {
    this.consecutiveNotFound = consecutiveNotFound;
    return this;
  }

  public SourceBuilder consecutiveZeroResults(int consecutiveZeroResults) {
    this.consecutiveZeroResults = consecutiveZeroResults;
    return this;
  }

  public SourceBuilder needsRegeneration(boolean needsRegeneration) {
    this.needsRegeneration = needsRegeneration;
    return this;
  }

  public SourceBuilder runningJobId(UUID runningJobId) {
    this.runningJobId = runningJobId;
    return this;
  }

  public Source build() {
    Source source = new Source(name, url, domain);
    if (id != null) {
      Entities.setField(source, "id", id);
    }
    source.setOrganizationId(organizationId);
    source.setCityId(cityId);
    source.setScrapeFrequencyHours(scrapeFrequencyHours);
    source.setExtractionTimeoutSeconds(extractionTimeoutSeconds);
    if (!active) {
      Entities.setField(source, "active", false);
    }
    if (runningJobId != null) {
      Entities.setField(source, "runningJobId", runningJobId);
    }
    Object health = source.getHealth();
    Entities.setField(health, "totalRuns", totalRuns);
    Entities.setField(health, "successfulRuns", successfulRuns);
    Entities.setField(health, "consecutiveFailures", consecutiveFailures);
    Entities.setField(health, "consecutiveNotFound", consecutiveNotFound);
    Entities.setField(health, "consecutiveZeroResults", consecutiveZeroResults);
    Entities.setField(health, "needsRegeneration", needsRegeneration);
    return source;
  }
}
