package dev.campfire.mcp;

import dev.campfire.alert.AlertService;
import dev.campfire.alert.SourceAlert;
import dev.campfire.dedup.DedupKind;
import dev.campfire.dedup.DedupResult;
import dev.campfire.dedup.DeduplicationService;
import dev.campfire.discovery.DiscoveredSource;
import dev.campfire.discovery.DiscoveryService;
import dev.campfire.discovery.DiscoveryStatus;
import dev.campfire.discovery.ReviewDecision;
import dev.campfire.discovery.SiteAnalysis;
import dev.campfire.error.ConflictException;
import dev.campfire.error.NotFoundException;
import dev.campfire.job.ExtractionJob;
import dev.campfire.job.JobService;
import dev.campfire.source.SourceFilter;
import dev.campfire.source.SourceHealthView;
import dev.campfire.source.SourceListing;
import dev.campfire.source.SourceService;
import dev.campfire.source.SourceSummary;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;

/**
 * MCP adapter exposing operator actions as tool methods.
 *
 * <p>Each method is annotated with {@code @Tool} and registered via {@link McpToolConfig}. Tool
 * methods follow the structured error pattern: all exceptions are caught and returned as
 * descriptive {@code Error: ...} strings, never thrown.
 *
 * <p>Tools: {@code list_sources}, {@code source_health}, {@code trigger_job}, {@code cancel_job},
 * {@code clear_regeneration}, {@code discovery_queue}, {@code review_discovery}, {@code run_dedup},
 * {@code list_alerts}.
 */
@Service
public class McpToolService {

  private static final Logger log = LoggerFactory.getLogger(McpToolService.class);

  static final String MCP_ACTOR = "mcp";

  private final SourceService sourceService;
  private final JobService jobService;
  private final DiscoveryService discoveryService;
  private final DeduplicationService deduplicationService;
  private final AlertService alertService;

  public McpToolService(
      SourceService sourceService,
      JobService jobService,
      DiscoveryService discoveryService,
      DeduplicationService deduplicationService,
      AlertService alertService) {
    this.sourceService = sourceService;
    this.jobService = jobService;
    this.discoveryService = discoveryService;
    this.deduplicationService = deduplicationService;
    this.alertService = alertService;
  }

  @Tool(
      name = "list_sources",
      description =
          "List camp-listing sources with health status, success rate and failure streak. "
              + "Filter: all, healthy (alias active), failing, nodata.")
  public String listSources(
      @ToolParam(description = "Filter: all, healthy, active, failing or nodata", required = false)
          @Nullable String filter,
      @ToolParam(description = "Restrict to one city (UUID)", required = false)
          @Nullable String cityId,
      @ToolParam(description = "Maximum rows (1-500, default 50)", required = false)
          @Nullable Integer limit) {
    try {
      SourceListing listing =
          sourceService.listSourcesFiltered(
              SourceFilter.parse(filter), cityId != null ? parseUuid(cityId) : null, limit);
      StringBuilder sb = new StringBuilder();
      sb.append(
          String.format(
              "Counts: all=%d healthy=%d failing=%d nodata=%d%n",
              listing.countsByFilter().get(SourceFilter.ALL),
              listing.countsByFilter().get(SourceFilter.HEALTHY),
              listing.countsByFilter().get(SourceFilter.FAILING),
              listing.countsByFilter().get(SourceFilter.NODATA)));
      if (listing.sources().isEmpty()) {
        return sb.append("No sources match this filter.").toString();
      }
      for (SourceSummary source : listing.sources()) {
        sb.append(
            String.format(
                "- %s (%s) [%s]: %s | success %.0f%% | failures in a row: %d%s%s%n",
                source.name(),
                source.id(),
                source.domain(),
                source.healthStatus(),
                source.successRate() * 100,
                source.consecutiveFailures(),
                source.needsRegeneration() ? " | needs regeneration" : "",
                source.active() ? "" : " | disabled"));
      }
      return sb.toString();
    } catch (IllegalArgumentException e) {
      return "Error: " + e.getMessage();
    } catch (Exception e) {
      return "Error listing sources: " + e.getMessage();
    }
  }

  @Tool(name = "source_health", description = "Show the health snapshot of one source by ID.")
  public String sourceHealth(@ToolParam(description = "UUID of the source") String sourceId) {
    try {
      return formatHealth(sourceService.getSourceHealth(parseUuid(sourceId)));
    } catch (NotFoundException e) {
      return "Error: Source %s not found.".formatted(sourceId);
    } catch (IllegalArgumentException e) {
      return "Error: Invalid source ID format. Provide a valid UUID.";
    } catch (Exception e) {
      return "Error reading source health: " + e.getMessage();
    }
  }

  @Tool(
      name = "trigger_job",
      description =
          "Start an extraction job for a source. Fails if a job is already running for it.")
  public String triggerJob(@ToolParam(description = "UUID of the source") String sourceId) {
    try {
      ExtractionJob job = jobService.triggerJob(parseUuid(sourceId), MCP_ACTOR);
      return "Job %s started for source %s.".formatted(job.getId(), sourceId);
    } catch (NotFoundException e) {
      return "Error: Source %s not found.".formatted(sourceId);
    } catch (ConflictException e) {
      return "Error: " + e.getMessage() + ". Wait for it to finish or cancel it with cancel_job.";
    } catch (IllegalArgumentException e) {
      return "Error: Invalid source ID format. Provide a valid UUID.";
    } catch (Exception e) {
      return "Error triggering job: " + e.getMessage();
    }
  }

  @Tool(name = "cancel_job", description = "Cancel a running extraction job by ID.")
  public String cancelJob(@ToolParam(description = "UUID of the job") String jobId) {
    try {
      ExtractionJob job = jobService.cancelJob(parseUuid(jobId), MCP_ACTOR);
      return "Job %s cancelled (status %s).".formatted(job.getId(), job.getStatus());
    } catch (NotFoundException e) {
      return "Error: Job %s not found.".formatted(jobId);
    } catch (ConflictException | ObjectOptimisticLockingFailureException e) {
      return "Error: Job %s is no longer running.".formatted(jobId);
    } catch (IllegalArgumentException e) {
      return "Error: Invalid job ID format. Provide a valid UUID.";
    } catch (Exception e) {
      return "Error cancelling job: " + e.getMessage();
    }
  }

  @Tool(
      name = "clear_regeneration",
      description =
          "Clear the needs-regeneration flag of a source once its extractor has been fixed.")
  public String clearRegeneration(@ToolParam(description = "UUID of the source") String sourceId) {
    try {
      var source = sourceService.clearRegenerationFlag(parseUuid(sourceId), MCP_ACTOR);
      return "Regeneration flag cleared on '%s'.".formatted(source.getName());
    } catch (NotFoundException e) {
      return "Error: Source %s not found.".formatted(sourceId);
    } catch (IllegalArgumentException e) {
      return "Error: Invalid source ID format. Provide a valid UUID.";
    } catch (Exception e) {
      return "Error clearing regeneration flag: " + e.getMessage();
    }
  }

  @Tool(
      name = "discovery_queue",
      description =
          "List discovered websites waiting for analysis or review, newest first. "
              + "Optionally filter by status or city.")
  public String discoveryQueue(
      @ToolParam(
              description =
                  "Status: PENDING_ANALYSIS, PENDING_REVIEW, APPROVED, REJECTED, SCRAPER_GENERATED,"
                      + " DUPLICATE. Empty = both pending states.",
              required = false)
          @Nullable String status,
      @ToolParam(description = "Restrict to one city (UUID)", required = false)
          @Nullable String cityId) {
    try {
      DiscoveryStatus parsed =
          status == null || status.isBlank()
              ? null
              : DiscoveryStatus.valueOf(status.trim().toUpperCase(Locale.ROOT));
      List<DiscoveredSource> queue =
          discoveryService.listQueue(parsed, cityId != null ? parseUuid(cityId) : null, null);
      if (queue.isEmpty()) {
        return "The discovery queue is empty.";
      }
      StringBuilder sb = new StringBuilder();
      for (DiscoveredSource item : queue) {
        SiteAnalysis analysis = item.getAnalysis();
        sb.append(
            String.format(
                "- %s (%s): %s%s%n",
                item.getUrl(),
                item.getId(),
                item.getStatus(),
                analysis != null
                    ? " | confidence %.2f, %s".formatted(analysis.confidence(), analysis.pageType())
                    : ""));
      }
      return sb.toString();
    } catch (IllegalArgumentException e) {
      return "Error: " + e.getMessage();
    } catch (Exception e) {
      return "Error listing the discovery queue: " + e.getMessage();
    }
  }

  @Tool(
      name = "review_discovery",
      description =
          "Approve or reject a discovered website. Approval creates the source and queues a"
              + " scraper development request.")
  public String reviewDiscovery(
      @ToolParam(description = "UUID of the discovered source") String discoveryId,
      @ToolParam(description = "approved or rejected") String decision,
      @ToolParam(description = "Review notes", required = false) @Nullable String notes) {
    try {
      DiscoveredSource reviewed =
          discoveryService.reviewDiscoveredSource(
              parseUuid(discoveryId), ReviewDecision.parse(decision), MCP_ACTOR, notes);
      return switch (reviewed.getStatus()) {
        case SCRAPER_GENERATED ->
            "Approved %s: source %s created, scraper requested."
                .formatted(reviewed.getUrl(), reviewed.getSourceId());
        case DUPLICATE ->
            "%s duplicates existing source %s."
                .formatted(reviewed.getUrl(), reviewed.getDuplicateOfSourceId());
        default -> "%s is now %s.".formatted(reviewed.getUrl(), reviewed.getStatus());
      };
    } catch (NotFoundException e) {
      return "Error: Discovered source %s not found.".formatted(discoveryId);
    } catch (ConflictException e) {
      return "Error: " + e.getMessage();
    } catch (IllegalArgumentException e) {
      return "Error: " + e.getMessage();
    } catch (Exception e) {
      return "Error reviewing discovered source: " + e.getMessage();
    }
  }

  @Tool(
      name = "run_dedup",
      description =
          "Run one deduplication batch over organizations, locations or camps. "
              + "Pass the returned continuation as cursor to resume.")
  public String runDedup(
      @ToolParam(description = "organizations, locations or camps") String kind,
      @ToolParam(description = "Candidates per batch (1-500)", required = false)
          @Nullable Integer batchSize,
      @ToolParam(description = "Continuation from the previous batch", required = false)
          @Nullable String cursor) {
    try {
      DedupResult result =
          deduplicationService.runDeduplicationBatch(DedupKind.parse(kind), batchSize, cursor);
      return String.format(
          "Dedup %s: scanned %d, merged %d group(s), deleted %d, repointed %d, failed %d.%s",
          result.kind(),
          result.scanned(),
          result.merged(),
          result.deleted(),
          result.repointed(),
          result.failedGroups(),
          result.exhausted() ? " Done." : " Continue with cursor " + result.continuation());
    } catch (IllegalArgumentException e) {
      return "Error: " + e.getMessage();
    } catch (Exception e) {
      log.error("run_dedup failed for {}", kind, e);
      return "Error running deduplication: " + e.getMessage();
    }
  }

  @Tool(name = "list_alerts", description = "List unacknowledged operator alerts, newest first.")
  public String listAlerts(
      @ToolParam(description = "Maximum rows (default 20)", required = false)
          @Nullable Integer limit) {
    try {
      int max = limit == null || limit < 1 ? 20 : Math.min(limit, 500);
      List<SourceAlert> alerts = alertService.listUnacknowledged(max);
      if (alerts.isEmpty()) {
        return "No unacknowledged alerts.";
      }
      StringBuilder sb = new StringBuilder();
      for (SourceAlert alert : alerts) {
        sb.append(
            String.format(
                "- [%s] %s %s: %s%n",
                alert.getSeverity(), alert.getType(), alert.getCreatedAt(), alert.getMessage()));
      }
      return sb.toString();
    } catch (Exception e) {
      return "Error listing alerts: " + e.getMessage();
    }
  }

  private static String formatHealth(SourceHealthView health) {
    return String.format(
        "Source: %s (%s)%nStatus: %s%nRuns: %d/%d successful (%.0f%%)%nFailures in a row: %d%n"
            + "Needs regeneration: %s%nActive: %s%s%nLast error: %s%nNext scrape: %s%n"
            + "Quality: %s%nRunning job: %s",
        health.name(),
        health.sourceId(),
        health.status(),
        health.successfulRuns(),
        health.totalRuns(),
        health.successRate() * 100,
        health.consecutiveFailures(),
        health.needsRegeneration() ? "yes" : "no",
        health.active() ? "yes" : "no",
        health.closureReason() != null ? " (" + health.closureReason() + ")" : "",
        health.lastError() != null ? health.lastError() : "none",
        health.nextScheduledScrapeAt() != null ? health.nextScheduledScrapeAt() : "not scheduled",
        health.qualityTier() != null
            ? "%s (%d)".formatted(health.qualityTier(), health.dataQualityScore())
            : "unknown",
        health.runningJobId() != null ? health.runningJobId() : "none");
  }

  private static UUID parseUuid(String value) {
    return UUID.fromString(value.trim());
  }
}
