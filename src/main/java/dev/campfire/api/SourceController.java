package dev.campfire.api;

import dev.campfire.alert.AlertService;
import dev.campfire.job.ExtractionJob;
import dev.campfire.job.JobService;
import dev.campfire.source.Source;
import dev.campfire.source.SourceDeletion;
import dev.campfire.source.SourceFilter;
import dev.campfire.source.SourceHealthView;
import dev.campfire.source.SourceListing;
import dev.campfire.source.SourceService;
import jakarta.validation.Valid;
import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.jspecify.annotations.Nullable;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** Operator REST surface for sources: listing, health, lifecycle and job triggers. */
@RestController
@RequestMapping("/api/sources")
public class SourceController {

  private final SourceService sourceService;
  private final JobService jobService;
  private final AlertService alertService;

  public SourceController(
      SourceService sourceService, JobService jobService, AlertService alertService) {
    this.sourceService = sourceService;
    this.jobService = jobService;
    this.alertService = alertService;
  }

  @GetMapping
  public SourceListing list(
      @RequestParam(required = false) @Nullable String filter,
      @RequestParam(required = false) @Nullable UUID cityId,
      @RequestParam(required = false) @Nullable Integer limit) {
    return sourceService.listSourcesFiltered(SourceFilter.parse(filter), cityId, limit);
  }

  @PostMapping
  public ResponseEntity<SourceHealthView> create(@Valid @RequestBody CreateSourceRequest request) {
    Source source = sourceService.createSource(request.toNewSource());
    return ResponseEntity.created(URI.create("/api/sources/" + source.getId()))
        .body(SourceHealthView.of(source));
  }

  @GetMapping("/{id}/health")
  public SourceHealthView health(@PathVariable UUID id) {
    return sourceService.getSourceHealth(id);
  }

  @DeleteMapping("/{id}")
  public SourceDeletion delete(
      @PathVariable UUID id, @RequestParam(defaultValue = "false") boolean cascade) {
    return sourceService.deleteSource(id, cascade);
  }

  /** Starts a job; 202 with the job, or 409 when one is already running for the source. */
  @PostMapping("/{id}/jobs")
  public ResponseEntity<JobView> trigger(
      @PathVariable UUID id, @RequestBody(required = false) @Nullable ActorRequest request) {
    ExtractionJob job = jobService.triggerJob(id, ActorRequest.actorOf(request));
    return ResponseEntity.accepted()
        .location(URI.create("/api/jobs/" + job.getId()))
        .body(JobView.of(job));
  }

  @GetMapping("/{id}/jobs")
  public List<JobView> jobs(@PathVariable UUID id, @RequestParam(defaultValue = "20") int limit) {
    return jobService.listJobsForSource(id, clamp(limit)).stream().map(JobView::of).toList();
  }

  @GetMapping("/{id}/alerts")
  public List<AlertView> alerts(
      @PathVariable UUID id, @RequestParam(defaultValue = "50") int limit) {
    return alertService.listForSource(id, clamp(limit)).stream().map(AlertView::of).toList();
  }

  @PostMapping("/{id}/rescan")
  public SourceHealthView rescan(
      @PathVariable UUID id, @RequestBody(required = false) @Nullable ActorRequest request) {
    String reason =
        request != null && request.reason() != null && !request.reason().isBlank()
            ? request.reason()
            : "Requested by " + ActorRequest.actorOf(request);
    return SourceHealthView.of(sourceService.flagForRescan(id, reason));
  }

  @PostMapping("/{id}/clear-regeneration")
  public SourceHealthView clearRegeneration(
      @PathVariable UUID id, @RequestBody(required = false) @Nullable ActorRequest request) {
    return SourceHealthView.of(
        sourceService.clearRegenerationFlag(id, ActorRequest.actorOf(request)));
  }

  @PostMapping("/{id}/re-enable")
  public SourceHealthView reEnable(
      @PathVariable UUID id, @RequestBody(required = false) @Nullable ActorRequest request) {
    return SourceHealthView.of(sourceService.reEnable(id, ActorRequest.actorOf(request)));
  }

  @PostMapping("/{id}/release-stuck-jobs")
  public Map<String, Object> releaseStuckJobs(@PathVariable UUID id) {
    return Map.of("sourceId", id, "released", jobService.releaseStuckJobs(id));
  }

  @PutMapping("/{id}/parsing-notes")
  public SourceHealthView parsingNotes(
      @PathVariable UUID id, @Valid @RequestBody ParsingNotesRequest request) {
    return SourceHealthView.of(sourceService.updateParsingNotes(id, request.notes()));
  }

  private static int clamp(int limit) {
    if (limit < 1 || limit > 500) {
      throw new IllegalArgumentException("limit must be between 1 and 500, got: " + limit);
    }
    return limit;
  }
}
