package dev.campfire.api;

import dev.campfire.discovery.DiscoveredSource;
import dev.campfire.discovery.DiscoveryService;
import dev.campfire.discovery.DiscoveryStatus;
import dev.campfire.discovery.NewDiscovery;
import dev.campfire.discovery.ReviewDecision;
import dev.campfire.discovery.SiteAnalysis;
import jakarta.validation.Valid;
import java.net.URI;
import java.util.List;
import java.util.UUID;
import org.jspecify.annotations.Nullable;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** Discovery queue: intake from search, analysis callback and operator review. */
@RestController
@RequestMapping("/api/discoveries")
public class DiscoveryController {

  private final DiscoveryService discoveryService;

  public DiscoveryController(DiscoveryService discoveryService) {
    this.discoveryService = discoveryService;
  }

  @PostMapping
  public ResponseEntity<DiscoveryView> record(@RequestBody NewDiscovery discovery) {
    DiscoveredSource discovered = discoveryService.recordDiscovery(discovery);
    return ResponseEntity.created(URI.create("/api/discoveries/" + discovered.getId()))
        .body(DiscoveryView.of(discovered));
  }

  /** Pending items (both pending states) by default, newest first. */
  @GetMapping
  public List<DiscoveryView> queue(
      @RequestParam(required = false) @Nullable DiscoveryStatus status,
      @RequestParam(required = false) @Nullable UUID cityId,
      @RequestParam(required = false) @Nullable Integer limit) {
    return discoveryService.listQueue(status, cityId, limit).stream()
        .map(DiscoveryView::of)
        .toList();
  }

  @GetMapping("/{id}")
  public DiscoveryView get(@PathVariable UUID id) {
    return DiscoveryView.of(discoveryService.getDiscovery(id));
  }

  @PostMapping("/{id}/analysis")
  public DiscoveryView analysis(@PathVariable UUID id, @RequestBody SiteAnalysis analysis) {
    return DiscoveryView.of(discoveryService.applyAnalysis(id, analysis));
  }

  @PostMapping("/{id}/review")
  public DiscoveryView review(@PathVariable UUID id, @Valid @RequestBody ReviewRequest request) {
    return DiscoveryView.of(
        discoveryService.reviewDiscoveredSource(
            id, ReviewDecision.parse(request.decision()), request.reviewer(), request.notes()));
  }

  @PostMapping("/{id}/duplicate")
  public DiscoveryView duplicate(
      @PathVariable UUID id, @Valid @RequestBody DuplicateRequest request) {
    return DiscoveryView.of(
        discoveryService.markDuplicate(id, request.reviewer(), request.duplicateOfSourceId()));
  }
}
