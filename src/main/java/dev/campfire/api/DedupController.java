package dev.campfire.api;

import dev.campfire.dedup.DedupKind;
import dev.campfire.dedup.DedupResult;
import dev.campfire.dedup.DeduplicationService;
import org.jspecify.annotations.Nullable;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/dedup")
public class DedupController {

  private final DeduplicationService deduplicationService;

  public DedupController(DeduplicationService deduplicationService) {
    this.deduplicationService = deduplicationService;
  }

  /**
   * Runs one batch. Pass the returned {@code continuation} as {@code cursor} until it comes back
   * null.
   */
  @PostMapping("/{kind}")
  public DedupResult run(
      @PathVariable String kind,
      @RequestParam(required = false) @Nullable Integer batchSize,
      @RequestParam(required = false) @Nullable String cursor) {
    return deduplicationService.runDeduplicationBatch(DedupKind.parse(kind), batchSize, cursor);
  }
}
