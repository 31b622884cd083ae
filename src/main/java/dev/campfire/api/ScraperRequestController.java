package dev.campfire.api;

import dev.campfire.discovery.DiscoveryService;
import dev.campfire.discovery.ScraperRequestStatus;
import jakarta.validation.Valid;
import java.util.List;
import java.util.UUID;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** Work queue read and updated by the scraper-automation collaborator. */
@RestController
@RequestMapping("/api/scraper-requests")
public class ScraperRequestController {

  private final DiscoveryService discoveryService;

  public ScraperRequestController(DiscoveryService discoveryService) {
    this.discoveryService = discoveryService;
  }

  @GetMapping
  public List<ScraperRequestView> list(
      @RequestParam(defaultValue = "PENDING") ScraperRequestStatus status) {
    return discoveryService.listScraperRequests(status).stream()
        .map(ScraperRequestView::of)
        .toList();
  }

  @PatchMapping("/{id}")
  public ScraperRequestView update(
      @PathVariable UUID id, @Valid @RequestBody ScraperRequestUpdate update) {
    return ScraperRequestView.of(
        discoveryService.updateScraperRequest(id, update.status(), update.notes()));
  }
}
