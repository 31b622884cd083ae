package dev.campfire.api;

import dev.campfire.alert.AlertService;
import java.util.List;
import java.util.UUID;
import org.jspecify.annotations.Nullable;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/alerts")
public class AlertController {

  private final AlertService alertService;

  public AlertController(AlertService alertService) {
    this.alertService = alertService;
  }

  /** Unacknowledged alerts, newest first. */
  @GetMapping
  public List<AlertView> list(@RequestParam(defaultValue = "50") int limit) {
    if (limit < 1 || limit > 500) {
      throw new IllegalArgumentException("limit must be between 1 and 500, got: " + limit);
    }
    return alertService.listUnacknowledged(limit).stream().map(AlertView::of).toList();
  }

  @PostMapping("/{id}/ack")
  public AlertView acknowledge(
      @PathVariable UUID id, @RequestBody(required = false) @Nullable ActorRequest request) {
    return AlertView.of(alertService.acknowledge(id, ActorRequest.actorOf(request)));
  }
}
