package dev.campfire.api;

import dev.campfire.job.ExtractionResult;
import dev.campfire.job.JobService;
import java.util.UUID;
import org.jspecify.annotations.Nullable;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/jobs")
public class JobController {

  private final JobService jobService;

  public JobController(JobService jobService) {
    this.jobService = jobService;
  }

  @GetMapping("/{id}")
  public JobView get(@PathVariable UUID id) {
    return JobView.of(jobService.getJob(id));
  }

  /** Result callback of the extraction collaborator. 409 when the job is no longer running. */
  @PostMapping("/{id}/result")
  public JobView result(@PathVariable UUID id, @RequestBody ExtractionResult result) {
    return JobView.of(jobService.submitExtractionResult(id, result));
  }

  @PostMapping("/{id}/cancel")
  public JobView cancel(
      @PathVariable UUID id, @RequestBody(required = false) @Nullable ActorRequest request) {
    return JobView.of(jobService.cancelJob(id, ActorRequest.actorOf(request)));
  }
}
