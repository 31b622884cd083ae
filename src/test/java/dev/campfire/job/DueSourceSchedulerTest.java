package dev.campfire.job;

import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;

import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class DueSourceSchedulerTest {

  @Mock JobService jobService;

  @InjectMocks DueSourceScheduler scheduler;

  @Test
  void triggers_every_due_source_and_skips_those_already_running() {
    UUID busy = UUID.randomUUID();
    UUID due = UUID.randomUUID();
    given(jobService.findDueSourceIds()).willReturn(List.of(busy, due));
    given(jobService.triggerJob(busy, DueSourceScheduler.SCHEDULER_ACTOR))
        .willThrow(new JobConflictException(busy));

    scheduler.triggerDueSources();

    then(jobService).should().triggerJob(due, DueSourceScheduler.SCHEDULER_ACTOR);
  }
}
