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
class JobTimeoutSweeperTest {

  @Mock JobService jobService;

  @InjectMocks JobTimeoutSweeper sweeper;

  @Test
  void one_failing_job_does_not_stop_the_sweep() {
    UUID finished = UUID.randomUUID();
    UUID broken = UUID.randomUUID();
    UUID late = UUID.randomUUID();
    given(jobService.findTimedOutJobIds()).willReturn(List.of(finished, broken, late));
    given(jobService.timeOut(finished))
        .willThrow(new IllegalJobTransitionException(finished, JobStatus.COMPLETED, JobStatus.FAILED));
    given(jobService.timeOut(broken)).willThrow(new IllegalStateException("db down"));

    sweeper.sweep();

    then(jobService).should().timeOut(late);
  }
}
