package dev.campfire.api;

import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import dev.campfire.config.GlobalExceptionHandler;
import dev.campfire.dedup.DedupKind;
import dev.campfire.dedup.DedupResult;
import dev.campfire.dedup.DeduplicationService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class DedupControllerTest {

  @Mock DeduplicationService deduplicationService;

  MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    mockMvc =
        MockMvcBuilders.standaloneSetup(new DedupController(deduplicationService))
            .setControllerAdvice(new GlobalExceptionHandler())
            .build();
  }

  @Test
  void runs_one_batch_and_returns_the_continuation() throws Exception {
    given(deduplicationService.runDeduplicationBatch(DedupKind.ORGANIZATIONS, 50, null))
        .willReturn(new DedupResult(DedupKind.ORGANIZATIONS, 50, 1, 2, 7, 0, "next-page"));

    mockMvc
        .perform(post("/api/dedup/{kind}", "organization").param("batchSize", "50"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.merged").value(1))
        .andExpect(jsonPath("$.deleted").value(2))
        .andExpect(jsonPath("$.repointed").value(7))
        .andExpect(jsonPath("$.continuation").value("next-page"));
  }

  @Test
  void unknown_kind_is_a_bad_request() throws Exception {
    mockMvc.perform(post("/api/dedup/{kind}", "sessions")).andExpect(status().isBadRequest());
    then(deduplicationService).shouldHaveNoInteractions();
  }

  @Test
  void service_rejections_are_bad_requests() throws Exception {
    given(deduplicationService.runDeduplicationBatch(DedupKind.CAMPS, 0, null))
        .willThrow(new IllegalArgumentException("batchSize must be between 1 and 500, got: 0"));

    mockMvc
        .perform(post("/api/dedup/{kind}", "camps").param("batchSize", "0"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.detail").value("batchSize must be between 1 and 500, got: 0"));
  }
}
