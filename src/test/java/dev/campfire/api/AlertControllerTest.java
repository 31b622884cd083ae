package dev.campfire.api;

import static org.mockito.BDDMockito.given;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import dev.campfire.alert.AlertService;
import dev.campfire.alert.AlertSeverity;
import dev.campfire.alert.AlertType;
import dev.campfire.alert.SourceAlert;
import dev.campfire.config.GlobalExceptionHandler;
import dev.campfire.fixture.Entities;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class AlertControllerTest {

  @Mock AlertService alertService;

  MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    mockMvc =
        MockMvcBuilders.standaloneSetup(new AlertController(alertService))
            .setControllerAdvice(new GlobalExceptionHandler())
            .build();
  }

  @Test
  void lists_unacknowledged_alerts() throws Exception {
    given(alertService.listUnacknowledged(50)).willReturn(List.of(alert()));

    mockMvc
        .perform(get("/api/alerts"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].type").value("SCRAPER_DEGRADED"))
        .andExpect(jsonPath("$[0].severity").value("WARNING"));
  }

  @Test
  void limit_out_of_range_is_a_bad_request() throws Exception {
    mockMvc.perform(get("/api/alerts").param("limit", "501")).andExpect(status().isBadRequest());
  }

  @Test
  void acknowledges_with_the_given_actor() throws Exception {
    SourceAlert alert = alert();
    alert.acknowledge("alice", Instant.parse("2025-05-01T12:00:00Z"));
    given(alertService.acknowledge(alert.getId(), "alice")).willReturn(alert);

    mockMvc
        .perform(
            post("/api/alerts/{id}/ack", alert.getId())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"actor\": \"alice\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.acknowledgedBy").value("alice"));
  }

  private static SourceAlert alert() {
    return Entities.withId(
        new SourceAlert(
            UUID.randomUUID(),
            AlertType.SCRAPER_DEGRADED,
            AlertSeverity.WARNING,
            "Source 'Camp Sunshine' has failed 3 times in a row: HTTP 500"));
  }
}
