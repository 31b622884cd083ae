package dev.campfire.dedup;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.times;

import dev.campfire.catalog.Address;
import dev.campfire.catalog.Camp;
import dev.campfire.catalog.CampRepository;
import dev.campfire.catalog.Location;
import dev.campfire.catalog.LocationRepository;
import dev.campfire.catalog.Organization;
import dev.campfire.catalog.OrganizationRepository;
import dev.campfire.fixture.Entities;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.PageRequest;

@ExtendWith(MockitoExtension.class)
class DeduplicationServiceTest {

  private static final Instant T0 = Instant.parse("2025-03-01T10:00:00Z");

  @Mock OrganizationRepository organizationRepository;

  @Mock LocationRepository locationRepository;

  @Mock CampRepository campRepository;

  @Mock GroupMerger groupMerger;

  DedupProperties properties;

  DeduplicationService deduplicationService;

  @BeforeEach
  void setUp() {
    properties = new DedupProperties();
    deduplicationService =
        new DeduplicationService(
            organizationRepository, locationRepository, campRepository, groupMerger, properties);
  }

  private static Organization organization(String name, String website, int minutes) {
    Organization organization = Entities.withId(new Organization(name, "slug-" + minutes, website));
    return Entities.withCreatedAt(organization, T0.plusSeconds(60L * minutes));
  }

  @Nested
  class Organizations {

    @Test
    void three_copies_of_one_provider_merge_into_one() {
      List<Organization> rows =
          List.of(
              organization("Camp Sunshine", "https://campsunshine.example.com", 0),
              organization("camp sunshine", "https://www.campsunshine.example.com/", 1),
              organization("CAMP  SUNSHINE", "https://campsunshine.example.com/about", 2));
      given(organizationRepository.findAllByOrderByCreatedAtAscIdAsc(PageRequest.of(0, 200)))
          .willReturn(rows);
      given(
              groupMerger.mergeOrganizations(
                  "camp sunshine", "campsunshine.example.com", SurvivorPolicy.FIRST_CREATED))
          .willReturn(new MergeOutcome(2, 7));

      DedupResult result =
          deduplicationService.runDeduplicationBatch(DedupKind.ORGANIZATIONS, null, null);

      assertThat(result.scanned()).isEqualTo(3);
      assertThat(result.merged()).isEqualTo(1);
      assertThat(result.deleted()).isEqualTo(2);
      assertThat(result.repointed()).isEqualTo(7);
      assertThat(result.failedGroups()).isZero();
      assertThat(result.exhausted()).isTrue();
      then(groupMerger).should(times(1)).mergeOrganizations(any(), any(), any());
    }

    @Test
    void merged_catalog_is_left_unchanged() {
      given(organizationRepository.findAllByOrderByCreatedAtAscIdAsc(PageRequest.of(0, 200)))
          .willReturn(List.of(organization("Camp Sunshine", "https://campsunshine.example.com", 0)));
      given(groupMerger.mergeOrganizations(any(), any(), any())).willReturn(MergeOutcome.NONE);

      DedupResult result =
          deduplicationService.runDeduplicationBatch(DedupKind.ORGANIZATIONS, null, null);

      assertThat(result.merged()).isZero();
      assertThat(result.deleted()).isZero();
      assertThat(result.repointed()).isZero();
    }

    @Test
    void same_name_on_different_domains_stays_apart() {
      given(organizationRepository.findAllByOrderByCreatedAtAscIdAsc(PageRequest.of(0, 200)))
          .willReturn(
              List.of(
                  organization("YMCA Camps", "https://ymca-portland.example.org", 0),
                  organization("YMCA Camps", "https://ymca-seattle.example.org", 1)));
      given(groupMerger.mergeOrganizations(any(), any(), any())).willReturn(MergeOutcome.NONE);

      deduplicationService.runDeduplicationBatch(DedupKind.ORGANIZATIONS, null, null);

      then(groupMerger).should().mergeOrganizations("ymca camps", "ymca-portland.example.org", SurvivorPolicy.FIRST_CREATED);
      then(groupMerger).should().mergeOrganizations("ymca camps", "ymca-seattle.example.org", SurvivorPolicy.FIRST_CREATED);
    }

    @Test
    void full_slice_returns_a_cursor_and_the_next_batch_resumes_after_it() {
      Organization first = organization("Alpha", "https://alpha.example.com", 0);
      Organization second = organization("Beta", "https://beta.example.com", 1);
      Organization third = organization("Gamma", "https://gamma.example.com", 2);
      given(organizationRepository.findAllByOrderByCreatedAtAscIdAsc(PageRequest.of(0, 2)))
          .willReturn(List.of(first, second));
      given(
              organizationRepository.findSliceAfter(
                  second.getCreatedAt(), second.getId(), PageRequest.of(0, 2)))
          .willReturn(List.of(third));
      given(groupMerger.mergeOrganizations(any(), any(), any())).willReturn(MergeOutcome.NONE);

      DedupResult firstBatch =
          deduplicationService.runDeduplicationBatch(DedupKind.ORGANIZATIONS, 2, null);
      DedupResult secondBatch =
          deduplicationService.runDeduplicationBatch(
              DedupKind.ORGANIZATIONS, 2, firstBatch.continuation());

      assertThat(firstBatch.continuation())
          .isEqualTo(new DedupCursor(second.getCreatedAt(), second.getId()).encode());
      assertThat(secondBatch.scanned()).isEqualTo(1);
      assertThat(secondBatch.exhausted()).isTrue();
    }

    @Test
    void a_failing_group_is_counted_and_the_batch_goes_on() {
      given(organizationRepository.findAllByOrderByCreatedAtAscIdAsc(PageRequest.of(0, 200)))
          .willReturn(
              List.of(
                  organization("Alpha", "https://alpha.example.com", 0),
                  organization("Beta", "https://beta.example.com", 1)));
      given(groupMerger.mergeOrganizations(eq("alpha"), any(), any()))
          .willThrow(new IllegalStateException("deadlock detected"));
      given(groupMerger.mergeOrganizations(eq("beta"), any(), any()))
          .willReturn(new MergeOutcome(1, 2));

      DedupResult result =
          deduplicationService.runDeduplicationBatch(DedupKind.ORGANIZATIONS, null, null);

      assertThat(result.failedGroups()).isEqualTo(1);
      assertThat(result.merged()).isEqualTo(1);
      assertThat(result.deleted()).isEqualTo(1);
    }

    @Test
    void survivor_policy_is_passed_through() {
      properties.setSurvivorPolicy(SurvivorPolicy.MOST_REFERENCED);
      given(organizationRepository.findAllByOrderByCreatedAtAscIdAsc(PageRequest.of(0, 200)))
          .willReturn(List.of(organization("Alpha", "https://alpha.example.com", 0)));
      given(groupMerger.mergeOrganizations(any(), any(), any())).willReturn(MergeOutcome.NONE);

      deduplicationService.runDeduplicationBatch(DedupKind.ORGANIZATIONS, null, null);

      then(groupMerger)
          .should()
          .mergeOrganizations("alpha", "alpha.example.com", SurvivorPolicy.MOST_REFERENCED);
    }
  }

  @Test
  void location_batches_purge_placeholders_first() {
    UUID organizationId = UUID.randomUUID();
    Location location =
        Entities.withCreatedAt(
            Entities.withId(
                new Location(organizationId, null, "Main Campus", new Address("1 Main St", null, null, null))),
            T0);
    given(groupMerger.purgeBadLocations(45.5152, -122.6784, DedupProperties.PLACEHOLDER_TOLERANCE, 200))
        .willReturn(4);
    given(locationRepository.findAllByOrderByCreatedAtAscIdAsc(PageRequest.of(0, 200)))
        .willReturn(List.of(location));
    given(groupMerger.mergeLocations(organizationId, "main campus", SurvivorPolicy.FIRST_CREATED))
        .willReturn(new MergeOutcome(1, 3));

    DedupResult result = deduplicationService.runDeduplicationBatch(DedupKind.LOCATIONS, null, null);

    assertThat(result.deleted()).isEqualTo(5);
    assertThat(result.merged()).isEqualTo(1);
  }

  @Test
  void placeholder_purge_repeats_until_a_short_chunk() {
    properties.setBatchSize(2);
    given(groupMerger.purgeBadLocations(45.5152, -122.6784, DedupProperties.PLACEHOLDER_TOLERANCE, 2))
        .willReturn(2, 2, 1);
    given(locationRepository.findAllByOrderByCreatedAtAscIdAsc(PageRequest.of(0, 2)))
        .willReturn(List.of());

    DedupResult result = deduplicationService.runDeduplicationBatch(DedupKind.LOCATIONS, null, null);

    assertThat(result.deleted()).isEqualTo(5);
    assertThat(result.scanned()).isZero();
    then(groupMerger)
        .should(times(3))
        .purgeBadLocations(45.5152, -122.6784, DedupProperties.PLACEHOLDER_TOLERANCE, 2);
  }

  @Test
  void camps_without_organization_are_grouped_too() {
    Camp camp = Entities.withCreatedAt(Entities.withId(new Camp(null, "Lego Robotics")), T0);
    given(campRepository.findAllByOrderByCreatedAtAscIdAsc(PageRequest.of(0, 200)))
        .willReturn(List.of(camp));
    given(groupMerger.mergeCamps(null, "lego robotics", SurvivorPolicy.FIRST_CREATED))
        .willReturn(MergeOutcome.NONE);

    DedupResult result = deduplicationService.runDeduplicationBatch(DedupKind.CAMPS, null, null);

    assertThat(result.scanned()).isEqualTo(1);
  }

  @Test
  void run_to_completion_follows_the_cursor() {
    properties.setBatchSize(1);
    Organization first = organization("Alpha", "https://alpha.example.com", 0);
    Organization second = organization("Beta", "https://beta.example.com", 1);
    given(organizationRepository.findAllByOrderByCreatedAtAscIdAsc(PageRequest.of(0, 1)))
        .willReturn(List.of(first));
    given(organizationRepository.findSliceAfter(first.getCreatedAt(), first.getId(), PageRequest.of(0, 1)))
        .willReturn(List.of(second));
    given(organizationRepository.findSliceAfter(second.getCreatedAt(), second.getId(), PageRequest.of(0, 1)))
        .willReturn(List.of());
    given(groupMerger.mergeOrganizations(any(), any(), any())).willReturn(new MergeOutcome(1, 1));

    DedupResult total = deduplicationService.runToCompletion(DedupKind.ORGANIZATIONS);

    assertThat(total.scanned()).isEqualTo(2);
    assertThat(total.merged()).isEqualTo(2);
    assertThat(total.exhausted()).isTrue();
  }

  @Test
  void batch_size_out_of_range_is_rejected() {
    assertThatThrownBy(() -> deduplicationService.runDeduplicationBatch(DedupKind.CAMPS, 0, null))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> deduplicationService.runDeduplicationBatch(DedupKind.CAMPS, 501, null))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void malformed_cursor_is_rejected() {
    assertThatThrownBy(
            () -> deduplicationService.runDeduplicationBatch(DedupKind.CAMPS, 10, "not-a-cursor"))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
