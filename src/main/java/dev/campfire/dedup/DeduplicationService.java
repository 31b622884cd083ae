package dev.campfire.dedup;

import dev.campfire.catalog.Camp;
import dev.campfire.catalog.CampRepository;
import dev.campfire.catalog.Location;
import dev.campfire.catalog.LocationRepository;
import dev.campfire.catalog.Organization;
import dev.campfire.catalog.OrganizationRepository;
import java.time.Instant;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.function.Supplier;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

/**
 * Merges duplicate organizations, locations and camps in resumable batches.
 *
 * <p>Each batch reads up to {@code batchSize} candidates in creation order after the cursor, then
 * merges the whole catalog group of every candidate through {@link GroupMerger}, so duplicates
 * spread over several batches are still found. Groups are keyed by:
 *
 * <ul>
 *   <li>organizations - normalized name and website domain
 *   <li>locations - organization and normalized name
 *   <li>camps - organization and normalized name
 * </ul>
 *
 * <p>Running a batch on an already merged catalog changes nothing.
 */
@Service
public class DeduplicationService {

  private static final Logger log = LoggerFactory.getLogger(DeduplicationService.class);

  private final OrganizationRepository organizationRepository;
  private final LocationRepository locationRepository;
  private final CampRepository campRepository;
  private final GroupMerger groupMerger;
  private final DedupProperties properties;

  public DeduplicationService(
      OrganizationRepository organizationRepository,
      LocationRepository locationRepository,
      CampRepository campRepository,
      GroupMerger groupMerger,
      DedupProperties properties) {
    this.organizationRepository = organizationRepository;
    this.locationRepository = locationRepository;
    this.campRepository = campRepository;
    this.groupMerger = groupMerger;
    this.properties = properties;
  }

  /**
   * Runs one batch.
   *
   * @param batchSize candidates to read (1-500); null for {@code campfire.dedup.batch-size}
   * @param cursor continuation returned by the previous batch; null to start from the beginning
   * @throws IllegalArgumentException for a batch size out of range or a malformed cursor
   */
  public DedupResult runDeduplicationBatch(
      DedupKind kind, @Nullable Integer batchSize, @Nullable String cursor) {
    int size = batchSize == null ? properties.getBatchSize() : batchSize;
    if (size < 1 || size > DedupProperties.MAX_BATCH_SIZE) {
      throw new IllegalArgumentException(
          "batchSize must be between 1 and %d, got: %d"
              .formatted(DedupProperties.MAX_BATCH_SIZE, size));
    }
    DedupCursor after = cursor == null || cursor.isBlank() ? null : DedupCursor.decode(cursor);
    SurvivorPolicy policy = properties.getSurvivorPolicy();
    BatchTally tally = new BatchTally();

    List<Candidate> slice =
        switch (kind) {
          case ORGANIZATIONS -> organizationSlice(after, size);
          case LOCATIONS -> {
            tally.deleted += purgePlaceholderLocations(size);
            yield locationSlice(after, size);
          }
          case CAMPS -> campSlice(after, size);
        };

    Set<List<Object>> seen = new HashSet<>();
    for (Candidate candidate : slice) {
      if (seen.add(candidate.groupKey())) {
        tally.apply(candidate, () -> candidate.merge().apply(policy));
      }
    }

    String continuation =
        slice.size() == size ? slice.get(slice.size() - 1).cursor().encode() : null;
    DedupResult result =
        new DedupResult(
            kind,
            slice.size(),
            tally.merged,
            tally.deleted,
            tally.repointed,
            tally.failedGroups,
            continuation);
    log.info(
        "Dedup batch {}: scanned {}, merged {} group(s), deleted {}, repointed {}, failed {}",
        kind,
        result.scanned(),
        result.merged(),
        result.deleted(),
        result.repointed(),
        result.failedGroups());
    return result;
  }

  /** Runs batches of one kind until the catalog is exhausted. */
  public DedupResult runToCompletion(DedupKind kind) {
    int scanned = 0;
    int merged = 0;
    int deleted = 0;
    int repointed = 0;
    int failed = 0;
    String cursor = null;
    do {
      DedupResult batch = runDeduplicationBatch(kind, null, cursor);
      scanned += batch.scanned();
      merged += batch.merged();
      deleted += batch.deleted();
      repointed += batch.repointed();
      failed += batch.failedGroups();
      cursor = batch.continuation();
    } while (cursor != null);
    return new DedupResult(kind, scanned, merged, deleted, repointed, failed, null);
  }

  /** Deletes unreferenced placeholder locations in chunks of {@code size} until none remain. */
  private int purgePlaceholderLocations(int size) {
    int total = 0;
    int purged;
    do {
      purged =
          groupMerger.purgeBadLocations(
              properties.getPlaceholderLatitude(),
              properties.getPlaceholderLongitude(),
              DedupProperties.PLACEHOLDER_TOLERANCE,
              size);
      total += purged;
    } while (purged == size);
    return total;
  }

  private List<Candidate> organizationSlice(@Nullable DedupCursor after, int size) {
    PageRequest page = PageRequest.of(0, size);
    List<Organization> rows =
        after == null
            ? organizationRepository.findAllByOrderByCreatedAtAscIdAsc(page)
            : organizationRepository.findSliceAfter(after.createdAt(), after.id(), page);
    return rows.stream()
        .map(
            o ->
                new Candidate(
                    o.getId(),
                    o.getCreatedAt(),
                    keyOf(o.getWebsiteDomain(), o.getNormalizedName()),
                    policy ->
                        groupMerger.mergeOrganizations(
                            o.getNormalizedName(), o.getWebsiteDomain(), policy)))
        .toList();
  }

  private List<Candidate> locationSlice(@Nullable DedupCursor after, int size) {
    PageRequest page = PageRequest.of(0, size);
    List<Location> rows =
        after == null
            ? locationRepository.findAllByOrderByCreatedAtAscIdAsc(page)
            : locationRepository.findSliceAfter(after.createdAt(), after.id(), page);
    return rows.stream()
        .map(
            l ->
                new Candidate(
                    l.getId(),
                    l.getCreatedAt(),
                    keyOf(l.getOrganizationId(), l.getNormalizedName()),
                    policy ->
                        groupMerger.mergeLocations(
                            l.getOrganizationId(), l.getNormalizedName(), policy)))
        .toList();
  }

  private List<Candidate> campSlice(@Nullable DedupCursor after, int size) {
    PageRequest page = PageRequest.of(0, size);
    List<Camp> rows =
        after == null
            ? campRepository.findAllByOrderByCreatedAtAscIdAsc(page)
            : campRepository.findSliceAfter(after.createdAt(), after.id(), page);
    return rows.stream()
        .map(
            c ->
                new Candidate(
                    c.getId(),
                    c.getCreatedAt(),
                    keyOf(c.getOrganizationId(), c.getNormalizedName()),
                    policy ->
                        groupMerger.mergeCamps(c.getOrganizationId(), c.getNormalizedName(), policy)))
        .toList();
  }

  // a null organization or domain is a valid key part, which List.of rejects
  private static List<Object> keyOf(@Nullable Object scope, String normalizedName) {
    return Arrays.asList(scope, normalizedName);
  }

  private record Candidate(
      UUID id,
      Instant createdAt,
      List<Object> groupKey,
      Function<SurvivorPolicy, MergeOutcome> merge) {

    DedupCursor cursor() {
      return new DedupCursor(createdAt, id);
    }
  }

  private static final class BatchTally {

    int merged;
    int deleted;
    int repointed;
    int failedGroups;

    void apply(Candidate candidate, Supplier<MergeOutcome> merge) {
      try {
        MergeOutcome outcome = merge.get();
        if (outcome.merged()) {
          merged++;
        }
        deleted += outcome.deleted();
        repointed += outcome.repointed();
      } catch (RuntimeException e) {
        failedGroups++;
        log.error(
            "Merging the group of {} {} failed; continuing with the batch",
            candidate.id(),
            Objects.toString(candidate.groupKey()),
            e);
      }
    }
  }
}
