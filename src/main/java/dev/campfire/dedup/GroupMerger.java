package dev.campfire.dedup;

import dev.campfire.catalog.Camp;
import dev.campfire.catalog.CampRepository;
import dev.campfire.catalog.CampSessionRepository;
import dev.campfire.catalog.Location;
import dev.campfire.catalog.LocationRepository;
import dev.campfire.catalog.Organization;
import dev.campfire.catalog.OrganizationRepository;
import dev.campfire.source.SourceRepository;
import java.util.List;
import java.util.UUID;
import java.util.function.ToLongFunction;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Merges one duplicate group per call, each in its own transaction.
 *
 * <p>The group is re-read inside the transaction, so a group already merged by an earlier batch is
 * a no-op. For every donor, all foreign references are moved onto the survivor before the donor is
 * deleted; a failure rolls back that group only.
 */
@Component
public class GroupMerger {

  private static final Logger log = LoggerFactory.getLogger(GroupMerger.class);

  private final OrganizationRepository organizationRepository;
  private final LocationRepository locationRepository;
  private final CampRepository campRepository;
  private final CampSessionRepository sessionRepository;
  private final SourceRepository sourceRepository;

  public GroupMerger(
      OrganizationRepository organizationRepository,
      LocationRepository locationRepository,
      CampRepository campRepository,
      CampSessionRepository sessionRepository,
      SourceRepository sourceRepository) {
    this.organizationRepository = organizationRepository;
    this.locationRepository = locationRepository;
    this.campRepository = campRepository;
    this.sessionRepository = sessionRepository;
    this.sourceRepository = sourceRepository;
  }

  @Transactional(propagation = Propagation.REQUIRES_NEW)
  public MergeOutcome mergeOrganizations(
      String normalizedName, @Nullable String websiteDomain, SurvivorPolicy policy) {
    List<Organization> group =
        websiteDomain != null
            ? organizationRepository.findByNormalizedNameAndWebsiteDomainOrderByCreatedAtAscIdAsc(
                normalizedName, websiteDomain)
            : organizationRepository
                .findByNormalizedNameAndWebsiteDomainIsNullOrderByCreatedAtAscIdAsc(normalizedName);
    if (group.size() < 2) {
      return MergeOutcome.NONE;
    }
    Organization survivor = chooseSurvivor(group, policy, this::organizationReferences);
    int repointed = 0;
    int deleted = 0;
    for (Organization donor : group) {
      if (donor == survivor) {
        continue;
      }
      UUID from = donor.getId();
      UUID to = survivor.getId();
      repointed += sourceRepository.reassignOrganization(from, to);
      repointed += sessionRepository.reassignOrganization(from, to);
      repointed += campRepository.reassignOrganization(from, to);
      repointed += locationRepository.reassignOrganization(from, to);
      survivor.absorb(donor);
      organizationRepository.delete(donor);
      deleted++;
    }
    log.info(
        "Merged {} organization(s) into {} ('{}'), {} reference(s) moved",
        deleted,
        survivor.getId(),
        survivor.getName(),
        repointed);
    return new MergeOutcome(deleted, repointed);
  }

  @Transactional(propagation = Propagation.REQUIRES_NEW)
  public MergeOutcome mergeLocations(
      @Nullable UUID organizationId, String normalizedName, SurvivorPolicy policy) {
    List<Location> group =
        organizationId != null
            ? locationRepository.findByOrganizationIdAndNormalizedNameOrderByCreatedAtAscIdAsc(
                organizationId, normalizedName)
            : locationRepository.findByOrganizationIdIsNullAndNormalizedNameOrderByCreatedAtAscIdAsc(
                normalizedName);
    if (group.size() < 2) {
      return MergeOutcome.NONE;
    }
    Location survivor =
        chooseSurvivor(group, policy, l -> sessionRepository.countByLocationId(l.getId()));
    int repointed = 0;
    int deleted = 0;
    for (Location donor : group) {
      if (donor == survivor) {
        continue;
      }
      repointed += sessionRepository.reassignLocation(donor.getId(), survivor.getId());
      locationRepository.delete(donor);
      deleted++;
    }
    log.info(
        "Merged {} location(s) into {} ('{}'), {} session(s) moved",
        deleted,
        survivor.getId(),
        survivor.getName(),
        repointed);
    return new MergeOutcome(deleted, repointed);
  }

  @Transactional(propagation = Propagation.REQUIRES_NEW)
  public MergeOutcome mergeCamps(
      @Nullable UUID organizationId, String normalizedName, SurvivorPolicy policy) {
    List<Camp> group =
        organizationId != null
            ? campRepository.findByOrganizationIdAndNormalizedNameOrderByCreatedAtAscIdAsc(
                organizationId, normalizedName)
            : campRepository.findByOrganizationIdIsNullAndNormalizedNameOrderByCreatedAtAscIdAsc(
                normalizedName);
    if (group.size() < 2) {
      return MergeOutcome.NONE;
    }
    Camp survivor = chooseSurvivor(group, policy, c -> sessionRepository.countByCampId(c.getId()));
    int repointed = 0;
    int deleted = 0;
    for (Camp donor : group) {
      if (donor == survivor) {
        continue;
      }
      repointed += sessionRepository.reassignCamp(donor.getId(), survivor.getId());
      survivor.absorb(donor);
      campRepository.delete(donor);
      deleted++;
    }
    log.info(
        "Merged {} camp(s) into {} ('{}'), {} session(s) moved",
        deleted,
        survivor.getId(),
        survivor.getName(),
        repointed);
    return new MergeOutcome(deleted, repointed);
  }

  /**
   * Deletes up to {@code limit} unreferenced locations with a missing or TBD street, or with
   * coordinates inside the placeholder box.
   *
   * @return the number of locations deleted
   */
  @Transactional(propagation = Propagation.REQUIRES_NEW)
  public int purgeBadLocations(double latitude, double longitude, double tolerance, int limit) {
    List<Location> bad =
        locationRepository.findUnreferencedBadLocations(
            latitude - tolerance,
            latitude + tolerance,
            longitude - tolerance,
            longitude + tolerance,
            PageRequest.of(0, limit));
    locationRepository.deleteAll(bad);
    if (!bad.isEmpty()) {
      log.info("Purged {} placeholder location(s)", bad.size());
    }
    return bad.size();
  }

  /**
   * Picks the survivor of a group sorted by creation order. With {@link
   * SurvivorPolicy#MOST_REFERENCED} the first record with the highest reference count wins.
   */
  static <T> T chooseSurvivor(List<T> group, SurvivorPolicy policy, ToLongFunction<T> references) {
    T survivor = group.get(0);
    if (policy == SurvivorPolicy.FIRST_CREATED) {
      return survivor;
    }
    long best = references.applyAsLong(survivor);
    for (T candidate : group.subList(1, group.size())) {
      long count = references.applyAsLong(candidate);
      if (count > best) {
        best = count;
        survivor = candidate;
      }
    }
    return survivor;
  }

  private long organizationReferences(Organization organization) {
    UUID id = organization.getId();
    return sourceRepository.countByOrganizationId(id)
        + sessionRepository.countByOrganizationId(id)
        + campRepository.countByOrganizationId(id)
        + locationRepository.countByOrganizationId(id);
  }
}
