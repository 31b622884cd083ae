package dev.campfire.catalog;

import dev.campfire.validation.DateRange;
import dev.campfire.validation.ExtractedRecord;
import dev.campfire.validation.Validation;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Writes validated extraction records into the catalog with merge-on-write semantics.
 *
 * <p>A record updates an existing session of the same source when the start dates are equal and the
 * names are {@linkplain NameSimilarity#matches similar}; otherwise a new session is inserted. Camps
 * and locations are found by their deduplication keys before new ones are created, so repeated runs
 * do not grow the catalog.
 *
 * <p>All writes join the caller's transaction.
 */
@Service
public class CatalogWriter {

  private static final Logger log = LoggerFactory.getLogger(CatalogWriter.class);

  private final CampSessionRepository sessionRepository;
  private final CampRepository campRepository;
  private final LocationRepository locationRepository;
  private final OrganizationRepository organizationRepository;

  public CatalogWriter(
      CampSessionRepository sessionRepository,
      CampRepository campRepository,
      LocationRepository locationRepository,
      OrganizationRepository organizationRepository) {
    this.sessionRepository = sessionRepository;
    this.campRepository = campRepository;
    this.locationRepository = locationRepository;
    this.organizationRepository = organizationRepository;
  }

  @Transactional
  public UpsertOutcome upsertSession(
      SessionTarget target, ExtractedRecord record, Validation validation, Instant scrapedAt) {
    String name = validation.normalized().name();
    Optional<CampSession> existing = findMatch(target.sourceId(), name, validation);

    CampSession session =
        existing.orElseGet(() -> new CampSession(target.sourceId(), target.organizationId()));
    session.apply(validation, scrapedAt);

    if (target.organizationId() != null) {
      String campName = record.campName() != null && !record.campName().isBlank()
          ? record.campName()
          : name;
      if (!campName.isBlank()) {
        Camp camp = findOrCreateCamp(target.organizationId(), campName, record.imageUrls());
        session.setCampId(camp.getId());
      }
      Location location = resolveLocation(target, record.venue());
      if (location != null) {
        session.setLocationId(location.getId());
      }
    }

    sessionRepository.save(session);
    return existing.isPresent() ? UpsertOutcome.UPDATED : UpsertOutcome.CREATED;
  }

  /**
   * Finds the organization that owns a website domain, or creates one with a unique slug.
   *
   * @param name display name for a new organization
   * @param website provider website
   * @param cityId city the organization is known to serve, may be null
   */
  @Transactional
  public Organization findOrCreateOrganization(
      String name, String website, @Nullable UUID cityId) {
    String domain = UrlNormalizer.extractDomain(website);
    if (domain != null) {
      List<Organization> owners =
          organizationRepository.findByWebsiteDomainOrderByCreatedAtAscIdAsc(domain);
      if (!owners.isEmpty()) {
        Organization owner = owners.get(0);
        owner.addCity(cityId);
        return owner;
      }
    }
    Organization organization = new Organization(name, uniqueSlug(name), website);
    organization.addCity(cityId);
    Organization saved = organizationRepository.save(organization);
    log.info("Created organization '{}' ({}) for domain {}", name, saved.getId(), domain);
    return saved;
  }

  private Optional<CampSession> findMatch(UUID sourceId, String name, Validation validation) {
    DateRange dates = validation.normalized().dates();
    List<CampSession> candidates =
        dates != null
            ? sessionRepository.findBySourceIdAndStartDate(sourceId, dates.start())
            : sessionRepository.findBySourceIdAndStartDateIsNull(sourceId);
    return candidates.stream()
        .filter(candidate -> NameSimilarity.matches(candidate.getName(), name))
        .findFirst();
  }

  private Camp findOrCreateCamp(UUID organizationId, String campName, List<String> imageUrls) {
    List<Camp> camps =
        campRepository.findByOrganizationIdAndNormalizedNameOrderByCreatedAtAscIdAsc(
            organizationId, NameNormalizer.normalize(campName));
    if (!camps.isEmpty()) {
      Camp camp = camps.get(0);
      if (camp.getImageUrls().isEmpty() && !imageUrls.isEmpty()) {
        camp.setImageUrls(imageUrls);
      }
      return camp;
    }
    Camp camp = new Camp(organizationId, campName.trim());
    camp.setImageUrls(imageUrls);
    return campRepository.save(camp);
  }

  private @Nullable Location resolveLocation(
      SessionTarget target, ExtractedRecord.@Nullable Venue venue) {
    if (venue == null || venue.name() == null || venue.name().isBlank()) {
      return null;
    }
    List<Location> locations =
        locationRepository.findByOrganizationIdAndNormalizedNameOrderByCreatedAtAscIdAsc(
            target.organizationId(), NameNormalizer.normalize(venue.name()));
    if (!locations.isEmpty()) {
      return locations.get(0);
    }
    Location location =
        new Location(
            target.organizationId(),
            target.cityId(),
            venue.name().trim(),
            new Address(venue.street(), venue.city(), venue.state(), venue.zip()));
    if (venue.latitude() != null && venue.longitude() != null) {
      location.setCoordinates(venue.latitude(), venue.longitude());
    }
    return locationRepository.save(location);
  }

  private String uniqueSlug(String name) {
    String base = NameNormalizer.slugify(name);
    String slug = base;
    int suffix = 2;
    while (organizationRepository.existsBySlug(slug)) {
      slug = base + "-" + suffix++;
    }
    return slug;
  }
}
