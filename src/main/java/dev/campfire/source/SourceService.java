package dev.campfire.source;

import dev.campfire.catalog.CampSessionRepository;
import dev.campfire.catalog.UrlNormalizer;
import dev.campfire.error.ConflictException;
import dev.campfire.validation.SessionStatus;
import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Operator-facing source management: listing with health filters, health snapshots, creation,
 * deletion and the manual actions on the health state.
 */
@Service
public class SourceService {

  private static final Logger log = LoggerFactory.getLogger(SourceService.class);

  static final int DEFAULT_LIMIT = 50;
  static final int MAX_LIMIT = 500;

  private static final Sort BY_NAME = Sort.by(Sort.Order.asc("name").ignoreCase());

  private final SourceRepository sourceRepository;
  private final CampSessionRepository sessionRepository;
  private final Clock clock;

  public SourceService(
      SourceRepository sourceRepository, CampSessionRepository sessionRepository, Clock clock) {
    this.sourceRepository = sourceRepository;
    this.sessionRepository = sessionRepository;
    this.clock = clock;
  }

  /**
   * Lists sources matching a filter, ordered by name, along with the size of every filter.
   *
   * @param filter which sources to return
   * @param cityId restrict both the list and the counts to one city; null for all cities
   * @param limit maximum rows to return (1-500, default 50)
   */
  @Transactional(readOnly = true)
  public SourceListing listSourcesFiltered(
      SourceFilter filter, @Nullable UUID cityId, @Nullable Integer limit) {
    int max = limit == null ? DEFAULT_LIMIT : limit;
    if (max < 1 || max > MAX_LIMIT) {
      throw new IllegalArgumentException(
          "limit must be between 1 and %d, got: %d".formatted(MAX_LIMIT, max));
    }

    Specification<Source> scope = SourceSpecs.inCity(cityId);
    Map<SourceFilter, Long> counts = new EnumMap<>(SourceFilter.class);
    for (SourceFilter candidate : SourceFilter.values()) {
      counts.put(candidate, sourceRepository.count(scope.and(SourceSpecs.matching(candidate))));
    }

    List<Source> sources =
        sourceRepository
            .findAll(scope.and(SourceSpecs.matching(filter)), PageRequest.of(0, max, BY_NAME))
            .getContent();
    Set<UUID> withActiveSessions = sourcesWithActiveSessions(sources);
    List<SourceSummary> page =
        sources.stream()
            .map(s -> SourceSummary.of(s, withActiveSessions.contains(s.getId())))
            .toList();
    return new SourceListing(page, counts);
  }

  @Transactional(readOnly = true)
  public SourceHealthView getSourceHealth(UUID sourceId) {
    return SourceHealthView.of(getSource(sourceId));
  }

  @Transactional(readOnly = true)
  public Source getSource(UUID sourceId) {
    return sourceRepository
        .findById(sourceId)
        .orElseThrow(() -> new SourceNotFoundException(sourceId));
  }

  /**
   * Creates a source from a URL. The URL is normalized before the uniqueness check, so {@code
   * https://Example.com/camps/} and {@code https://example.com/camps} are the same source.
   *
   * @throws IllegalArgumentException if the URL is not an http(s) URL or the name is blank
   * @throws ConflictException if a source already exists for the URL
   */
  @Transactional
  public Source createSource(NewSource request) {
    if (request.name() == null || request.name().isBlank()) {
      throw new IllegalArgumentException("Source name must not be empty");
    }
    if (!UrlNormalizer.isHttpUrl(request.url())) {
      throw new IllegalArgumentException("Source URL must be an http(s) URL: " + request.url());
    }
    if (request.scrapeFrequencyHours() != null && request.scrapeFrequencyHours() < 1) {
      throw new IllegalArgumentException("scrapeFrequencyHours must be >= 1");
    }
    String url = UrlNormalizer.normalize(request.url());
    sourceRepository
        .findByUrl(url)
        .ifPresent(
            existing -> {
              throw new ConflictException(
                  "Source %s already exists for %s".formatted(existing.getId(), url));
            });

    Source source = new Source(request.name().trim(), url, UrlNormalizer.extractDomain(url));
    source.setAdditionalUrls(request.additionalUrls());
    source.setOrganizationId(request.organizationId());
    source.setCityId(request.cityId());
    if (request.scrapeFrequencyHours() != null) {
      source.setScrapeFrequencyHours(request.scrapeFrequencyHours());
    }
    source.setExtractionTimeoutSeconds(request.extractionTimeoutSeconds());
    if (request.parsingNotes() != null) {
      source.setParsingNotes(request.parsingNotes(), clock.instant());
    }
    Source saved = sourceRepository.save(source);
    log.info("Created source '{}' ({}) for {}", saved.getName(), saved.getId(), url);
    return saved;
  }

  /**
   * Deletes a source. Its sessions are kept with the source reference cleared, unless {@code
   * cascade} is set, in which case they are deleted too. Jobs and alerts keep their rows.
   *
   * @throws SourceBusyException if a job is running for the source
   */
  @Transactional
  public SourceDeletion deleteSource(UUID sourceId, boolean cascade) {
    Source source = getSource(sourceId);
    if (source.isRunning()) {
      throw new SourceBusyException(sourceId, "delete");
    }
    int unlinked = 0;
    int deleted = 0;
    if (cascade) {
      deleted = sessionRepository.deleteBySourceIdInBulk(sourceId);
    } else {
      unlinked = sessionRepository.unlinkSource(sourceId);
    }
    if (sourceRepository.deleteIfIdle(sourceId) == 0) {
      throw new SourceBusyException(sourceId, "delete");
    }
    log.info(
        "Deleted source {} ({} sessions unlinked, {} sessions deleted)",
        sourceId,
        unlinked,
        deleted);
    return new SourceDeletion(sourceId, unlinked, deleted);
  }

  /** Asks the scheduler to run the source at its next pass, regardless of its schedule. */
  @Transactional
  public Source flagForRescan(UUID sourceId, String reason) {
    Source source = getSource(sourceId);
    source.requestRescan(reason, clock.instant());
    log.info("Source {} flagged for rescan: {}", sourceId, reason);
    return source;
  }

  /**
   * Clears the sticky regeneration flag once the extractor has been fixed. This is the only way the
   * flag is ever reset.
   */
  @Transactional
  public Source clearRegenerationFlag(UUID sourceId, String actor) {
    Source source = getSource(sourceId);
    source.getHealth().clearRegeneration();
    source.scheduleNextAttempt(clock.instant());
    log.info("Regeneration flag cleared on source {} by {}", sourceId, actor);
    return source;
  }

  /** Re-activates a disabled source and resets its failure streaks. */
  @Transactional
  public Source reEnable(UUID sourceId, String actor) {
    Source source = getSource(sourceId);
    source.reopen();
    source.scheduleNextAttempt(clock.instant());
    log.info("Source {} re-enabled by {}", sourceId, actor);
    return source;
  }

  @Transactional
  public Source updateParsingNotes(UUID sourceId, String notes) {
    Source source = getSource(sourceId);
    source.setParsingNotes(notes, clock.instant());
    return source;
  }

  private Set<UUID> sourcesWithActiveSessions(List<Source> sources) {
    if (sources.isEmpty()) {
      return Set.of();
    }
    List<UUID> ids = sources.stream().map(Source::getId).toList();
    return new HashSet<>(sessionRepository.findSourceIdsWithStatus(ids, SessionStatus.ACTIVE));
  }
}
