package dev.campfire.discovery;

import dev.campfire.alert.AlertService;
import dev.campfire.alert.AlertSeverity;
import dev.campfire.alert.AlertType;
import dev.campfire.catalog.CatalogWriter;
import dev.campfire.catalog.Organization;
import dev.campfire.catalog.UrlNormalizer;
import dev.campfire.error.NotFoundException;
import dev.campfire.source.NewSource;
import dev.campfire.source.Source;
import dev.campfire.source.SourceNotFoundException;
import dev.campfire.source.SourceRepository;
import dev.campfire.source.SourceService;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Queue of candidate provider websites between the search collaborator and the source catalog.
 *
 * <p>URLs arrive through {@link #recordDiscovery}, get an AI verdict through {@link #applyAnalysis}
 * and are then approved or rejected by an operator. Nothing is ever approved automatically. A URL
 * whose domain already belongs to a source ends as {@link DiscoveryStatus#DUPLICATE}.
 */
@Service
public class DiscoveryService {

  private static final Logger log = LoggerFactory.getLogger(DiscoveryService.class);

  static final int DEFAULT_QUEUE_LIMIT = 50;
  static final int MAX_QUEUE_LIMIT = 500;

  private final DiscoveredSourceRepository discoveryRepository;
  private final ScraperDevelopmentRequestRepository scraperRequestRepository;
  private final SourceRepository sourceRepository;
  private final SourceService sourceService;
  private final CatalogWriter catalogWriter;
  private final AlertService alertService;
  private final DiscoveryProperties properties;
  private final Clock clock;

  public DiscoveryService(
      DiscoveredSourceRepository discoveryRepository,
      ScraperDevelopmentRequestRepository scraperRequestRepository,
      SourceRepository sourceRepository,
      SourceService sourceService,
      CatalogWriter catalogWriter,
      AlertService alertService,
      DiscoveryProperties properties,
      Clock clock) {
    this.discoveryRepository = discoveryRepository;
    this.scraperRequestRepository = scraperRequestRepository;
    this.sourceRepository = sourceRepository;
    this.sourceService = sourceService;
    this.catalogWriter = catalogWriter;
    this.alertService = alertService;
    this.properties = properties;
    this.clock = clock;
  }

  /**
   * Records a discovered URL in {@code PENDING_ANALYSIS}. A URL already in the queue is not
   * recorded twice; the existing entry is returned.
   *
   * @throws IllegalArgumentException if the URL is not an http(s) URL
   */
  @Transactional
  public DiscoveredSource recordDiscovery(NewDiscovery discovery) {
    if (!UrlNormalizer.isHttpUrl(discovery.url())) {
      throw new IllegalArgumentException("Discovered URL must be an http(s) URL: " + discovery.url());
    }
    String url = UrlNormalizer.normalize(discovery.url());
    Optional<DiscoveredSource> existing = discoveryRepository.findByUrl(url);
    if (existing.isPresent()) {
      log.debug("URL {} already discovered as {}", url, existing.get().getId());
      return existing.get();
    }
    DiscoveredSource saved =
        discoveryRepository.save(
            new DiscoveredSource(
                url,
                UrlNormalizer.extractDomain(url),
                discovery.title(),
                discovery.snippet(),
                discovery.discoveryQuery(),
                discovery.cityId()));
    log.info("Discovered {} from query '{}'", url, discovery.discoveryQuery());
    return saved;
  }

  /**
   * Applies the analyser's verdict. The item becomes a duplicate when its domain already has a
   * source, is rejected when the page is not a camp site or the confidence is below {@code
   * campfire.discovery.min-confidence}, and otherwise waits for review.
   *
   * @throws IllegalArgumentException if the confidence is outside 0 to 1
   * @throws IllegalDiscoveryTransitionException if the item was already analysed or reviewed
   */
  @Transactional
  public DiscoveredSource applyAnalysis(UUID discoveryId, SiteAnalysis analysis) {
    if (analysis.confidence() < 0.0 || analysis.confidence() > 1.0) {
      throw new IllegalArgumentException(
          "confidence must be between 0 and 1, got: " + analysis.confidence());
    }
    DiscoveredSource discovered = getDiscovery(discoveryId);
    if (discovered.getStatus() != DiscoveryStatus.PENDING_ANALYSIS) {
      throw new IllegalDiscoveryTransitionException(
          discoveryId, discovered.getStatus(), DiscoveryStatus.PENDING_REVIEW);
    }
    discovered.recordAnalysis(analysis, clock.instant());

    Optional<Source> owner = existingSourceFor(discovered.getDomain());
    if (owner.isPresent()) {
      markDuplicateOf(discovered, owner.get().getId());
    } else if (!analysis.likelyCampSite() || analysis.confidence() < properties.getMinConfidence()) {
      discovered.moveTo(DiscoveryStatus.REJECTED);
      log.info(
          "Discovered source {} rejected by analysis (camp site: {}, confidence {})",
          discoveryId,
          analysis.likelyCampSite(),
          analysis.confidence());
    } else {
      discovered.moveTo(DiscoveryStatus.PENDING_REVIEW);
      alertService.raise(
          null,
          AlertType.NEW_SOURCES_PENDING,
          AlertSeverity.INFO,
          "New source %s awaits review (confidence %.2f)"
              .formatted(discovered.getUrl(), analysis.confidence()));
    }
    return discovered;
  }

  /**
   * Operator review. Approval creates the organization (when its domain is new) and the source,
   * then queues a scraper development request; approving a domain that already has a source marks
   * the item as a duplicate instead.
   *
   * @throws IllegalDiscoveryTransitionException unless the item is pending
   */
  @Transactional
  public DiscoveredSource reviewDiscoveredSource(
      UUID discoveryId, ReviewDecision decision, String reviewer, @Nullable String notes) {
    DiscoveredSource discovered = getDiscovery(discoveryId);
    DiscoveryStatus target =
        decision == ReviewDecision.APPROVED ? DiscoveryStatus.APPROVED : DiscoveryStatus.REJECTED;
    if (!discovered.getStatus().isPending()) {
      throw new IllegalDiscoveryTransitionException(discoveryId, discovered.getStatus(), target);
    }
    discovered.recordReview(reviewer, notes, clock.instant());

    if (decision == ReviewDecision.REJECTED) {
      discovered.moveTo(DiscoveryStatus.REJECTED);
      log.info("Discovered source {} rejected by {}", discoveryId, reviewer);
      return discovered;
    }

    Optional<Source> owner = existingSourceFor(discovered.getDomain());
    if (owner.isPresent()) {
      markDuplicateOf(discovered, owner.get().getId());
      return discovered;
    }

    discovered.moveTo(DiscoveryStatus.APPROVED);
    String name = displayName(discovered);
    Organization organization =
        catalogWriter.findOrCreateOrganization(name, discovered.getUrl(), discovered.getCityId());
    Source source =
        sourceService.createSource(
            NewSource.of(name, discovered.getUrl(), organization.getId(), discovered.getCityId()));
    discovered.linkSource(source.getId());
    discovered.moveTo(DiscoveryStatus.SCRAPER_GENERATED);

    scraperRequestRepository.save(
        new ScraperDevelopmentRequest(
            source.getId(),
            source.getName(),
            source.getUrl(),
            discovered.getCityId(),
            reviewer,
            suggestedApproach(discovered)));
    log.info(
        "Discovered source {} approved by {} as source {}", discoveryId, reviewer, source.getId());
    return discovered;
  }

  /**
   * Short-circuits a pending item to {@link DiscoveryStatus#DUPLICATE}.
   *
   * @param duplicateOfSourceId the source it duplicates, when known
   */
  @Transactional
  public DiscoveredSource markDuplicate(
      UUID discoveryId, String reviewer, @Nullable UUID duplicateOfSourceId) {
    DiscoveredSource discovered = getDiscovery(discoveryId);
    if (duplicateOfSourceId != null && !sourceRepository.existsById(duplicateOfSourceId)) {
      throw new SourceNotFoundException(duplicateOfSourceId);
    }
    discovered.recordReview(reviewer, null, clock.instant());
    markDuplicateOf(discovered, duplicateOfSourceId);
    return discovered;
  }

  /**
   * Lists the queue, newest first.
   *
   * @param status one status, or null for both pending states
   * @param cityId restrict to one city; null for all
   * @param limit maximum rows (1-500, default 50)
   */
  @Transactional(readOnly = true)
  public List<DiscoveredSource> listQueue(
      @Nullable DiscoveryStatus status, @Nullable UUID cityId, @Nullable Integer limit) {
    int max = limit == null ? DEFAULT_QUEUE_LIMIT : limit;
    if (max < 1 || max > MAX_QUEUE_LIMIT) {
      throw new IllegalArgumentException(
          "limit must be between 1 and %d, got: %d".formatted(MAX_QUEUE_LIMIT, max));
    }
    Set<DiscoveryStatus> statuses = status == null ? DiscoveryStatus.PENDING : Set.of(status);
    PageRequest page = PageRequest.of(0, max);
    return cityId == null
        ? discoveryRepository.findByStatusInOrderByCreatedAtDesc(statuses, page)
        : discoveryRepository.findByStatusInAndCityIdOrderByCreatedAtDesc(statuses, cityId, page);
  }

  @Transactional(readOnly = true)
  public DiscoveredSource getDiscovery(UUID discoveryId) {
    return discoveryRepository
        .findById(discoveryId)
        .orElseThrow(() -> new DiscoveryNotFoundException(discoveryId));
  }

  @Transactional(readOnly = true)
  public List<ScraperDevelopmentRequest> listScraperRequests(ScraperRequestStatus status) {
    return scraperRequestRepository.findByStatusOrderByCreatedAtAsc(status);
  }

  /** Progress report from the scraper-automation collaborator. */
  @Transactional
  public ScraperDevelopmentRequest updateScraperRequest(
      UUID requestId, ScraperRequestStatus status, @Nullable String notes) {
    ScraperDevelopmentRequest request =
        scraperRequestRepository
            .findById(requestId)
            .orElseThrow(() -> new NotFoundException("ScraperDevelopmentRequest", requestId));
    request.updateStatus(status, notes);
    log.info("Scraper request {} for {} is now {}", requestId, request.getSourceUrl(), status);
    return request;
  }

  private void markDuplicateOf(DiscoveredSource discovered, @Nullable UUID sourceId) {
    discovered.moveTo(DiscoveryStatus.DUPLICATE);
    discovered.markDuplicateOf(sourceId);
    log.info("Discovered source {} is a duplicate of source {}", discovered.getId(), sourceId);
  }

  private Optional<Source> existingSourceFor(@Nullable String domain) {
    if (domain == null) {
      return Optional.empty();
    }
    return sourceRepository.findByDomain(domain).stream().findFirst();
  }

  private static String displayName(DiscoveredSource discovered) {
    SiteAnalysis analysis = discovered.getAnalysis();
    if (analysis != null) {
      Optional<String> organizationName =
          analysis.organizationNames().stream()
              .filter(name -> !name.isBlank())
              .map(String::trim)
              .findFirst();
      if (organizationName.isPresent()) {
        return organizationName.get();
      }
    }
    if (discovered.getTitle() != null && !discovered.getTitle().isBlank()) {
      return discovered.getTitle().trim();
    }
    return discovered.getDomain();
  }

  private static @Nullable String suggestedApproach(DiscoveredSource discovered) {
    SiteAnalysis analysis = discovered.getAnalysis();
    return analysis != null ? analysis.suggestedApproach() : null;
  }
}
