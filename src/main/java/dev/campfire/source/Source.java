package dev.campfire.source;

import dev.campfire.validation.QualityTier;
import dev.campfire.validation.SourceQuality;
import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import org.hibernate.annotations.DynamicUpdate;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * A managed website from which camp sessions are extracted.
 *
 * <p>Each source tracks its canonical URL, the provider domain derived from it, extra pages to visit,
 * scheduling state and an embedded {@link Health} snapshot updated by every terminal job.
 *
 * <p>{@code runningJobId} is the per-source lease: it is only ever set through the compare-and-swap
 * in {@link SourceRepository#claimLease} and cleared through {@link SourceRepository#releaseLease},
 * never through this entity. Updates are dynamic so that writing health counters does not
 * overwrite a lease taken by another transaction.
 *
 * <p>Maps to the {@code sources} table managed by Flyway migrations.
 *
 * @see Health
 * @see SourceRepository
 */
@Entity
@Table(name = "sources")
@DynamicUpdate
public class Source {

    static final int DEFAULT_SCRAPE_FREQUENCY_HOURS = 24;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false, unique = true)
    private String url;

    @Column(nullable = false)
    private String domain;

    @ElementCollection
    @CollectionTable(name = "source_additional_urls", joinColumns = @JoinColumn(name = "source_id"))
    @OrderColumn(name = "position")
    private List<AdditionalUrl> additionalUrls = new ArrayList<>();

    @Column(nullable = false)
    private boolean active = true;

    @Column(name = "organization_id")
    private UUID organizationId;

    @Column(name = "city_id")
    private UUID cityId;

    @Column(name = "parsing_notes")
    private String parsingNotes;

    @Column(name = "parsing_notes_updated_at")
    private Instant parsingNotesUpdatedAt;

    @Column(name = "needs_rescan", nullable = false)
    private boolean needsRescan;

    @Column(name = "rescan_reason")
    private String rescanReason;

    @Column(name = "rescan_requested_at")
    private Instant rescanRequestedAt;

    @Column(name = "scrape_frequency_hours", nullable = false)
    private int scrapeFrequencyHours = DEFAULT_SCRAPE_FREQUENCY_HOURS;

    @Column(name = "extraction_timeout_seconds")
    private Integer extractionTimeoutSeconds;

    @Column(name = "last_scraped_at")
    private Instant lastScrapedAt;

    @Column(name = "next_scheduled_scrape_at")
    private Instant nextScheduledScrapeAt;

    @Column(name = "closure_reason")
    private String closureReason;

    @Column(name = "closed_at")
    private Instant closedAt;

    @Column(name = "closed_by")
    private String closedBy;

    @Column(name = "data_quality_score")
    private Integer dataQualityScore;

    @Enumerated(EnumType.STRING)
    @Column(name = "quality_tier")
    private QualityTier qualityTier;

    @Embedded
    private Health health = new Health();

    @Column(name = "running_job_id", insertable = false, updatable = false)
    private UUID runningJobId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected Source() {
        // JPA requires no-arg constructor
    }

    /**
     * Creates an active source with empty health, due for its first scrape immediately.
     *
     * @param name   a human-readable label for this source
     * @param url    the canonical URL (must be unique)
     * @param domain the provider domain derived from {@code url}
     */
    public Source(String name, String url, String domain) {
        this.name = name;
        this.url = url;
        this.domain = domain;
    }

    @PrePersist
    protected void onCreate() {
        this.createdAt = Instant.now().truncatedTo(ChronoUnit.MICROS);
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = Instant.now().truncatedTo(ChronoUnit.MICROS);
    }

    /** Marks a successful run: clears any rescan request and schedules the next regular scrape. */
    void markScraped(Instant at) {
        this.lastScrapedAt = at;
        this.needsRescan = false;
        this.rescanReason = null;
        this.rescanRequestedAt = null;
        this.nextScheduledScrapeAt = at.plus(Duration.ofHours(scrapeFrequencyHours));
    }

    void scheduleNextAttempt(Instant at) {
        this.nextScheduledScrapeAt = at;
    }

    void requestRescan(String reason, Instant at) {
        this.needsRescan = true;
        this.rescanReason = reason;
        this.rescanRequestedAt = at;
    }

    void close(String reason, String actor, Instant at) {
        this.active = false;
        this.closureReason = reason;
        this.closedBy = actor;
        this.closedAt = at;
    }

    void reopen() {
        this.active = true;
        this.closureReason = null;
        this.closedBy = null;
        this.closedAt = null;
        this.health.resetStreaks();
    }

    public void recordQuality(SourceQuality quality) {
        this.dataQualityScore = quality.score();
        this.qualityTier = quality.tier();
    }

    public boolean isRunning() {
        return runningJobId != null;
    }

    public UUID getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getUrl() {
        return url;
    }

    public String getDomain() {
        return domain;
    }

    public List<AdditionalUrl> getAdditionalUrls() {
        return additionalUrls;
    }

    public void setAdditionalUrls(List<AdditionalUrl> additionalUrls) {
        this.additionalUrls = new ArrayList<>(additionalUrls);
    }

    public boolean isActive() {
        return active;
    }

    public UUID getOrganizationId() {
        return organizationId;
    }

    public void setOrganizationId(UUID organizationId) {
        this.organizationId = organizationId;
    }

    public UUID getCityId() {
        return cityId;
    }

    public void setCityId(UUID cityId) {
        this.cityId = cityId;
    }

    public String getParsingNotes() {
        return parsingNotes;
    }

    public void setParsingNotes(String parsingNotes, Instant at) {
        this.parsingNotes = parsingNotes;
        this.parsingNotesUpdatedAt = at;
    }

    public Instant getParsingNotesUpdatedAt() {
        return parsingNotesUpdatedAt;
    }

    public boolean isNeedsRescan() {
        return needsRescan;
    }

    public String getRescanReason() {
        return rescanReason;
    }

    public Instant getRescanRequestedAt() {
        return rescanRequestedAt;
    }

    public int getScrapeFrequencyHours() {
        return scrapeFrequencyHours;
    }

    public void setScrapeFrequencyHours(int scrapeFrequencyHours) {
        this.scrapeFrequencyHours = scrapeFrequencyHours;
    }

    public Integer getExtractionTimeoutSeconds() {
        return extractionTimeoutSeconds;
    }

    public void setExtractionTimeoutSeconds(Integer extractionTimeoutSeconds) {
        this.extractionTimeoutSeconds = extractionTimeoutSeconds;
    }

    public Instant getLastScrapedAt() {
        return lastScrapedAt;
    }

    public Instant getNextScheduledScrapeAt() {
        return nextScheduledScrapeAt;
    }

    public String getClosureReason() {
        return closureReason;
    }

    public Instant getClosedAt() {
        return closedAt;
    }

    public String getClosedBy() {
        return closedBy;
    }

    public Integer getDataQualityScore() {
        return dataQualityScore;
    }

    public QualityTier getQualityTier() {
        return qualityTier;
    }

    public Health getHealth() {
        return health;
    }

    public UUID getRunningJobId() {
        return runningJobId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
