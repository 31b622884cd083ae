package dev.campfire.discovery;

import jakarta.persistence.Column;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.Version;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

/**
 * A candidate provider website found by search, waiting to be analysed and reviewed.
 *
 * <p>Status changes go through {@link #moveTo}, which enforces {@link
 * DiscoveryStatus#canTransitionTo}. Maps to the {@code discovered_sources} table managed by Flyway
 * migrations.
 */
@Entity
@Table(name = "discovered_sources")
public class DiscoveredSource {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, unique = true)
    private String url;

    @Column(nullable = false)
    private String domain;

    private String title;

    private String snippet;

    @Column(name = "discovery_query")
    private String discoveryQuery;

    @Column(name = "city_id")
    private UUID cityId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private DiscoveryStatus status = DiscoveryStatus.PENDING_ANALYSIS;

    @Embedded
    private SiteAnalysis analysis;

    @Column(name = "analyzed_at")
    private Instant analyzedAt;

    @Column(name = "reviewed_by")
    private String reviewedBy;

    @Column(name = "reviewed_at")
    private Instant reviewedAt;

    @Column(name = "review_notes")
    private String reviewNotes;

    @Column(name = "source_id")
    private UUID sourceId;

    @Column(name = "duplicate_of_source_id")
    private UUID duplicateOfSourceId;

    @Version
    private long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected DiscoveredSource() {
        // JPA requires no-arg constructor
    }

    public DiscoveredSource(
            String url, String domain, String title, String snippet, String discoveryQuery, UUID cityId) {
        this.url = url;
        this.domain = domain;
        this.title = title;
        this.snippet = snippet;
        this.discoveryQuery = discoveryQuery;
        this.cityId = cityId;
    }

    @PrePersist
    protected void onCreate() {
        this.createdAt = Instant.now().truncatedTo(ChronoUnit.MICROS);
    }

    void moveTo(DiscoveryStatus target) {
        if (!status.canTransitionTo(target)) {
            throw new IllegalDiscoveryTransitionException(id, status, target);
        }
        this.status = target;
    }

    void recordAnalysis(SiteAnalysis analysis, Instant at) {
        this.analysis = analysis;
        this.analyzedAt = at;
    }

    void recordReview(String reviewer, String notes, Instant at) {
        this.reviewedBy = reviewer;
        this.reviewNotes = notes;
        this.reviewedAt = at;
    }

    void linkSource(UUID sourceId) {
        this.sourceId = sourceId;
    }

    void markDuplicateOf(UUID sourceId) {
        this.duplicateOfSourceId = sourceId;
    }

    public UUID getId() {
        return id;
    }

    public String getUrl() {
        return url;
    }

    public String getDomain() {
        return domain;
    }

    public String getTitle() {
        return title;
    }

    public String getSnippet() {
        return snippet;
    }

    public String getDiscoveryQuery() {
        return discoveryQuery;
    }

    public UUID getCityId() {
        return cityId;
    }

    public DiscoveryStatus getStatus() {
        return status;
    }

    public SiteAnalysis getAnalysis() {
        return analysis;
    }

    public Instant getAnalyzedAt() {
        return analyzedAt;
    }

    public String getReviewedBy() {
        return reviewedBy;
    }

    public Instant getReviewedAt() {
        return reviewedAt;
    }

    public String getReviewNotes() {
        return reviewNotes;
    }

    public UUID getSourceId() {
        return sourceId;
    }

    public UUID getDuplicateOfSourceId() {
        return duplicateOfSourceId;
    }

    public long getVersion() {
        return version;
    }

    /** When the URL was first recorded. */
    public Instant getCreatedAt() {
        return createdAt;
    }
}
