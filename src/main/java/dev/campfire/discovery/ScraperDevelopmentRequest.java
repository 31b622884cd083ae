package dev.campfire.discovery;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

/**
 * Work item for the scraper-automation collaborator, queued when a discovered source is approved.
 *
 * <p>Maps to the {@code scraper_development_requests} table managed by Flyway migrations.
 */
@Entity
@Table(name = "scraper_development_requests")
public class ScraperDevelopmentRequest {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "source_id")
    private UUID sourceId;

    @Column(name = "source_name", nullable = false)
    private String sourceName;

    @Column(name = "source_url", nullable = false)
    private String sourceUrl;

    @Column(name = "city_id")
    private UUID cityId;

    @Column(name = "requested_by")
    private String requestedBy;

    private String notes;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ScraperRequestStatus status = ScraperRequestStatus.PENDING;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected ScraperDevelopmentRequest() {
        // JPA requires no-arg constructor
    }

    public ScraperDevelopmentRequest(
            UUID sourceId, String sourceName, String sourceUrl, UUID cityId, String requestedBy, String notes) {
        this.sourceId = sourceId;
        this.sourceName = sourceName;
        this.sourceUrl = sourceUrl;
        this.cityId = cityId;
        this.requestedBy = requestedBy;
        this.notes = notes;
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

    void updateStatus(ScraperRequestStatus status, String notes) {
        this.status = status;
        if (notes != null) {
            this.notes = notes;
        }
    }

    public UUID getId() {
        return id;
    }

    public UUID getSourceId() {
        return sourceId;
    }

    public String getSourceName() {
        return sourceName;
    }

    public String getSourceUrl() {
        return sourceUrl;
    }

    public UUID getCityId() {
        return cityId;
    }

    public String getRequestedBy() {
        return requestedBy;
    }

    public String getNotes() {
        return notes;
    }

    public ScraperRequestStatus getStatus() {
        return status;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
