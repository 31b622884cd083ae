package dev.campfire.catalog;

import dev.campfire.validation.AgeGradeRange;
import dev.campfire.validation.DateRange;
import dev.campfire.validation.NormalizedSession;
import dev.campfire.validation.SessionStatus;
import dev.campfire.validation.TimeWindow;
import dev.campfire.validation.Validation;
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
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * A dated, bookable session in the catalog, written from a validated extraction record.
 *
 * <p>Sessions keep the raw texts they were parsed from next to the parsed values so that a
 * low-completeness session can be fixed by hand. {@code sourceId} is nulled, not cascaded, when
 * the source is deleted.
 *
 * <p>Maps to the {@code camp_sessions} table managed by Flyway migrations.
 */
@Entity
@Table(name = "camp_sessions")
public class CampSession {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "source_id")
    private UUID sourceId;

    @Column(name = "organization_id")
    private UUID organizationId;

    @Column(name = "camp_id")
    private UUID campId;

    @Column(name = "location_id")
    private UUID locationId;

    @Column(nullable = false)
    private String name;

    @Column(name = "start_date")
    private LocalDate startDate;

    @Column(name = "end_date")
    private LocalDate endDate;

    @Column(name = "date_raw")
    private String dateRaw;

    @Column(name = "drop_off_hour")
    private Integer dropOffHour;

    @Column(name = "drop_off_minute")
    private Integer dropOffMinute;

    @Column(name = "pick_up_hour")
    private Integer pickUpHour;

    @Column(name = "pick_up_minute")
    private Integer pickUpMinute;

    @Column(name = "time_raw")
    private String timeRaw;

    @Column(name = "price_cents")
    private Integer priceInCents;

    @Column(name = "price_raw")
    private String priceRaw;

    @Column(name = "min_age")
    private Integer minAge;

    @Column(name = "max_age")
    private Integer maxAge;

    @Column(name = "min_grade")
    private Integer minGrade;

    @Column(name = "max_grade")
    private Integer maxGrade;

    @Column(name = "age_grade_raw")
    private String ageGradeRaw;

    @Column(name = "location_text")
    private String locationText;

    @Column(name = "registration_url")
    private String registrationUrl;

    @Column(name = "completeness_score", nullable = false)
    private int completenessScore;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "missing_fields", nullable = false)
    private List<String> missingFields = new ArrayList<>();

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private SessionStatus status = SessionStatus.PENDING_REVIEW;

    @Column(name = "last_scraped_at")
    private Instant lastScrapedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected CampSession() {
        // JPA requires no-arg constructor
    }

    public CampSession(UUID sourceId, UUID organizationId) {
        this.sourceId = sourceId;
        this.organizationId = organizationId;
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

    /**
     * Overwrites the extracted fields with a fresh validation. Values the new extraction could not
     * resolve are cleared rather than kept, so the session always reflects the latest run.
     */
    public void apply(Validation validation, Instant scrapedAt) {
        NormalizedSession normalized = validation.normalized();
        this.name = normalized.name();

        DateRange dates = normalized.dates();
        this.startDate = dates != null ? dates.start() : null;
        this.endDate = dates != null ? dates.end() : null;
        this.dateRaw = normalized.dateRaw();

        TimeWindow window = normalized.timeWindow();
        this.dropOffHour = window != null ? window.dropOffHour() : null;
        this.dropOffMinute = window != null ? window.dropOffMinute() : null;
        this.pickUpHour = window != null ? window.pickUpHour() : null;
        this.pickUpMinute = window != null ? window.pickUpMinute() : null;
        this.timeRaw = normalized.timeRaw();

        this.priceInCents = normalized.priceInCents();
        this.priceRaw = normalized.priceRaw();

        AgeGradeRange ageGrade = normalized.ageGrade();
        this.minAge = ageGrade.minAge();
        this.maxAge = ageGrade.maxAge();
        this.minGrade = ageGrade.minGrade();
        this.maxGrade = ageGrade.maxGrade();
        this.ageGradeRaw = normalized.ageGradeRaw();

        this.locationText = normalized.location();
        this.registrationUrl = normalized.registrationUrl();
        this.completenessScore = validation.completenessScore();
        this.missingFields = new ArrayList<>(validation.missingFields());
        this.status = validation.status();
        this.lastScrapedAt = scrapedAt;
    }

    public UUID getId() {
        return id;
    }

    public UUID getSourceId() {
        return sourceId;
    }

    public UUID getOrganizationId() {
        return organizationId;
    }

    public UUID getCampId() {
        return campId;
    }

    public void setCampId(UUID campId) {
        this.campId = campId;
    }

    public UUID getLocationId() {
        return locationId;
    }

    public void setLocationId(UUID locationId) {
        this.locationId = locationId;
    }

    public String getName() {
        return name;
    }

    public LocalDate getStartDate() {
        return startDate;
    }

    public LocalDate getEndDate() {
        return endDate;
    }

    public Integer getDropOffHour() {
        return dropOffHour;
    }

    public Integer getPickUpHour() {
        return pickUpHour;
    }

    public Integer getPriceInCents() {
        return priceInCents;
    }

    public Integer getMinAge() {
        return minAge;
    }

    public Integer getMaxAge() {
        return maxAge;
    }

    public Integer getMinGrade() {
        return minGrade;
    }

    public Integer getMaxGrade() {
        return maxGrade;
    }

    public String getLocationText() {
        return locationText;
    }

    public String getRegistrationUrl() {
        return registrationUrl;
    }

    public int getCompletenessScore() {
        return completenessScore;
    }

    public List<String> getMissingFields() {
        return missingFields;
    }

    public SessionStatus getStatus() {
        return status;
    }

    public Instant getLastScrapedAt() {
        return lastScrapedAt;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
