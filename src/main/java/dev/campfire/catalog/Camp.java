package dev.campfire.catalog;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * A programme offered by an organization ("Lego Engineering"), grouping its dated sessions.
 *
 * <p>Maps to the {@code camps} table managed by Flyway migrations.
 */
@Entity
@Table(name = "camps")
public class Camp {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "organization_id")
    private UUID organizationId;

    @Column(nullable = false)
    private String name;

    @Column(name = "normalized_name", nullable = false)
    private String normalizedName;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "image_urls", nullable = false)
    private List<String> imageUrls = new ArrayList<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected Camp() {
        // JPA requires no-arg constructor
    }

    public Camp(UUID organizationId, String name) {
        this.organizationId = organizationId;
        this.name = name;
        this.normalizedName = NameNormalizer.normalize(name);
    }

    @PrePersist
    protected void onCreate() {
        this.createdAt = Instant.now().truncatedTo(ChronoUnit.MICROS);
    }

    /** Copies the donor's images when this camp has none. */
    public void absorb(Camp donor) {
        if (imageUrls.isEmpty() && !donor.imageUrls.isEmpty()) {
            imageUrls = new ArrayList<>(donor.imageUrls);
        }
    }

    public UUID getId() {
        return id;
    }

    public UUID getOrganizationId() {
        return organizationId;
    }

    public String getName() {
        return name;
    }

    public String getNormalizedName() {
        return normalizedName;
    }

    public List<String> getImageUrls() {
        return imageUrls;
    }

    public void setImageUrls(List<String> imageUrls) {
        this.imageUrls = new ArrayList<>(imageUrls);
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
