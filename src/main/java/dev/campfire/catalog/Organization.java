package dev.campfire.catalog;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.HashSet;
import java.util.Set;
import java.util.UUID;

/**
 * A camp provider. Sources, camps, locations and sessions point at their organization by id.
 *
 * <p>{@code normalizedName} and {@code websiteDomain} together form the deduplication key and are
 * kept in sync with {@code name} and {@code website} by the setters.
 *
 * <p>Maps to the {@code organizations} table managed by Flyway migrations.
 */
@Entity
@Table(name = "organizations")
public class Organization {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false, unique = true)
    private String slug;

    @Column(name = "normalized_name", nullable = false)
    private String normalizedName;

    private String website;

    @Column(name = "website_domain")
    private String websiteDomain;

    @Column(name = "logo_url")
    private String logoUrl;

    @ElementCollection
    @CollectionTable(name = "organization_cities", joinColumns = @JoinColumn(name = "organization_id"))
    @Column(name = "city_id")
    private Set<UUID> cityIds = new HashSet<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected Organization() {
        // JPA requires no-arg constructor
    }

    public Organization(String name, String slug, String website) {
        this.slug = slug;
        setName(name);
        setWebsite(website);
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
     * Folds a duplicate into this organization: copies the logo and website when this record lacks
     * them and unions the served cities.
     */
    public void absorb(Organization donor) {
        if (logoUrl == null && donor.logoUrl != null) {
            logoUrl = donor.logoUrl;
        }
        if (website == null && donor.website != null) {
            setWebsite(donor.website);
        }
        cityIds.addAll(donor.cityIds);
    }

    public UUID getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
        this.normalizedName = NameNormalizer.normalize(name);
    }

    public String getSlug() {
        return slug;
    }

    public String getNormalizedName() {
        return normalizedName;
    }

    public String getWebsite() {
        return website;
    }

    public void setWebsite(String website) {
        this.website = website;
        this.websiteDomain = UrlNormalizer.extractDomain(website);
    }

    public String getWebsiteDomain() {
        return websiteDomain;
    }

    public String getLogoUrl() {
        return logoUrl;
    }

    public void setLogoUrl(String logoUrl) {
        this.logoUrl = logoUrl;
    }

    public Set<UUID> getCityIds() {
        return cityIds;
    }

    public void addCity(UUID cityId) {
        if (cityId != null) {
            cityIds.add(cityId);
        }
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
