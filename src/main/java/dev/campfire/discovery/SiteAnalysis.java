package dev.campfire.discovery;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import java.util.List;
import java.util.Objects;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;
import org.jspecify.annotations.Nullable;

/**
 * The AI collaborator's verdict on a discovered URL, embedded in the {@code discovered_sources}
 * row. Null on the entity until the analysis arrives.
 *
 * @param confidence 0 to 1
 * @param organizationNames provider names detected on the page
 */
@Embeddable
public record SiteAnalysis(
    @Column(name = "ai_likely_camp_site") boolean likelyCampSite,
    @Column(name = "ai_confidence") double confidence,
    @Enumerated(EnumType.STRING) @Column(name = "ai_page_type") @Nullable PageType pageType,
    @JdbcTypeCode(SqlTypes.JSON) @Column(name = "ai_organization_names")
        @Nullable List<String> organizationNames,
    @Column(name = "ai_has_schedule_info") boolean hasScheduleInfo,
    @Column(name = "ai_has_pricing_info") boolean hasPricingInfo,
    @Column(name = "ai_suggested_approach") @Nullable String suggestedApproach) {

  public SiteAnalysis {
    organizationNames =
        organizationNames == null
            ? List.of()
            : organizationNames.stream().filter(Objects::nonNull).toList();
  }
}
