package dev.campfire.source;

import dev.campfire.BaseIntegrationTest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class SourceListingIT extends BaseIntegrationTest {

    @Autowired
    SourceService sourceService;

    @Autowired
    SourceRepository sourceRepository;

    @Test
    void filters_and_counts_are_computed_in_the_database() {
        UUID cityId = UUID.randomUUID();
        Source alpha = newSource("Alpha Camps", cityId);
        newSource("delta Robotics", cityId);
        Source beta = newSource("beta Adventures", cityId);
        Source gamma = newSource("Gamma Arts", cityId);
        newSource("Elsewhere Camps", UUID.randomUUID());

        for (int i = 0; i < HealthThresholds.DEGRADED_FAILURES; i++) {
            beta.getHealth().recordFailure(Instant.now(), "timeout", false);
        }
        sourceRepository.save(beta);
        gamma.close("season over", "operator", Instant.now());
        sourceRepository.save(gamma);

        SourceListing healthy = sourceService.listSourcesFiltered(SourceFilter.HEALTHY, cityId, null);

        assertThat(healthy.countsByFilter())
                .containsEntry(SourceFilter.ALL, 4L)
                .containsEntry(SourceFilter.HEALTHY, 2L)
                .containsEntry(SourceFilter.FAILING, 1L)
                .containsEntry(SourceFilter.NODATA, 3L);
        assertThat(healthy.sources())
                .extracting(SourceSummary::name)
                .containsExactly("Alpha Camps", "delta Robotics");
        assertThat(healthy.sources().get(0).id()).isEqualTo(alpha.getId());
        assertThat(healthy.sources()).noneMatch(SourceSummary::hasActiveSessions);
    }

    @Test
    void limit_truncates_the_page_but_not_the_counts() {
        UUID cityId = UUID.randomUUID();
        newSource("Camp One", cityId);
        newSource("Camp Two", cityId);

        SourceListing listing = sourceService.listSourcesFiltered(SourceFilter.ALL, cityId, 1);

        assertThat(listing.sources()).extracting(SourceSummary::name).containsExactly("Camp One");
        assertThat(listing.countsByFilter()).containsEntry(SourceFilter.ALL, 2L);
    }

    private Source newSource(String name, UUID cityId) {
        String host = "listing-" + UUID.randomUUID() + ".example.com";
        return sourceService.createSource(NewSource.of(name, "https://" + host + "/camps", null, cityId));
    }
}
