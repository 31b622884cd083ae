package dev.campfire.dedup;

import dev.campfire.BaseIntegrationTest;
import dev.campfire.catalog.Address;
import dev.campfire.catalog.Location;
import dev.campfire.catalog.LocationRepository;
import dev.campfire.catalog.Organization;
import dev.campfire.catalog.OrganizationRepository;
import dev.campfire.source.Source;
import dev.campfire.source.SourceRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class DeduplicationIT extends BaseIntegrationTest {

    @Autowired
    DeduplicationService deduplicationService;

    @Autowired
    OrganizationRepository organizationRepository;

    @Autowired
    LocationRepository locationRepository;

    @Autowired
    SourceRepository sourceRepository;

    @Test
    void organizations_sharing_name_and_domain_collapse_onto_the_oldest() {
        String suffix = UUID.randomUUID().toString();
        String website = "https://sunshine-" + suffix + ".example.com";
        Organization oldest = organizationRepository.saveAndFlush(
                new Organization("Camp Sunshine", "camp-sunshine-a-" + suffix, website));
        Organization second = organizationRepository.saveAndFlush(
                new Organization("camp sunshine", "camp-sunshine-b-" + suffix, website));
        Organization third = organizationRepository.saveAndFlush(
                new Organization("  Camp   Sunshine ", "camp-sunshine-c-" + suffix, website + "/about"));
        Source secondSource = sourceFor(second);
        Source thirdSource = sourceFor(third);

        DedupResult result = deduplicationService.runToCompletion(DedupKind.ORGANIZATIONS);

        assertThat(result.exhausted()).isTrue();
        assertThat(result.failedGroups()).isZero();
        List<Organization> remaining = organizationRepository
                .findByWebsiteDomainOrderByCreatedAtAscIdAsc(oldest.getWebsiteDomain());
        assertThat(remaining).extracting(Organization::getId).containsExactly(oldest.getId());
        assertThat(sourceRepository.findById(secondSource.getId()).orElseThrow().getOrganizationId())
                .isEqualTo(oldest.getId());
        assertThat(sourceRepository.findById(thirdSource.getId()).orElseThrow().getOrganizationId())
                .isEqualTo(oldest.getId());

        deduplicationService.runToCompletion(DedupKind.ORGANIZATIONS);

        assertThat(organizationRepository.findByWebsiteDomainOrderByCreatedAtAscIdAsc(oldest.getWebsiteDomain()))
                .hasSize(1);
    }

    @Test
    void location_run_merges_duplicates_and_purges_placeholders() {
        String suffix = UUID.randomUUID().toString();
        Organization organization = organizationRepository.saveAndFlush(new Organization(
                "Venue Owner", "venue-owner-" + suffix, "https://venues-" + suffix + ".example.com"));
        Address address = new Address("1945 SE Water Ave", "Portland", "OR", "97214");
        Location hall = locationRepository.saveAndFlush(
                new Location(organization.getId(), null, "Main Hall", address));
        Location duplicate = locationRepository.saveAndFlush(
                new Location(organization.getId(), null, "main  hall", address));
        Location placeholder = new Location(organization.getId(), null, "Somewhere " + suffix, address);
        placeholder.setCoordinates(45.5152, -122.6784);
        placeholder = locationRepository.saveAndFlush(placeholder);

        DedupResult result = deduplicationService.runToCompletion(DedupKind.LOCATIONS);

        assertThat(result.deleted()).isGreaterThanOrEqualTo(2);
        assertThat(locationRepository.findById(hall.getId())).isPresent();
        assertThat(locationRepository.findById(duplicate.getId())).isEmpty();
        assertThat(locationRepository.findById(placeholder.getId())).isEmpty();
    }

    private Source sourceFor(Organization organization) {
        String host = "dedup-" + UUID.randomUUID() + ".example.com";
        Source source = new Source(organization.getName().trim(), "https://" + host, host);
        source.setOrganizationId(organization.getId());
        return sourceRepository.saveAndFlush(source);
    }
}
