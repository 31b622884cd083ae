package dev.campfire;

import dev.campfire.alert.AlertSeverity;
import dev.campfire.alert.AlertType;
import dev.campfire.alert.SourceAlert;
import dev.campfire.alert.SourceAlertRepository;
import dev.campfire.catalog.Address;
import dev.campfire.catalog.Camp;
import dev.campfire.catalog.CampRepository;
import dev.campfire.catalog.Location;
import dev.campfire.catalog.LocationRepository;
import dev.campfire.catalog.Organization;
import dev.campfire.catalog.OrganizationRepository;
import dev.campfire.discovery.DiscoveredSource;
import dev.campfire.discovery.DiscoveredSourceRepository;
import dev.campfire.discovery.DiscoveryStatus;
import dev.campfire.discovery.ScraperDevelopmentRequest;
import dev.campfire.discovery.ScraperDevelopmentRequestRepository;
import dev.campfire.job.ExtractionJob;
import dev.campfire.job.ExtractionJobRepository;
import dev.campfire.job.JobStatus;
import dev.campfire.source.AdditionalUrl;
import dev.campfire.source.Source;
import dev.campfire.source.SourceRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Compensates for ddl-auto=none by verifying each JPA entity
 * can be persisted and read back against the Flyway schema.
 */
@Transactional
class JpaSchemaDriftIT extends BaseIntegrationTest {

    @Autowired
    private SourceRepository sourceRepository;

    @Autowired
    private ExtractionJobRepository jobRepository;

    @Autowired
    private OrganizationRepository organizationRepository;

    @Autowired
    private LocationRepository locationRepository;

    @Autowired
    private CampRepository campRepository;

    @Autowired
    private SourceAlertRepository alertRepository;

    @Autowired
    private DiscoveredSourceRepository discoveredSourceRepository;

    @Autowired
    private ScraperDevelopmentRequestRepository scraperRequestRepository;

    @Test
    void source_roundtrips_with_additional_urls() {
        String host = "drift-" + UUID.randomUUID() + ".example.com";
        Source source = new Source("Drift Camps", "https://" + host + "/summer", host);
        source.setAdditionalUrls(List.of(new AdditionalUrl("https://" + host + "/winter", "winter")));
        source.setScrapeFrequencyHours(48);

        Source saved = sourceRepository.saveAndFlush(source);
        Source found = sourceRepository.findById(saved.getId()).orElseThrow();

        assertThat(found.getDomain()).isEqualTo(host);
        assertThat(found.getAdditionalUrls()).extracting(AdditionalUrl::label).containsExactly("winter");
        assertThat(found.getScrapeFrequencyHours()).isEqualTo(48);
        assertThat(found.getHealth().getTotalRuns()).isZero();
        assertThat(found.getCreatedAt()).isNotNull();
    }

    @Test
    void job_roundtrips_against_flyway_schema() {
        String host = "drift-" + UUID.randomUUID() + ".example.com";
        Source source = sourceRepository.saveAndFlush(new Source("Drift Jobs", "https://" + host, host));

        ExtractionJob saved = jobRepository.saveAndFlush(new ExtractionJob(source.getId(), "drift"));
        ExtractionJob found = jobRepository.findById(saved.getId()).orElseThrow();

        assertThat(found.getSourceId()).isEqualTo(source.getId());
        assertThat(found.getStatus()).isEqualTo(JobStatus.PENDING);
        assertThat(found.getTriggeredBy()).isEqualTo("drift");
    }

    @Test
    void catalog_entities_roundtrip_against_flyway_schema() {
        String suffix = UUID.randomUUID().toString();
        Organization organization = new Organization(
                "Drift Org", "drift-org-" + suffix, "https://drift-" + suffix + ".example.com");
        UUID cityId = UUID.randomUUID();
        organization.addCity(cityId);
        Organization savedOrganization = organizationRepository.saveAndFlush(organization);

        Location location = new Location(savedOrganization.getId(), cityId, "Main Hall",
                new Address("1945 SE Water Ave", "Portland", "OR", "97214"));
        location.setCoordinates(45.5085, -122.6653);
        Location savedLocation = locationRepository.saveAndFlush(location);

        Camp camp = new Camp(savedOrganization.getId(), "Lego Robotics");
        camp.setImageUrls(List.of("https://cdn.example.com/lego.png"));
        Camp savedCamp = campRepository.saveAndFlush(camp);

        assertThat(organizationRepository.findById(savedOrganization.getId()).orElseThrow().getCityIds())
                .containsExactly(cityId);
        assertThat(locationRepository.findById(savedLocation.getId()).orElseThrow().getAddress().zip())
                .isEqualTo("97214");
        assertThat(campRepository.findById(savedCamp.getId()).orElseThrow().getImageUrls())
                .containsExactly("https://cdn.example.com/lego.png");
    }

    @Test
    void alert_and_discovery_entities_roundtrip_against_flyway_schema() {
        SourceAlert alert = alertRepository.saveAndFlush(
                new SourceAlert(null, AlertType.ZERO_RESULTS, AlertSeverity.WARNING, "No sessions"));
        String url = "https://drift-" + UUID.randomUUID() + ".example.com/camps";
        DiscoveredSource discovery = discoveredSourceRepository.saveAndFlush(
                new DiscoveredSource(url, "example.com", "Drift", null, "summer camps", null));
        ScraperDevelopmentRequest request = scraperRequestRepository.saveAndFlush(
                new ScraperDevelopmentRequest(null, "Drift", url, null, "drift", "static html"));

        assertThat(alertRepository.findById(alert.getId()).orElseThrow().isAcknowledged()).isFalse();
        assertThat(discoveredSourceRepository.findById(discovery.getId()).orElseThrow().getStatus())
                .isEqualTo(DiscoveryStatus.PENDING_ANALYSIS);
        assertThat(scraperRequestRepository.findById(request.getId()).orElseThrow().getNotes())
                .isEqualTo("static html");
    }
}
