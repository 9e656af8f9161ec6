package fr.lapetina.vpn.selector.integration;

import fr.lapetina.vpn.selector.domain.model.CandidateServer;
import fr.lapetina.vpn.selector.domain.model.Protocol;
import fr.lapetina.vpn.selector.domain.model.ScoredCandidate;
import fr.lapetina.vpn.selector.domain.model.SelectionKey;
import fr.lapetina.vpn.selector.infrastructure.config.ConfigLoader;
import fr.lapetina.vpn.selector.infrastructure.config.SelectorConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Integration tests wiring the whole selector from test-config.yaml.
 */
class SelectorFactoryIntegrationTest {

    private TestSelectorFactory factory;

    @BeforeEach
    void setUp() {
        factory = TestSelectorFactory.create();
    }

    @AfterEach
    void tearDown() {
        if (factory != null) {
            factory.close();
        }
    }

    private static CandidateServer server(String domain, String country, int load, String category) {
        return CandidateServer.builder()
                .domain(domain).countryCode(country).load(load)
                .addCategory(category)
                .addProtocol(Protocol.UDP).addProtocol(Protocol.TCP)
                .build();
    }

    @Test
    @DisplayName("should wire the engine from the test configuration")
    void shouldWireFromConfig() {
        assertThat(factory.getEngine().getProber().getName()).isEqualTo("stub");
        assertThat(factory.getMetricsRegistry()).isNotNull();
        assertThat(factory.getCatalog().categoryLabel("p2p")).isEqualTo("P2P");
    }

    @Test
    @DisplayName("should only consider configured protocols")
    void shouldRestrictToConfiguredProtocols() {
        factory.getStubProber().respond("a.example.com", 20, 0);

        Map<SelectionKey, ScoredCandidate> best =
                factory.evaluate(List.of(server("a.example.com", "US", 10, "normal")));

        assertThat(best).containsOnlyKeys(new SelectionKey("US", "Standard VPN servers", Protocol.UDP));
    }

    @Test
    @DisplayName("should pick the best server per country")
    void shouldPickBestPerCountry() {
        factory.getStubProber()
                .respond("us1.example.com", 20, 0)
                .respond("us2.example.com", 50, 0)
                .respond("de1.example.com", 40, 0);

        Map<SelectionKey, ScoredCandidate> best = factory.evaluate(List.of(
                server("us1.example.com", "US", 10, "normal"),
                server("us2.example.com", "US", 5, "normal"),
                server("de1.example.com", "DE", 30, "normal")
        ));

        assertThat(best).hasSize(2);
        assertThat(best.get(new SelectionKey("US", "Standard VPN servers", Protocol.UDP)).domain())
                .isEqualTo("us1.example.com");
        assertThat(best.get(new SelectionKey("DE", "Standard VPN servers", Protocol.UDP)).domain())
                .isEqualTo("de1.example.com");
        assertThat(factory.getMetricsRegistry().getParallelism()).isEqualTo(3);
        assertThat(factory.getMetricsRegistry().scrape()).contains("test_selector_candidates_total");
    }

    @Test
    @DisplayName("should read, filter and evaluate the configured candidate file")
    void shouldEvaluateConfiguredCandidates(@TempDir Path dir) throws IOException {
        Path candidates = dir.resolve("servers.json");
        try (InputStream in = getClass().getClassLoader().getResourceAsStream("servers.json")) {
            Files.copy(in, candidates);
        }
        SelectorConfig config = new ConfigLoader("test-config.yaml").load();
        config.getSelection().setCandidatesFile(candidates.toString());
        config.getSelection().setCountries(List.of("US"));

        try (TestSelectorFactory configured = TestSelectorFactory.create(config)) {
            configured.getStubProber()
                    .respond("us1234.nordvpn.com", 20, 0)
                    .respond("us2000.nordvpn.com", 50, 0);

            Map<SelectionKey, ScoredCandidate> best = configured.evaluateConfiguredCandidates();

            assertThat(best).containsOnlyKeys(
                    new SelectionKey("US", "Standard VPN servers", Protocol.UDP),
                    new SelectionKey("US", "P2P", Protocol.UDP));
            assertThat(best.get(new SelectionKey("US", "Standard VPN servers", Protocol.UDP)).connectionName())
                    .isEqualTo("us1234.udp[Standard VPN servers|P2P]");
            assertThat(configured.getStubProber().getProbedHosts())
                    .doesNotContain("de501.nordvpn.com");
        }
    }
}
