package fr.lapetina.vpn.selector;

import fr.lapetina.vpn.selector.api.SelectionReportWriter;
import fr.lapetina.vpn.selector.domain.model.ScoredCandidate;
import fr.lapetina.vpn.selector.domain.model.SelectionKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Main entry point: evaluates the configured server list once and prints the
 * best server per (country, category, protocol) as JSON.
 */
public class VpnServerSelectorApplication {

    private static final Logger log = LoggerFactory.getLogger(VpnServerSelectorApplication.class);

    public static void main(String[] args) {
        String configPath = args.length > 0 ? args[0] : "config.yaml";

        try (SelectorFactory factory = SelectorFactory.create(configPath)) {
            Map<SelectionKey, ScoredCandidate> best = factory.evaluateConfiguredCandidates();
            System.out.println(new SelectionReportWriter().toJson(best));
        } catch (Exception e) {
            log.error("Server selection failed", e);
            System.exit(1);
        }
    }
}
