package fr.lapetina.vpn.selector;

import fr.lapetina.vpn.selector.disruptor.ServerSelectionEngine;
import fr.lapetina.vpn.selector.domain.model.CandidateServer;
import fr.lapetina.vpn.selector.domain.model.Protocol;
import fr.lapetina.vpn.selector.domain.model.ProviderCatalog;
import fr.lapetina.vpn.selector.domain.model.ScoredCandidate;
import fr.lapetina.vpn.selector.domain.model.SelectionKey;
import fr.lapetina.vpn.selector.infrastructure.config.ConfigLoader;
import fr.lapetina.vpn.selector.infrastructure.config.SelectorConfig;
import fr.lapetina.vpn.selector.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.vpn.selector.infrastructure.probe.NetworkProber;
import fr.lapetina.vpn.selector.infrastructure.probe.ProberFactory;
import fr.lapetina.vpn.selector.infrastructure.provider.CandidateFilter;
import fr.lapetina.vpn.selector.infrastructure.provider.CandidateServerReader;
import fr.lapetina.vpn.selector.infrastructure.resource.ConcurrencyController;
import fr.lapetina.vpn.selector.infrastructure.resource.DescriptorBudgetProvider;
import fr.lapetina.vpn.selector.infrastructure.resource.JvmDescriptorBudgetProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Paths;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Factory for creating a fully-wired selection engine from configuration.
 * This is the primary entry point for running an evaluation.
 *
 * <p>Usage:
 * <pre>{@code
 * try (SelectorFactory factory = SelectorFactory.create("config.yaml")) {
 *     Map<SelectionKey, ScoredCandidate> best = factory.evaluate(candidates);
 * }
 * }</pre>
 */
public class SelectorFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SelectorFactory.class);

    private final SelectorConfig config;
    private final ProviderCatalog catalog;
    private final MetricsRegistry metricsRegistry;
    private final NetworkProber prober;
    private final ServerSelectionEngine engine;

    protected SelectorFactory(
            SelectorConfig config,
            NetworkProber proberOverride,
            DescriptorBudgetProvider budgetProviderOverride
    ) {
        this.config = config;
        this.catalog = createCatalog(config.getProvider());
        this.metricsRegistry = config.getMetrics().isEnabled()
                ? new MetricsRegistry(config.getMetrics().getPrefix())
                : null;

        // Allow override for testing
        this.prober = proberOverride != null ? proberOverride : ProberFactory.fromConfig(config.getProbe());
        log.info("Using prober: {}", prober.getName());

        SelectorConfig.ConcurrencyConfig concurrency = config.getConcurrency();
        ConcurrencyController controller = new ConcurrencyController(
                budgetProviderOverride != null ? budgetProviderOverride : new JvmDescriptorBudgetProvider(),
                concurrency.getDescriptorsPerWorker(),
                concurrency.getFallbackParallelism(),
                concurrency.getMaxParallelism()
        );

        this.engine = ServerSelectionEngine.builder()
                .fromConfig(config)
                .prober(prober)
                .catalog(catalog)
                .concurrencyController(controller)
                .metricsRegistry(metricsRegistry)
                .build();

        log.info("SelectorFactory initialized");
    }

    /**
     * Creates a factory from the specified configuration file.
     */
    public static SelectorFactory create(String configPath) {
        log.info("Initializing SelectorFactory from config: {}", configPath);
        return new SelectorFactory(new ConfigLoader(configPath).load(), null, null);
    }

    /**
     * Creates a factory from an already loaded configuration.
     */
    public static SelectorFactory create(SelectorConfig config) {
        return new SelectorFactory(config, null, null);
    }

    /**
     * Reads the configured candidate file, applies the configured filters and evaluates.
     */
    public Map<SelectionKey, ScoredCandidate> evaluateConfiguredCandidates() {
        List<CandidateServer> candidates = new CandidateServerReader()
                .read(Paths.get(config.getSelection().getCandidatesFile()));
        return evaluate(candidates);
    }

    /**
     * Evaluates the given candidates with the configured filters, attempts and protocols.
     */
    public Map<SelectionKey, ScoredCandidate> evaluate(List<CandidateServer> candidates) {
        CandidateFilter filter = new CandidateFilter(
                config.getSelection().getCountries(),
                config.getSelection().getCategories(),
                catalog
        );
        List<CandidateServer> selected = filter.apply(candidates);
        if (selected.size() != candidates.size()) {
            log.info("Candidates filtered: before={}, after={}", candidates.size(), selected.size());
        }
        return engine.evaluate(selected, config.getProbe().getAttempts(), allowedProtocols());
    }

    Set<Protocol> allowedProtocols() {
        Set<Protocol> protocols = EnumSet.noneOf(Protocol.class);
        for (String id : config.getSelection().getProtocols()) {
            Protocol.fromId(id).ifPresent(protocols::add);
        }
        return protocols;
    }

    private static ProviderCatalog createCatalog(SelectorConfig.ProviderConfig provider) {
        ProviderCatalog defaults = ProviderCatalog.nordVpn();
        if (provider.getCategories().isEmpty() && provider.getProtocols().isEmpty()) {
            return defaults;
        }

        Map<String, String> categories = provider.getCategories().isEmpty()
                ? defaults.getCategoryLabels()
                : provider.getCategories();

        Map<Protocol, String> protocols = new EnumMap<>(Protocol.class);
        if (provider.getProtocols().isEmpty()) {
            protocols.putAll(defaults.getProtocolLabels());
        } else {
            provider.getProtocols().forEach((id, label) ->
                    Protocol.fromId(id).ifPresent(p -> protocols.put(p, label)));
        }
        return new ProviderCatalog(categories, protocols);
    }

    public ServerSelectionEngine getEngine() {
        return engine;
    }

    public SelectorConfig getConfig() {
        return config;
    }

    public ProviderCatalog getCatalog() {
        return catalog;
    }

    /**
     * Returns the metrics registry, or null when metrics are disabled.
     */
    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    @Override
    public void close() {
        if (metricsRegistry != null) {
            try {
                metricsRegistry.close();
            } catch (Exception e) {
                log.warn("Error closing metrics registry", e);
            }
        }
        log.info("SelectorFactory shut down");
    }
}
