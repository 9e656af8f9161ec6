package fr.lapetina.vpn.selector.infrastructure.probe;

import fr.lapetina.vpn.selector.infrastructure.config.SelectorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Factory for creating network probers by configured name.
 */
public final class ProberFactory {

    private static final Logger log = LoggerFactory.getLogger(ProberFactory.class);

    public static final String DEFAULT_PROBER = "ping";

    private static final Map<String, Function<SelectorConfig.ProbeConfig, NetworkProber>> REGISTRY =
            new ConcurrentHashMap<>();

    static {
        register("ping", config -> new SystemPingProber(config.getCommand(), timeout(config)));
        register("reachable", config -> new ReachabilityProber(timeout(config)));
        register("tcp-connect", config -> new TcpConnectProber(config.getTcpPort(), timeout(config)));
    }

    private ProberFactory() {
        // Utility class
    }

    private static Duration timeout(SelectorConfig.ProbeConfig config) {
        return Duration.ofMillis(config.getAttemptTimeoutMs());
    }

    /**
     * Registers a custom prober.
     *
     * @param name    Prober name (used in configuration)
     * @param factory Creates a prober from the probe settings
     */
    public static void register(String name, Function<SelectorConfig.ProbeConfig, NetworkProber> factory) {
        REGISTRY.put(name.toLowerCase(Locale.ROOT), factory);
    }

    /**
     * Creates a prober by name.
     *
     * @return Prober instance, or empty if not registered
     */
    public static Optional<NetworkProber> create(String name, SelectorConfig.ProbeConfig config) {
        if (name == null) {
            return Optional.empty();
        }
        Function<SelectorConfig.ProbeConfig, NetworkProber> factory = REGISTRY.get(name.toLowerCase(Locale.ROOT));
        return factory == null ? Optional.empty() : Optional.of(factory.apply(config));
    }

    /**
     * Creates the prober named in {@code config}, falling back to {@value #DEFAULT_PROBER}.
     */
    public static NetworkProber fromConfig(SelectorConfig.ProbeConfig config) {
        return create(config.getType(), config).orElseGet(() -> {
            log.warn("Unknown prober type '{}', using {}", config.getType(), DEFAULT_PROBER);
            return REGISTRY.get(DEFAULT_PROBER).apply(config);
        });
    }

    public static Iterable<String> getRegisteredNames() {
        return REGISTRY.keySet();
    }
}
