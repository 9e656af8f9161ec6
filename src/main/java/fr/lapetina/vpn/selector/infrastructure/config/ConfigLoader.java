package fr.lapetina.vpn.selector.infrastructure.config;

import fr.lapetina.vpn.selector.domain.model.Protocol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Loads the selector configuration from YAML.
 *
 * Supports:
 * - Loading from the file system, falling back to the classpath
 * - Range validation of the loaded values
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private final Path configPath;
    private final Yaml yaml;

    public ConfigLoader(String configPath) {
        this.configPath = Paths.get(configPath);
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new Constructor(SelectorConfig.class, loaderOptions));
    }

    /**
     * Loads configuration from file or classpath.
     *
     * @return The loaded, validated configuration
     * @throws ConfigurationException if loading or validation fails
     */
    public SelectorConfig load() {
        SelectorConfig config = loadFromPath();
        if (config == null) {
            log.warn("Configuration is empty, using defaults: {}", configPath);
            config = createDefault();
        }
        validate(config);
        return config;
    }

    private SelectorConfig loadFromPath() {
        if (Files.exists(configPath)) {
            return loadFromFile(configPath);
        }

        String classpathResource = configPath.toString();
        if (classpathResource.startsWith("/")) {
            classpathResource = classpathResource.substring(1);
        }

        try (InputStream is = getClass().getClassLoader().getResourceAsStream(classpathResource)) {
            if (is != null) {
                log.info("Loading configuration from classpath: {}", classpathResource);
                return parse(is, classpathResource);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load from classpath: " + classpathResource, e);
        }

        throw new ConfigurationException("Configuration file not found: " + configPath);
    }

    private SelectorConfig loadFromFile(Path path) {
        log.info("Loading configuration from file: {}", path);
        try (InputStream is = Files.newInputStream(path)) {
            return parse(is, path.toString());
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    /**
     * Loads configuration from an input stream.
     */
    public SelectorConfig loadFromStream(InputStream inputStream) {
        SelectorConfig config = parse(inputStream, "stream");
        if (config == null) {
            config = createDefault();
        }
        validate(config);
        return config;
    }

    private SelectorConfig parse(InputStream is, String source) {
        try {
            return yaml.load(is);
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid YAML in " + source + ": " + e.getMessage(), e);
        }
    }

    /**
     * Checks value ranges that would otherwise fail deep inside an evaluation run.
     */
    static void validate(SelectorConfig config) {
        SelectorConfig.ProbeConfig probe = config.getProbe();
        require(probe.getAttempts() >= 1, "probe.attempts must be at least 1");
        require(probe.getAttemptTimeoutMs() > 0, "probe.attemptTimeoutMs must be positive");
        require(probe.getTcpPort() >= 1 && probe.getTcpPort() <= 65535, "probe.tcpPort must be within [1, 65535]");

        SelectorConfig.ScoringConfig scoring = config.getScoring();
        require(scoring.getLossCutoffPercent() > 0 && scoring.getLossCutoffPercent() <= 100,
                "scoring.lossCutoffPercent must be within (0, 100]");
        require(scoring.getPrecision() >= 0, "scoring.precision must not be negative");

        SelectorConfig.ConcurrencyConfig concurrency = config.getConcurrency();
        require(concurrency.getDescriptorsPerWorker() >= 1, "concurrency.descriptorsPerWorker must be at least 1");
        require(concurrency.getFallbackParallelism() >= 1, "concurrency.fallbackParallelism must be at least 1");
        require(concurrency.getMaxParallelism() >= 0, "concurrency.maxParallelism must not be negative");
        require(Integer.bitCount(concurrency.getRingBufferSize()) == 1,
                "concurrency.ringBufferSize must be a power of 2");

        for (String protocol : config.getSelection().getProtocols()) {
            require(Protocol.fromId(protocol).isPresent(), "selection.protocols contains unknown protocol: " + protocol);
        }
        for (String protocol : config.getProvider().getProtocols().keySet()) {
            require(Protocol.fromId(protocol).isPresent(), "provider.protocols contains unknown protocol: " + protocol);
        }
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new ConfigurationException(message);
        }
    }

    /**
     * Creates a default configuration.
     */
    public static SelectorConfig createDefault() {
        return new SelectorConfig();
    }

    /**
     * Exception for configuration errors.
     */
    public static class ConfigurationException extends RuntimeException {
        public ConfigurationException(String message) {
            super(message);
        }

        public ConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
