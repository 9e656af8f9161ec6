package fr.lapetina.vpn.selector.infrastructure.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Root configuration object for the server selector.
 * Designed to be populated from YAML.
 */
public class SelectorConfig {

    private ProbeConfig probe = new ProbeConfig();
    private ScoringConfig scoring = new ScoringConfig();
    private ConcurrencyConfig concurrency = new ConcurrencyConfig();
    private SelectionConfig selection = new SelectionConfig();
    private ProviderConfig provider = new ProviderConfig();
    private MetricsConfig metrics = new MetricsConfig();

    public ProbeConfig getProbe() { return probe; }
    public void setProbe(ProbeConfig probe) { this.probe = probe; }

    public ScoringConfig getScoring() { return scoring; }
    public void setScoring(ScoringConfig scoring) { this.scoring = scoring; }

    public ConcurrencyConfig getConcurrency() { return concurrency; }
    public void setConcurrency(ConcurrencyConfig concurrency) { this.concurrency = concurrency; }

    public SelectionConfig getSelection() { return selection; }
    public void setSelection(SelectionConfig selection) { this.selection = selection; }

    public ProviderConfig getProvider() { return provider; }
    public void setProvider(ProviderConfig provider) { this.provider = provider; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * Network probe settings.
     */
    public static class ProbeConfig {
        private String type = "ping";
        private int attempts = 5;
        private long attemptTimeoutMs = 1000;
        private String command = "ping";
        private int tcpPort = 443;

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }

        public int getAttempts() { return attempts; }
        public void setAttempts(int attempts) { this.attempts = attempts; }

        public long getAttemptTimeoutMs() { return attemptTimeoutMs; }
        public void setAttemptTimeoutMs(long attemptTimeoutMs) { this.attemptTimeoutMs = attemptTimeoutMs; }

        public String getCommand() { return command; }
        public void setCommand(String command) { this.command = command; }

        public int getTcpPort() { return tcpPort; }
        public void setTcpPort(int tcpPort) { this.tcpPort = tcpPort; }
    }

    /**
     * Score cutoffs.
     */
    public static class ScoringConfig {
        private double lossCutoffPercent = 5.0;
        private int precision = 4;

        public double getLossCutoffPercent() { return lossCutoffPercent; }
        public void setLossCutoffPercent(double lossCutoffPercent) { this.lossCutoffPercent = lossCutoffPercent; }

        public int getPrecision() { return precision; }
        public void setPrecision(int precision) { this.precision = precision; }
    }

    /**
     * Worker pool sizing and ring buffer settings.
     */
    public static class ConcurrencyConfig {
        private int descriptorsPerWorker = 2;
        private int fallbackParallelism = 16;
        private int maxParallelism = 0;
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";

        public int getDescriptorsPerWorker() { return descriptorsPerWorker; }
        public void setDescriptorsPerWorker(int descriptorsPerWorker) { this.descriptorsPerWorker = descriptorsPerWorker; }

        public int getFallbackParallelism() { return fallbackParallelism; }
        public void setFallbackParallelism(int fallbackParallelism) { this.fallbackParallelism = fallbackParallelism; }

        /** Upper bound on workers regardless of descriptor headroom, 0 for none. */
        public int getMaxParallelism() { return maxParallelism; }
        public void setMaxParallelism(int maxParallelism) { this.maxParallelism = maxParallelism; }

        public int getRingBufferSize() { return ringBufferSize; }
        public void setRingBufferSize(int ringBufferSize) { this.ringBufferSize = ringBufferSize; }

        public String getWaitStrategy() { return waitStrategy; }
        public void setWaitStrategy(String waitStrategy) { this.waitStrategy = waitStrategy; }
    }

    /**
     * What to evaluate.
     */
    public static class SelectionConfig {
        private String candidatesFile = "servers.json";
        private List<String> protocols = new ArrayList<>(List.of("udp", "tcp"));
        private List<String> countries = new ArrayList<>();
        private List<String> categories = new ArrayList<>();

        public String getCandidatesFile() { return candidatesFile; }
        public void setCandidatesFile(String candidatesFile) { this.candidatesFile = candidatesFile; }

        public List<String> getProtocols() { return protocols; }
        public void setProtocols(List<String> protocols) { this.protocols = protocols; }

        /** Country codes to keep, empty for all. */
        public List<String> getCountries() { return countries; }
        public void setCountries(List<String> countries) { this.countries = countries; }

        /** Category tags or labels to keep, empty for all. */
        public List<String> getCategories() { return categories; }
        public void setCategories(List<String> categories) { this.categories = categories; }
    }

    /**
     * Provider label tables. Empty maps mean the built-in NordVPN tables.
     */
    public static class ProviderConfig {
        private Map<String, String> categories = new LinkedHashMap<>();
        private Map<String, String> protocols = new LinkedHashMap<>();

        public Map<String, String> getCategories() { return categories; }
        public void setCategories(Map<String, String> categories) { this.categories = categories; }

        public Map<String, String> getProtocols() { return protocols; }
        public void setProtocols(Map<String, String> protocols) { this.protocols = protocols; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private boolean enabled = true;
        private String prefix = "vpn_selector";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }
}
