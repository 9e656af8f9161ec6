package fr.lapetina.vpn.selector.infrastructure.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Centralized metrics registry using Micrometer.
 *
 * Provides:
 * - Probe latency histogram
 * - Candidate counters by outcome
 * - Accepted offer counter
 * - Worker pool width gauge
 * - Prometheus exposition
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    private final PrometheusMeterRegistry registry;
    private final Timer probeTimer;
    private final Timer runTimer;
    private final Counter acceptedOffers;
    private final Map<ProbeOutcome, Counter> outcomeCounters = new EnumMap<>(ProbeOutcome.class);
    private final AtomicInteger parallelism = new AtomicInteger(0);

    public MetricsRegistry(String prefix) {
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        this.probeTimer = Timer.builder(prefix + "_probe_duration")
                .description("Time spent probing one candidate")
                .publishPercentileHistogram()
                .publishPercentiles(0.5, 0.9, 0.99)
                .register(registry);

        this.runTimer = Timer.builder(prefix + "_evaluation_duration")
                .description("Duration of a full evaluation run")
                .register(registry);

        this.acceptedOffers = Counter.builder(prefix + "_offers_accepted_total")
                .description("Offers that became the best server for their key")
                .register(registry);

        for (ProbeOutcome outcome : ProbeOutcome.values()) {
            outcomeCounters.put(outcome, Counter.builder(prefix + "_candidates_total")
                    .description("Evaluated candidates by outcome")
                    .tag("outcome", outcome.name().toLowerCase())
                    .register(registry));
        }

        Gauge.builder(prefix + "_parallelism", parallelism, AtomicInteger::get)
                .description("Worker count of the latest evaluation run")
                .register(registry);

        log.info("MetricsRegistry initialized with prefix: {}", prefix);
    }

    public MetricsRegistry() {
        this("vpn_selector");
    }

    public void recordProbe(Duration duration) {
        probeTimer.record(duration);
    }

    public void recordRun(Duration duration) {
        runTimer.record(duration);
    }

    public void incrementOutcome(ProbeOutcome outcome) {
        outcomeCounters.get(outcome).increment();
    }

    public void incrementAcceptedOffers() {
        acceptedOffers.increment();
    }

    public void setParallelism(int value) {
        parallelism.set(value);
    }

    public double getOutcomeCount(ProbeOutcome outcome) {
        return outcomeCounters.get(outcome).count();
    }

    public double getAcceptedOffers() {
        return acceptedOffers.count();
    }

    public int getParallelism() {
        return parallelism.get();
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    /**
     * Returns the underlying Micrometer registry.
     */
    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
    }
}
