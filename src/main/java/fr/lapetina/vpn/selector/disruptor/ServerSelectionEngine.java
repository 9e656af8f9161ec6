package fr.lapetina.vpn.selector.disruptor;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.BusySpinWaitStrategy;
import com.lmax.disruptor.ExceptionHandler;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.SleepingWaitStrategy;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.YieldingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import fr.lapetina.vpn.selector.disruptor.exception.EvaluationInterruptedException;
import fr.lapetina.vpn.selector.disruptor.handlers.CandidateEvaluationHandler;
import fr.lapetina.vpn.selector.domain.event.EvaluationEvent;
import fr.lapetina.vpn.selector.domain.event.EvaluationEventFactory;
import fr.lapetina.vpn.selector.domain.model.CandidateServer;
import fr.lapetina.vpn.selector.domain.model.Protocol;
import fr.lapetina.vpn.selector.domain.model.ProviderCatalog;
import fr.lapetina.vpn.selector.domain.model.ScoredCandidate;
import fr.lapetina.vpn.selector.domain.model.SelectionKey;
import fr.lapetina.vpn.selector.domain.naming.ConnectionNamer;
import fr.lapetina.vpn.selector.domain.scoring.ServerScorer;
import fr.lapetina.vpn.selector.domain.selection.BestServerTable;
import fr.lapetina.vpn.selector.infrastructure.config.SelectorConfig;
import fr.lapetina.vpn.selector.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.vpn.selector.infrastructure.probe.NetworkProber;
import fr.lapetina.vpn.selector.infrastructure.resource.ConcurrencyController;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Evaluates candidate servers concurrently and keeps the best one per
 * (country, category, protocol).
 *
 * Each call to {@link #evaluate} builds its own Disruptor whose ring buffer feeds a pool
 * of competing workers. The pool width comes from the {@link ConcurrencyController},
 * so the number of probes in flight stays within the process's descriptor budget.
 * Publishing blocks while the ring is full, which queues surplus candidates until a
 * worker frees up.
 *
 * WAIT STRATEGY CHOICE: Configurable (default BlockingWaitStrategy)
 *
 * Workers spend nearly all their time waiting on the network, so spinning
 * strategies only burn CPU here. They stay available for benchmarking against
 * local stub probers.
 */
public final class ServerSelectionEngine {

    private static final Logger log = LoggerFactory.getLogger(ServerSelectionEngine.class);

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 5;

    private final NetworkProber prober;
    private final ServerScorer scorer;
    private final ConnectionNamer namer;
    private final ProviderCatalog catalog;
    private final ConcurrencyController concurrencyController;
    private final MetricsRegistry metricsRegistry;
    private final int maxRingBufferSize;
    private final String waitStrategy;
    private final AtomicInteger runCounter = new AtomicInteger(0);

    private ServerSelectionEngine(Builder builder) {
        this.prober = builder.prober;
        this.scorer = builder.scorer;
        this.catalog = builder.catalog;
        this.namer = builder.namer != null ? builder.namer : new ConnectionNamer(builder.catalog);
        this.concurrencyController = builder.concurrencyController;
        this.metricsRegistry = builder.metricsRegistry;
        this.maxRingBufferSize = builder.ringBufferSize;
        this.waitStrategy = builder.waitStrategy;

        log.info("ServerSelectionEngine created: prober={}, ringBufferSize={}, waitStrategy={}",
                prober.getName(), maxRingBufferSize, waitStrategy);
    }

    /**
     * Probes and scores every candidate, then returns the best server per key.
     * Blocks until every candidate has been evaluated.
     *
     * @param candidates       servers to evaluate; null entries are skipped
     * @param probeAttempts    probe attempts per candidate, at least 1
     * @param allowedProtocols protocols to consider; a candidate only offers the ones it supports
     * @return unmodifiable table sorted by key
     * @throws IllegalArgumentException if {@code probeAttempts < 1}
     * @throws fr.lapetina.vpn.selector.infrastructure.resource.ResourceBudgetException
     *         if the descriptor budget cannot be determined
     * @throws EvaluationInterruptedException if the calling thread is interrupted while waiting
     */
    public Map<SelectionKey, ScoredCandidate> evaluate(
            Collection<CandidateServer> candidates,
            int probeAttempts,
            Set<Protocol> allowedProtocols
    ) {
        if (probeAttempts < 1) {
            throw new IllegalArgumentException("probeAttempts must be at least 1: " + probeAttempts);
        }
        Set<Protocol> protocols = allowedProtocols == null || allowedProtocols.isEmpty()
                ? EnumSet.noneOf(Protocol.class)
                : EnumSet.copyOf(allowedProtocols);
        List<CandidateServer> accepted = dropNulls(candidates);

        BestServerTable table = new BestServerTable();
        int runId = runCounter.incrementAndGet();

        if (accepted.isEmpty()) {
            log.info("Evaluation skipped, no candidates: runId={}", runId);
            table.start();
            table.drain();
            return table.snapshot();
        }

        int workers = concurrencyController.degreeOfParallelism(accepted.size());
        if (metricsRegistry != null) {
            metricsRegistry.setParallelism(workers);
        }

        log.info("Evaluation started: runId={}, candidates={}, workers={}, probeAttempts={}, protocols={}",
                runId, accepted.size(), workers, probeAttempts, protocols);
        long start = System.nanoTime();

        CountDownLatch remaining = new CountDownLatch(accepted.size());
        Disruptor<EvaluationEvent> disruptor = createDisruptor(runId, ringBufferSize(accepted.size()));

        CandidateEvaluationHandler[] handlers = new CandidateEvaluationHandler[workers];
        for (int i = 0; i < workers; i++) {
            handlers[i] = new CandidateEvaluationHandler(
                    prober, scorer, namer, catalog, table, metricsRegistry,
                    protocols, probeAttempts, remaining);
        }
        disruptor.handleEventsWithWorkerPool(handlers);
        disruptor.setDefaultExceptionHandler(new EvaluationExceptionHandler());

        table.start();
        disruptor.start();
        try {
            publishAll(disruptor.getRingBuffer(), accepted);
            remaining.await();
        } catch (InterruptedException e) {
            disruptor.halt();
            Thread.currentThread().interrupt();
            log.warn("Evaluation interrupted: runId={}, pending={}", runId, remaining.getCount());
            throw new EvaluationInterruptedException(remaining.getCount(), e);
        }
        shutdown(disruptor, runId);

        table.drain();
        Map<SelectionKey, ScoredCandidate> result = table.snapshot();

        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
        if (metricsRegistry != null) {
            metricsRegistry.recordRun(elapsed);
        }
        log.info("Evaluation finished: runId={}, candidates={}, keys={}, elapsedMs={}",
                runId, accepted.size(), result.size(), elapsed.toMillis());
        return result;
    }

    private static List<CandidateServer> dropNulls(Collection<CandidateServer> candidates) {
        List<CandidateServer> accepted = new ArrayList<>();
        if (candidates == null) {
            return accepted;
        }
        int index = 0;
        for (CandidateServer candidate : candidates) {
            if (candidate == null) {
                log.warn("Skipping null candidate: index={}", index);
            } else {
                accepted.add(candidate);
            }
            index++;
        }
        return accepted;
    }

    private static void publishAll(RingBuffer<EvaluationEvent> ringBuffer, List<CandidateServer> candidates) {
        for (int i = 0; i < candidates.size(); i++) {
            // Blocks while every slot is still held by a worker
            long sequence = ringBuffer.next();
            try {
                ringBuffer.get(sequence).initialize(candidates.get(i), i);
            } finally {
                ringBuffer.publish(sequence);
            }
        }
    }

    private void shutdown(Disruptor<EvaluationEvent> disruptor, int runId) {
        try {
            disruptor.shutdown(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            log.warn("Worker pool shutdown timed out, halting: runId={}", runId);
            disruptor.halt();
        }
    }

    private Disruptor<EvaluationEvent> createDisruptor(int runId, int ringBufferSize) {
        return new Disruptor<>(
                new EvaluationEventFactory(),
                ringBufferSize,
                new WorkerThreadFactory("selector-" + runId + "-worker"),
                ProducerType.SINGLE, // Only the calling thread publishes
                createWaitStrategy(waitStrategy)
        );
    }

    /**
     * Smallest power of two holding every candidate, capped at the configured size.
     */
    int ringBufferSize(int candidateCount) {
        int size = Integer.highestOneBit(Math.max(1, candidateCount));
        if (size < candidateCount) {
            size <<= 1;
        }
        return Math.min(size, maxRingBufferSize);
    }

    private static WaitStrategy createWaitStrategy(String name) {
        return switch (name.toLowerCase()) {
            case "blocking" -> new BlockingWaitStrategy();
            case "yielding" -> new YieldingWaitStrategy();
            case "busy-spin" -> new BusySpinWaitStrategy();
            case "sleeping" -> new SleepingWaitStrategy();
            default -> {
                log.warn("Unknown wait strategy '{}', using BlockingWaitStrategy", name);
                yield new BlockingWaitStrategy();
            }
        };
    }

    public NetworkProber getProber() {
        return prober;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Thread factory for evaluation workers.
     */
    private static class WorkerThreadFactory implements ThreadFactory {
        private final String namePrefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        WorkerThreadFactory(String namePrefix) {
            this.namePrefix = namePrefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, namePrefix + "-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }

    /**
     * Logs anything escaping a worker. The worker has already counted its event down.
     */
    private static class EvaluationExceptionHandler implements ExceptionHandler<EvaluationEvent> {

        private static final Logger log = LoggerFactory.getLogger(EvaluationExceptionHandler.class);

        @Override
        public void handleEventException(Throwable ex, long sequence, EvaluationEvent event) {
            log.error("Exception in evaluation worker: sequence={}, event={}", sequence, event, ex);
        }

        @Override
        public void handleOnStartException(Throwable ex) {
            log.error("Exception during worker pool start", ex);
        }

        @Override
        public void handleOnShutdownException(Throwable ex) {
            log.error("Exception during worker pool shutdown", ex);
        }
    }

    /**
     * Builder for ServerSelectionEngine.
     */
    public static final class Builder {
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";
        private NetworkProber prober;
        private ServerScorer scorer = new ServerScorer();
        private ProviderCatalog catalog = ProviderCatalog.nordVpn();
        private ConnectionNamer namer;
        private ConcurrencyController concurrencyController;
        private MetricsRegistry metricsRegistry;

        public Builder ringBufferSize(int size) {
            // Must be power of 2
            if (Integer.bitCount(size) != 1) {
                throw new IllegalArgumentException("Ring buffer size must be power of 2");
            }
            this.ringBufferSize = size;
            return this;
        }

        public Builder waitStrategy(String strategy) {
            this.waitStrategy = strategy;
            return this;
        }

        public Builder prober(NetworkProber prober) {
            this.prober = prober;
            return this;
        }

        public Builder scorer(ServerScorer scorer) {
            this.scorer = scorer;
            return this;
        }

        public Builder catalog(ProviderCatalog catalog) {
            this.catalog = catalog;
            return this;
        }

        public Builder namer(ConnectionNamer namer) {
            this.namer = namer;
            return this;
        }

        public Builder concurrencyController(ConcurrencyController controller) {
            this.concurrencyController = controller;
            return this;
        }

        public Builder metricsRegistry(MetricsRegistry registry) {
            this.metricsRegistry = registry;
            return this;
        }

        public Builder fromConfig(SelectorConfig config) {
            this.ringBufferSize = config.getConcurrency().getRingBufferSize();
            this.waitStrategy = config.getConcurrency().getWaitStrategy();
            this.scorer = new ServerScorer(
                    config.getScoring().getLossCutoffPercent(),
                    config.getScoring().getPrecision());
            return this;
        }

        public ServerSelectionEngine build() {
            if (prober == null) {
                throw new IllegalStateException("NetworkProber is required");
            }
            if (scorer == null) {
                throw new IllegalStateException("ServerScorer is required");
            }
            if (catalog == null) {
                throw new IllegalStateException("ProviderCatalog is required");
            }
            if (concurrencyController == null) {
                throw new IllegalStateException("ConcurrencyController is required");
            }
            return new ServerSelectionEngine(this);
        }
    }
}
