package fr.lapetina.vpn.selector.disruptor.handlers;

import com.lmax.disruptor.WorkHandler;
import fr.lapetina.vpn.selector.domain.event.EvaluationEvent;
import fr.lapetina.vpn.selector.domain.model.CandidateServer;
import fr.lapetina.vpn.selector.domain.model.ProbeResult;
import fr.lapetina.vpn.selector.domain.model.Protocol;
import fr.lapetina.vpn.selector.domain.model.ProviderCatalog;
import fr.lapetina.vpn.selector.domain.model.ScoredCandidate;
import fr.lapetina.vpn.selector.domain.model.SelectionKey;
import fr.lapetina.vpn.selector.domain.naming.ConnectionNamer;
import fr.lapetina.vpn.selector.domain.scoring.ServerScorer;
import fr.lapetina.vpn.selector.domain.selection.BestServerTable;
import fr.lapetina.vpn.selector.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.vpn.selector.infrastructure.metrics.ProbeOutcome;
import fr.lapetina.vpn.selector.infrastructure.probe.NetworkProber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;
import java.util.concurrent.CountDownLatch;

/**
 * Worker of the evaluation pool: takes one candidate end-to-end through
 * probe, score, name and offer.
 *
 * Failures while probing or scoring are absorbed here; the candidate keeps the floor
 * score and is still offered. The run latch is counted down for every event, whatever
 * the outcome.
 */
public final class CandidateEvaluationHandler implements WorkHandler<EvaluationEvent> {

    private static final Logger log = LoggerFactory.getLogger(CandidateEvaluationHandler.class);

    private final NetworkProber prober;
    private final ServerScorer scorer;
    private final ConnectionNamer namer;
    private final ProviderCatalog catalog;
    private final BestServerTable table;
    private final MetricsRegistry metrics;
    private final Set<Protocol> allowedProtocols;
    private final int probeAttempts;
    private final CountDownLatch remaining;

    public CandidateEvaluationHandler(
            NetworkProber prober,
            ServerScorer scorer,
            ConnectionNamer namer,
            ProviderCatalog catalog,
            BestServerTable table,
            MetricsRegistry metrics,
            Set<Protocol> allowedProtocols,
            int probeAttempts,
            CountDownLatch remaining
    ) {
        this.prober = prober;
        this.scorer = scorer;
        this.namer = namer;
        this.catalog = catalog;
        this.table = table;
        this.metrics = metrics;
        this.allowedProtocols = allowedProtocols;
        this.probeAttempts = probeAttempts;
        this.remaining = remaining;
    }

    @Override
    public void onEvent(EvaluationEvent event) {
        CandidateServer candidate = event.getCandidate();
        try {
            evaluate(candidate, event.getPosition());
        } finally {
            event.clear();
            remaining.countDown();
        }
    }

    void evaluate(CandidateServer candidate, int position) {
        Set<Protocol> protocols = EnumSet.noneOf(Protocol.class);
        for (Protocol protocol : candidate.getProtocols()) {
            if (allowedProtocols.contains(protocol)) {
                protocols.add(protocol);
            }
        }
        if (protocols.isEmpty() || candidate.getCategories().isEmpty()) {
            log.debug("Candidate has nothing to offer: domain={}, protocols={}, categories={}",
                    candidate.getDomain(), candidate.getProtocols(), candidate.getCategories());
            record(ProbeOutcome.SKIPPED);
            return;
        }

        BigDecimal score;
        ProbeOutcome outcome;
        try {
            if (scorer.isSaturated(candidate.getLoad())) {
                score = scorer.floor();
                outcome = ProbeOutcome.SATURATED;
            } else {
                long start = System.nanoTime();
                ProbeResult probe = prober.probe(candidate.getDomain(), probeAttempts);
                if (metrics != null) {
                    metrics.recordProbe(Duration.ofNanos(System.nanoTime() - start));
                }
                score = scorer.score(candidate.getLoad(), probe);
                outcome = classify(probe, score);
            }
        } catch (RuntimeException e) {
            log.error("Candidate evaluation failed, using floor score: domain={}", candidate.getDomain(), e);
            score = scorer.floor();
            outcome = ProbeOutcome.FAILED;
        }
        record(outcome);

        log.debug("Candidate scored: domain={}, position={}, load={}, score={}, outcome={}",
                candidate.getDomain(), position, candidate.getLoad(), score, outcome);

        for (String category : candidate.getCategories()) {
            String categoryName = catalog.categoryLabel(category);
            for (Protocol protocol : protocols) {
                SelectionKey key = new SelectionKey(candidate.getCountryCode(), categoryName, protocol);
                ScoredCandidate scored = new ScoredCandidate(
                        namer.name(candidate, protocol), candidate.getDomain(), score, position);
                if (table.offer(key, scored) && metrics != null) {
                    metrics.incrementAcceptedOffers();
                }
            }
        }
    }

    private ProbeOutcome classify(ProbeResult probe, BigDecimal score) {
        if (score.signum() > 0) {
            return ProbeOutcome.SCORED;
        }
        if (probe != null && probe.isReachable() && scorer.isLossy(probe)) {
            return ProbeOutcome.LOSSY;
        }
        return ProbeOutcome.UNREACHABLE;
    }

    private void record(ProbeOutcome outcome) {
        if (metrics != null) {
            metrics.incrementOutcome(outcome);
        }
    }
}
