package fr.lapetina.vpn.selector.domain.selection;

import fr.lapetina.vpn.selector.domain.model.ScoredCandidate;
import fr.lapetina.vpn.selector.domain.model.SelectionKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Keeps the highest-scoring candidate per (country, category, protocol).
 *
 * Each {@link #offer} is a single atomic compare-and-replace on its key, so workers may
 * offer concurrently in any order. An empty bucket accepts any candidate; an occupied one
 * is taken over by a strictly higher score, or by an equal score from an earlier position
 * in the candidate list. The final table therefore does not depend on completion order.
 *
 * One instance serves exactly one evaluation run.
 */
public final class BestServerTable {

    private static final Logger log = LoggerFactory.getLogger(BestServerTable.class);

    private final Map<SelectionKey, ScoredCandidate> best = new ConcurrentHashMap<>();
    private final AtomicReference<TableState> state = new AtomicReference<>(TableState.IDLE);

    public void start() {
        transition(TableState.IDLE, TableState.RUNNING);
    }

    /**
     * Offers a candidate for a bucket.
     *
     * @return true if the candidate now holds the bucket
     */
    public boolean offer(SelectionKey key, ScoredCandidate candidate) {
        TableState current = state.get();
        if (current != TableState.RUNNING) {
            throw new IllegalStateException("Offers are only accepted while running, state=" + current);
        }

        boolean[] accepted = new boolean[1];
        best.compute(key, (k, incumbent) -> {
            if (incumbent == null || candidate.outranks(incumbent)) {
                accepted[0] = true;
                return candidate;
            }
            return incumbent;
        });

        if (accepted[0]) {
            log.debug("New best server: key={}, name={}, score={}", key, candidate.connectionName(), candidate.score());
        }
        return accepted[0];
    }

    public Optional<ScoredCandidate> get(SelectionKey key) {
        return Optional.ofNullable(best.get(key));
    }

    public int size() {
        return best.size();
    }

    /**
     * Marks that no further offers will arrive.
     */
    public void drain() {
        transition(TableState.RUNNING, TableState.DRAINED);
    }

    /**
     * Returns the final table sorted by key and moves to {@link TableState#FINALIZED}.
     */
    public Map<SelectionKey, ScoredCandidate> snapshot() {
        transition(TableState.DRAINED, TableState.FINALIZED);
        return Collections.unmodifiableMap(new TreeMap<>(best));
    }

    public TableState getState() {
        return state.get();
    }

    private void transition(TableState expected, TableState next) {
        if (!state.compareAndSet(expected, next)) {
            throw new IllegalStateException(
                    "Illegal table transition: expected=" + expected + ", actual=" + state.get() + ", next=" + next);
        }
    }
}
