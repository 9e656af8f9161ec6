package fr.lapetina.vpn.selector.domain.event;

import fr.lapetina.vpn.selector.domain.model.CandidateServer;

/**
 * Ring buffer slot carrying one candidate to an evaluation worker.
 *
 * Mutable and reused across the ring buffer; only the publisher and the
 * worker that claimed the slot touch it.
 */
public final class EvaluationEvent {

    private CandidateServer candidate;
    private int position;

    public void clear() {
        this.candidate = null;
        this.position = -1;
    }

    public void initialize(CandidateServer candidate, int position) {
        this.candidate = candidate;
        this.position = position;
    }

    public CandidateServer getCandidate() {
        return candidate;
    }

    /**
     * Index of the candidate in the submitted list.
     */
    public int getPosition() {
        return position;
    }

    @Override
    public String toString() {
        return "EvaluationEvent{position=" + position + ", candidate=" + candidate + '}';
    }
}
