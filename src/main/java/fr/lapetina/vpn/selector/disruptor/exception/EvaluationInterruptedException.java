package fr.lapetina.vpn.selector.disruptor.exception;

/**
 * Thrown when the calling thread is interrupted while an evaluation run is in progress.
 * The interrupt flag is restored before this is thrown.
 */
public final class EvaluationInterruptedException extends RuntimeException {

    private final long pendingCandidates;

    public EvaluationInterruptedException(long pendingCandidates, InterruptedException cause) {
        super("Evaluation interrupted with " + pendingCandidates + " candidates pending", cause);
        this.pendingCandidates = pendingCandidates;
    }

    public long getPendingCandidates() {
        return pendingCandidates;
    }
}
