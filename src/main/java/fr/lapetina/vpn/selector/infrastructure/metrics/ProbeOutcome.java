package fr.lapetina.vpn.selector.infrastructure.metrics;

/**
 * How the evaluation of one candidate ended, for metrics and logging.
 */
public enum ProbeOutcome {
    /** Probed and given a positive score */
    SCORED,

    /** Load at 100%, not probed */
    SATURATED,

    /** Packet loss at or above the cutoff */
    LOSSY,

    /** No attempt answered, or the measurements could not be scored */
    UNREACHABLE,

    /** Evaluation threw and the candidate was given the floor score */
    FAILED,

    /** No allowed protocol or no category, nothing to offer */
    SKIPPED
}
