package fr.lapetina.vpn.selector.domain.selection;

/**
 * Lifecycle of a best-servers table within one evaluation run.
 * Transitions only move forward.
 */
public enum TableState {
    /** Created, no worker started yet */
    IDLE,

    /** Workers are offering candidates */
    RUNNING,

    /** All workers have finished */
    DRAINED,

    /** Snapshot handed to the caller */
    FINALIZED
}
