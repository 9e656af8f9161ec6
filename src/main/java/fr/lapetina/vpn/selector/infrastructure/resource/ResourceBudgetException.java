package fr.lapetina.vpn.selector.infrastructure.resource;

/**
 * Thrown when the descriptor budget cannot be determined reliably.
 * Fatal for the evaluation run: sizing the worker pool blindly could exhaust descriptors.
 */
public final class ResourceBudgetException extends RuntimeException {

    public ResourceBudgetException(String message) {
        super(message);
    }

    public ResourceBudgetException(String message, Throwable cause) {
        super(message, cause);
    }
}
