package fr.lapetina.vpn.selector.domain.model;

/**
 * Thrown when a candidate server is missing a required field or carries an
 * out-of-range value.
 */
public final class InvalidCandidateException extends RuntimeException {

    public InvalidCandidateException(String message) {
        super(message);
    }
}
