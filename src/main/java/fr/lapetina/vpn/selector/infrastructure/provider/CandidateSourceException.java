package fr.lapetina.vpn.selector.infrastructure.provider;

/**
 * Thrown when the candidate server list cannot be read at all.
 * Individual malformed entries are skipped rather than reported through this exception.
 */
public final class CandidateSourceException extends RuntimeException {

    public CandidateSourceException(String message) {
        super(message);
    }

    public CandidateSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
