package fr.lapetina.vpn.selector.infrastructure.probe;

import fr.lapetina.vpn.selector.domain.model.ProbeResult;

/**
 * Measures round-trip time and packet loss to a host.
 *
 * Implementations must be thread-safe as one instance is shared by every
 * evaluation worker. Unreachability is a normal outcome reported through
 * {@link ProbeResult#lossPercent()}, never an exception.
 */
public interface NetworkProber {

    /**
     * Returns the name of this prober for configuration and logging.
     */
    String getName();

    /**
     * Probes the host {@code attempts} times, each attempt bounded by the prober's timeout.
     *
     * @param host     host name or address
     * @param attempts number of probe attempts, at least 1
     * @return mean latency of the answered attempts and share of lost ones
     * @throws IllegalArgumentException if {@code attempts < 1}
     */
    ProbeResult probe(String host, int attempts);

    static void requireAttempts(int attempts) {
        if (attempts < 1) {
            throw new IllegalArgumentException("attempts must be at least 1: " + attempts);
        }
    }
}
