package fr.lapetina.vpn.selector.infrastructure.probe;

import fr.lapetina.vpn.selector.domain.model.ProbeResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.Arrays;

/**
 * Probes with {@link InetAddress#isReachable(int)}, which uses ICMP echo when the JVM is
 * privileged and a TCP echo-port connection otherwise.
 */
public final class ReachabilityProber implements NetworkProber {

    private static final Logger log = LoggerFactory.getLogger(ReachabilityProber.class);

    private final int timeoutMs;

    public ReachabilityProber(Duration attemptTimeout) {
        this.timeoutMs = (int) Math.max(1, attemptTimeout.toMillis());
    }

    @Override
    public String getName() {
        return "reachable";
    }

    @Override
    public ProbeResult probe(String host, int attempts) {
        NetworkProber.requireAttempts(attempts);

        InetAddress address;
        try {
            address = InetAddress.getByName(host);
        } catch (UnknownHostException e) {
            log.debug("Host did not resolve: host={}", host);
            return ProbeResult.unreachable();
        }

        long[] samples = new long[attempts];
        Arrays.fill(samples, -1);
        for (int i = 0; i < attempts; i++) {
            long start = System.nanoTime();
            try {
                if (address.isReachable(timeoutMs)) {
                    samples[i] = (System.nanoTime() - start) / 1_000_000;
                }
            } catch (IOException e) {
                log.trace("Reachability attempt failed: host={}, attempt={}", host, i, e);
            }
        }

        ProbeResult result = ProbeResult.fromSamples(samples);
        log.debug("Reachability probe finished: host={}, result={}", host, result);
        return result;
    }
}
