package fr.lapetina.vpn.selector.infrastructure.probe;

import fr.lapetina.vpn.selector.domain.model.ProbeResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.time.Duration;
import java.util.Arrays;

/**
 * Probes by timing TCP connection establishment to a fixed port.
 * Useful where ICMP is filtered but the VPN's TCP port is open.
 */
public final class TcpConnectProber implements NetworkProber {

    private static final Logger log = LoggerFactory.getLogger(TcpConnectProber.class);

    private final int port;
    private final int timeoutMs;

    public TcpConnectProber(int port, Duration attemptTimeout) {
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("port must be within [1, 65535]: " + port);
        }
        this.port = port;
        this.timeoutMs = (int) Math.max(1, attemptTimeout.toMillis());
    }

    @Override
    public String getName() {
        return "tcp-connect";
    }

    @Override
    public ProbeResult probe(String host, int attempts) {
        NetworkProber.requireAttempts(attempts);

        long[] samples = new long[attempts];
        Arrays.fill(samples, -1);
        for (int i = 0; i < attempts; i++) {
            samples[i] = connectOnce(host);
        }

        ProbeResult result = ProbeResult.fromSamples(samples);
        log.debug("TCP probe finished: host={}, port={}, result={}", host, port, result);
        return result;
    }

    private long connectOnce(String host) {
        long start = System.nanoTime();
        try (Socket socket = new Socket()) {
            socket.setTcpNoDelay(true);
            socket.connect(new InetSocketAddress(host, port), timeoutMs);
            return (System.nanoTime() - start) / 1_000_000;
        } catch (IOException | IllegalArgumentException e) {
            log.trace("TCP attempt failed: host={}, port={}", host, port, e);
            return -1;
        }
    }

    public int getPort() {
        return port;
    }
}
