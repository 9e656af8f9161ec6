package fr.lapetina.vpn.selector.infrastructure.probe;

import fr.lapetina.vpn.selector.domain.model.ProbeResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Probes with the operating system's {@code ping} utility (ICMP echo).
 *
 * Runs {@code ping -n -q -c <attempts> -W <seconds> <host>} and reads the summary lines.
 * The flags follow the Linux iputils syntax.
 */
public final class SystemPingProber implements NetworkProber {

    private static final Logger log = LoggerFactory.getLogger(SystemPingProber.class);

    private static final Pattern LOSS = Pattern.compile("([\\d.]+)% packet loss");
    private static final Pattern RTT = Pattern.compile("= ([\\d.]+)/([\\d.]+)/([\\d.]+)");

    private final String command;
    private final Duration attemptTimeout;

    public SystemPingProber(String command, Duration attemptTimeout) {
        this.command = command;
        this.attemptTimeout = attemptTimeout;
    }

    public SystemPingProber(Duration attemptTimeout) {
        this("ping", attemptTimeout);
    }

    @Override
    public String getName() {
        return "ping";
    }

    @Override
    public ProbeResult probe(String host, int attempts) {
        NetworkProber.requireAttempts(attempts);
        if (host == null || host.isBlank() || host.startsWith("-")) {
            log.warn("Refusing to ping invalid host: host={}", host);
            return ProbeResult.unreachable();
        }

        long timeoutSeconds = Math.max(1, (attemptTimeout.toMillis() + 999) / 1000);
        List<String> cmd = new ArrayList<>(List.of(
                command, "-n", "-q",
                "-c", String.valueOf(attempts),
                "-W", String.valueOf(timeoutSeconds),
                host));

        Process process;
        try {
            process = new ProcessBuilder(cmd).redirectErrorStream(true).start();
        } catch (IOException e) {
            log.warn("Failed to start ping: host={}, command={}, error={}", host, command, e.getMessage());
            return ProbeResult.unreachable();
        }

        // ping sends one request per second
        long deadlineSeconds = attempts * (timeoutSeconds + 1) + 1;
        try {
            if (!process.waitFor(deadlineSeconds, TimeUnit.SECONDS)) {
                log.warn("Ping did not finish in time: host={}, deadlineSeconds={}", host, deadlineSeconds);
                process.destroyForcibly();
                return ProbeResult.unreachable();
            }
            String output = readOutput(process);
            ProbeResult result = parse(output).orElseGet(() -> {
                log.debug("Unparseable ping output: host={}, exitCode={}, output={}",
                        host, process.exitValue(), output.trim());
                return ProbeResult.unreachable();
            });
            log.debug("Ping finished: host={}, result={}", host, result);
            return result;
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            return ProbeResult.unreachable();
        } catch (IOException e) {
            log.warn("Failed to read ping output: host={}, error={}", host, e.getMessage());
            return ProbeResult.unreachable();
        }
    }

    private static String readOutput(Process process) throws IOException {
        try (InputStream in = process.getInputStream()) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    /**
     * Extracts loss and average round-trip time from ping's summary.
     * Empty when the loss line is missing.
     */
    static Optional<ProbeResult> parse(String output) {
        Matcher loss = LOSS.matcher(output);
        if (!loss.find()) {
            return Optional.empty();
        }
        double lossPercent;
        try {
            lossPercent = Math.min(100.0, Double.parseDouble(loss.group(1)));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }

        Matcher rtt = RTT.matcher(output);
        if (lossPercent >= 100.0 || !rtt.find()) {
            return Optional.of(ProbeResult.unreachable());
        }
        return Optional.of(ProbeResult.of(Double.parseDouble(rtt.group(2)), lossPercent));
    }
}
