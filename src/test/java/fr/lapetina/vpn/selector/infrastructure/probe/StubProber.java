package fr.lapetina.vpn.selector.infrastructure.probe;

import fr.lapetina.vpn.selector.domain.model.ProbeResult;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Prober returning canned results per host, recording every call and the
 * highest number of probes seen in flight at once.
 */
public final class StubProber implements NetworkProber {

    private final Map<String, ProbeResult> results = new ConcurrentHashMap<>();
    private final Map<String, RuntimeException> failures = new ConcurrentHashMap<>();
    private final Map<String, Long> hostDelays = new ConcurrentHashMap<>();
    private final List<String> probedHosts = new CopyOnWriteArrayList<>();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger maxInFlight = new AtomicInteger();
    private volatile long delayMillis;

    public StubProber respond(String host, double roundTripMillis, double lossPercent) {
        results.put(host, ProbeResult.of(roundTripMillis, lossPercent));
        return this;
    }

    public StubProber respond(String host, ProbeResult result) {
        results.put(host, result);
        return this;
    }

    public StubProber fail(String host, RuntimeException exception) {
        failures.put(host, exception);
        return this;
    }

    public StubProber delay(long millis) {
        this.delayMillis = millis;
        return this;
    }

    public StubProber delay(String host, long millis) {
        hostDelays.put(host, millis);
        return this;
    }

    @Override
    public String getName() {
        return "stub";
    }

    @Override
    public ProbeResult probe(String host, int attempts) {
        NetworkProber.requireAttempts(attempts);
        probedHosts.add(host);
        int current = inFlight.incrementAndGet();
        maxInFlight.accumulateAndGet(current, Math::max);
        try {
            long sleep = hostDelays.getOrDefault(host, delayMillis);
            if (sleep > 0) {
                Thread.sleep(sleep);
            }
            RuntimeException failure = failures.get(host);
            if (failure != null) {
                throw failure;
            }
            return results.getOrDefault(host, ProbeResult.unreachable());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ProbeResult.unreachable();
        } finally {
            inFlight.decrementAndGet();
        }
    }

    public List<String> getProbedHosts() {
        return probedHosts;
    }

    public int getMaxInFlight() {
        return maxInFlight.get();
    }
}
