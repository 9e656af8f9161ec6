package fr.lapetina.vpn.selector.domain.model;

import java.util.OptionalDouble;

/**
 * Outcome of probing one host a fixed number of times.
 *
 * @param roundTripMillis mean latency of the answered attempts, empty when nothing answered
 * @param lossPercent     share of unanswered attempts, 0 to 100
 */
public record ProbeResult(OptionalDouble roundTripMillis, double lossPercent) {

    private static final ProbeResult UNREACHABLE = new ProbeResult(OptionalDouble.empty(), 100.0);

    public ProbeResult {
        if (roundTripMillis == null) {
            roundTripMillis = OptionalDouble.empty();
        }
        if (lossPercent < 0.0 || lossPercent > 100.0 || Double.isNaN(lossPercent)) {
            throw new IllegalArgumentException("lossPercent must be within [0, 100]: " + lossPercent);
        }
    }

    public static ProbeResult of(double roundTripMillis, double lossPercent) {
        return new ProbeResult(OptionalDouble.of(roundTripMillis), lossPercent);
    }

    /**
     * Result for a host that answered none of the attempts.
     */
    public static ProbeResult unreachable() {
        return UNREACHABLE;
    }

    /**
     * Builds a result from per-attempt samples, where a negative sample marks a lost attempt.
     */
    public static ProbeResult fromSamples(long[] samplesMillis) {
        if (samplesMillis.length == 0) {
            return UNREACHABLE;
        }
        long total = 0;
        int answered = 0;
        for (long sample : samplesMillis) {
            if (sample >= 0) {
                total += sample;
                answered++;
            }
        }
        if (answered == 0) {
            return UNREACHABLE;
        }
        double loss = 100.0 * (samplesMillis.length - answered) / samplesMillis.length;
        return of((double) total / answered, loss);
    }

    public boolean isReachable() {
        return roundTripMillis.isPresent();
    }
}
