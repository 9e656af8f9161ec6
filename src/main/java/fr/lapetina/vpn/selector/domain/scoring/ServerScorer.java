package fr.lapetina.vpn.selector.domain.scoring;

import fr.lapetina.vpn.selector.domain.model.ProbeResult;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Turns a server's load and probe measurements into a comparable score.
 *
 * Score is {@code 1 / ln(load + rtt)}, rounded to a fixed number of fractional digits,
 * so it grows as load and latency shrink. Zero is the floor and marks a server
 * that is saturated, lossy or unreachable.
 *
 * Stateless and thread-safe.
 */
public final class ServerScorer {

    public static final int SATURATED_LOAD = 100;
    public static final double DEFAULT_LOSS_CUTOFF_PERCENT = 5.0;
    public static final int DEFAULT_PRECISION = 4;

    private final double lossCutoffPercent;
    private final int precision;
    private final BigDecimal zero;

    public ServerScorer(double lossCutoffPercent, int precision) {
        if (lossCutoffPercent <= 0.0 || lossCutoffPercent > 100.0) {
            throw new IllegalArgumentException("lossCutoffPercent must be within (0, 100]: " + lossCutoffPercent);
        }
        if (precision < 0) {
            throw new IllegalArgumentException("precision must not be negative: " + precision);
        }
        this.lossCutoffPercent = lossCutoffPercent;
        this.precision = precision;
        this.zero = BigDecimal.ZERO.setScale(precision);
    }

    public ServerScorer() {
        this(DEFAULT_LOSS_CUTOFF_PERCENT, DEFAULT_PRECISION);
    }

    /**
     * A fully loaded server is never probed; it keeps the floor score.
     */
    public boolean isSaturated(int load) {
        return load >= SATURATED_LOAD;
    }

    public boolean isLossy(ProbeResult probe) {
        return probe.lossPercent() >= lossCutoffPercent;
    }

    /**
     * Scores a server from its load and probe result.
     *
     * @param load  utilisation percentage reported by the provider
     * @param probe measurements, ignored when the server is saturated
     * @return score with {@code precision} fractional digits, never negative
     */
    public BigDecimal score(int load, ProbeResult probe) {
        if (isSaturated(load) || probe == null || isLossy(probe) || !probe.isReachable()) {
            return zero;
        }

        double base = load + probe.roundTripMillis().getAsDouble();
        // ln(x) <= 0 for x <= 1
        if (!Double.isFinite(base) || base <= 1.0) {
            return zero;
        }

        double raw = 1.0 / Math.log(base);
        if (!Double.isFinite(raw)) {
            return zero;
        }
        return BigDecimal.valueOf(raw).setScale(precision, RoundingMode.HALF_EVEN);
    }

    /**
     * Score given to saturated or failed candidates.
     */
    public BigDecimal floor() {
        return zero;
    }

    public double getLossCutoffPercent() {
        return lossCutoffPercent;
    }

    public int getPrecision() {
        return precision;
    }
}
