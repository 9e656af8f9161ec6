package fr.lapetina.vpn.selector.domain.model;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * A candidate after probing and scoring, as stored in the best-servers table.
 *
 * @param position index of the server in the submitted candidate list, used to break score ties
 */
public record ScoredCandidate(String connectionName, String domain, BigDecimal score, int position) {

    public ScoredCandidate {
        Objects.requireNonNull(connectionName, "connectionName is required");
        Objects.requireNonNull(domain, "domain is required");
        Objects.requireNonNull(score, "score is required");
        if (score.signum() < 0) {
            throw new IllegalArgumentException("score must not be negative: " + score);
        }
        if (position < 0) {
            throw new IllegalArgumentException("position must not be negative: " + position);
        }
    }

    /**
     * True when this candidate should take a bucket held by {@code other}: a higher score,
     * or an equal score from an earlier list position.
     */
    public boolean outranks(ScoredCandidate other) {
        int byScore = score.compareTo(other.score);
        return byScore > 0 || (byScore == 0 && position < other.position);
    }
}
