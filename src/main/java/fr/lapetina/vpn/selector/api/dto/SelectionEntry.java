package fr.lapetina.vpn.selector.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import fr.lapetina.vpn.selector.domain.model.ScoredCandidate;
import fr.lapetina.vpn.selector.domain.model.SelectionKey;

import java.math.BigDecimal;

/**
 * One row of the selection report.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SelectionEntry(
        @JsonProperty("country") String country,
        @JsonProperty("category") String category,
        @JsonProperty("protocol") String protocol,
        @JsonProperty("name") String name,
        @JsonProperty("domain") String domain,
        @JsonProperty("score") BigDecimal score
) {
    public static SelectionEntry of(SelectionKey key, ScoredCandidate candidate) {
        return new SelectionEntry(
                key.countryCode(),
                key.categoryName(),
                key.protocol().id(),
                candidate.connectionName(),
                candidate.domain(),
                candidate.score()
        );
    }
}
