package fr.lapetina.vpn.selector.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import fr.lapetina.vpn.selector.api.dto.SelectionEntry;
import fr.lapetina.vpn.selector.domain.model.ScoredCandidate;
import fr.lapetina.vpn.selector.domain.model.SelectionKey;

import java.io.UncheckedIOException;
import java.util.List;
import java.util.Map;

/**
 * Renders a best-servers table as a JSON array, one entry per key in table order.
 */
public final class SelectionReportWriter {

    private final ObjectMapper objectMapper;

    public SelectionReportWriter() {
        this.objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public List<SelectionEntry> toEntries(Map<SelectionKey, ScoredCandidate> table) {
        return table.entrySet().stream()
                .map(e -> SelectionEntry.of(e.getKey(), e.getValue()))
                .toList();
    }

    public String toJson(Map<SelectionKey, ScoredCandidate> table) {
        try {
            return objectMapper.writeValueAsString(toEntries(table));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to render selection report", e);
        }
    }
}
