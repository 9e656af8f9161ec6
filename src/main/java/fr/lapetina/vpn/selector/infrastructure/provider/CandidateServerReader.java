package fr.lapetina.vpn.selector.infrastructure.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.vpn.selector.domain.model.CandidateServer;
import fr.lapetina.vpn.selector.domain.model.InvalidCandidateException;
import fr.lapetina.vpn.selector.domain.model.Protocol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the provider's server list into candidate servers.
 *
 * Expected shape, one object per server:
 * <pre>{@code
 * { "domain": "us1234.nordvpn.com", "flag": "US", "load": 12,
 *   "categories": [ { "name": "Standard VPN servers" } ],
 *   "features": { "openvpn_udp": true, "openvpn_tcp": false } }
 * }</pre>
 *
 * Entries missing a required field are skipped with a warning; the rest of the list
 * is still returned.
 */
public final class CandidateServerReader {

    private static final Logger log = LoggerFactory.getLogger(CandidateServerReader.class);

    private final ObjectMapper objectMapper;

    public CandidateServerReader() {
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public List<CandidateServer> read(Path path) {
        log.info("Reading candidate servers from: {}", path);
        try (InputStream in = Files.newInputStream(path)) {
            return read(in);
        } catch (IOException e) {
            throw new CandidateSourceException("Failed to read candidate servers from: " + path, e);
        }
    }

    public List<CandidateServer> read(InputStream in) {
        JsonNode root;
        try {
            root = objectMapper.readTree(in);
        } catch (JsonProcessingException e) {
            throw new CandidateSourceException("Candidate server list is not valid JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new CandidateSourceException("Failed to read candidate server list", e);
        }
        if (root == null || !root.isArray()) {
            throw new CandidateSourceException("Candidate server list must be a JSON array");
        }

        List<CandidateServer> servers = new ArrayList<>(root.size());
        int skipped = 0;
        for (int i = 0; i < root.size(); i++) {
            try {
                servers.add(toCandidate(root.get(i)));
            } catch (InvalidCandidateException e) {
                skipped++;
                log.warn("Skipping malformed candidate: index={}, reason={}", i, e.getMessage());
            }
        }

        log.info("Candidate servers read: accepted={}, skipped={}", servers.size(), skipped);
        return servers;
    }

    CandidateServer toCandidate(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new InvalidCandidateException("entry is not an object");
        }

        JsonNode load = node.get("load");
        if (load == null || !load.isIntegralNumber()) {
            throw new InvalidCandidateException("load is required: domain=" + text(node, "domain"));
        }

        CandidateServer.Builder builder = CandidateServer.builder()
                .domain(text(node, "domain"))
                .countryCode(text(node, "flag"))
                .load(load.asInt());

        JsonNode categories = node.get("categories");
        if (categories == null || !categories.isArray()) {
            throw new InvalidCandidateException("categories are required: domain=" + text(node, "domain"));
        }
        for (JsonNode category : categories) {
            String name = category.isTextual() ? category.asText() : text(category, "name");
            builder.addCategory(name);
        }

        JsonNode features = node.get("features");
        if (features == null || !features.isObject()) {
            throw new InvalidCandidateException("features are required: domain=" + text(node, "domain"));
        }
        if (features.path("openvpn_udp").asBoolean(false)) {
            builder.addProtocol(Protocol.UDP);
        }
        if (features.path("openvpn_tcp").asBoolean(false)) {
            builder.addProtocol(Protocol.TCP);
        }

        return builder.build();
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
