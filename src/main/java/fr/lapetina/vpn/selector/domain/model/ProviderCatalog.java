package fr.lapetina.vpn.selector.domain.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Display labels published by the VPN provider for its category tags and protocols.
 *
 * A tag that is already one of the known labels resolves to itself, so server lists
 * carrying either form render the same way. Unknown tags are passed through unchanged.
 */
public final class ProviderCatalog {

    private static final Logger log = LoggerFactory.getLogger(ProviderCatalog.class);

    private final Map<String, String> categoryLabels;
    private final Map<Protocol, String> protocolLabels;

    public ProviderCatalog(Map<String, String> categoryLabels, Map<Protocol, String> protocolLabels) {
        this.categoryLabels = Collections.unmodifiableMap(new LinkedHashMap<>(categoryLabels));
        Map<Protocol, String> protocols = new EnumMap<>(Protocol.class);
        protocols.putAll(protocolLabels);
        this.protocolLabels = Collections.unmodifiableMap(protocols);
    }

    /**
     * NordVPN's category and protocol tables.
     */
    public static ProviderCatalog nordVpn() {
        Map<String, String> categories = new LinkedHashMap<>();
        categories.put("normal", "Standard VPN servers");
        categories.put("p2p", "P2P");
        categories.put("double", "Double VPN");
        categories.put("dedicated", "Dedicated IP servers");
        categories.put("onion", "Onion Over VPN");
        categories.put("ddos", "Anti DDoS");

        Map<Protocol, String> protocols = new EnumMap<>(Protocol.class);
        protocols.put(Protocol.TCP, "OpenVPN TCP");
        protocols.put(Protocol.UDP, "OpenVPN UDP");

        return new ProviderCatalog(categories, protocols);
    }

    public String categoryLabel(String tag) {
        String label = categoryLabels.get(tag);
        if (label != null) {
            return label;
        }
        if (!categoryLabels.containsValue(tag)) {
            log.debug("Unknown category tag, using it verbatim: tag={}", tag);
        }
        return tag;
    }

    public String protocolLabel(Protocol protocol) {
        return protocolLabels.getOrDefault(protocol, protocol.id());
    }

    public Map<String, String> getCategoryLabels() {
        return categoryLabels;
    }

    public Map<Protocol, String> getProtocolLabels() {
        return protocolLabels;
    }
}
