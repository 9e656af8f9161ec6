package fr.lapetina.vpn.selector.domain.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Tunnel transport a server can be reached over.
 */
public enum Protocol {
    UDP("udp"),
    TCP("tcp");

    private final String id;

    Protocol(String id) {
        this.id = id;
    }

    /**
     * Short identifier used in connection names and configuration.
     */
    public String id() {
        return id;
    }

    /**
     * Looks up a protocol by its short identifier, ignoring case.
     */
    public static Optional<Protocol> fromId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        for (Protocol protocol : values()) {
            if (protocol.id.equals(normalized)) {
                return Optional.of(protocol);
            }
        }
        return Optional.empty();
    }
}
