package fr.lapetina.vpn.selector.domain.naming;

import fr.lapetina.vpn.selector.domain.model.CandidateServer;
import fr.lapetina.vpn.selector.domain.model.Protocol;
import fr.lapetina.vpn.selector.domain.model.ProviderCatalog;

import java.util.Objects;
import java.util.StringJoiner;

/**
 * Derives the display name of a (server, protocol) connection,
 * e.g. {@code us1234.udp[P2P|Dedicated IP servers]}.
 */
public final class ConnectionNamer {

    private final ProviderCatalog catalog;

    public ConnectionNamer(ProviderCatalog catalog) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
    }

    public String name(CandidateServer server, Protocol protocol) {
        StringJoiner categories = new StringJoiner("|", "[", "]");
        for (String category : server.getCategories()) {
            categories.add(catalog.categoryLabel(category));
        }
        return server.getShortName() + '.' + protocol.id() + categories;
    }
}
