package fr.lapetina.vpn.selector.domain.model;

import java.util.Comparator;
import java.util.Objects;

/**
 * Bucket of the best-servers table: one winner is kept per country, category and protocol.
 */
public record SelectionKey(String countryCode, String categoryName, Protocol protocol)
        implements Comparable<SelectionKey> {

    private static final Comparator<SelectionKey> ORDER = Comparator
            .comparing(SelectionKey::countryCode)
            .thenComparing(SelectionKey::categoryName)
            .thenComparing(SelectionKey::protocol);

    public SelectionKey {
        Objects.requireNonNull(countryCode, "countryCode is required");
        Objects.requireNonNull(categoryName, "categoryName is required");
        Objects.requireNonNull(protocol, "protocol is required");
    }

    @Override
    public int compareTo(SelectionKey other) {
        return ORDER.compare(this, other);
    }
}
