package fr.lapetina.vpn.selector.infrastructure.provider;

import fr.lapetina.vpn.selector.domain.model.CandidateServer;
import fr.lapetina.vpn.selector.domain.model.ProviderCatalog;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Narrows the candidate list to configured countries and categories before probing.
 * An empty restriction keeps everything.
 */
public final class CandidateFilter {

    private final Set<String> countries;
    private final Set<String> categoryLabels;
    private final ProviderCatalog catalog;

    public CandidateFilter(Collection<String> countries, Collection<String> categories, ProviderCatalog catalog) {
        this.catalog = catalog;
        this.countries = countries.stream()
                .map(c -> c.trim().toUpperCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
        this.categoryLabels = categories.stream()
                .map(catalog::categoryLabel)
                .collect(Collectors.toUnmodifiableSet());
    }

    public boolean accepts(CandidateServer server) {
        if (!countries.isEmpty() && !countries.contains(server.getCountryCode().toUpperCase(Locale.ROOT))) {
            return false;
        }
        if (categoryLabels.isEmpty()) {
            return true;
        }
        return server.getCategories().stream()
                .map(catalog::categoryLabel)
                .anyMatch(categoryLabels::contains);
    }

    public List<CandidateServer> apply(List<CandidateServer> servers) {
        return servers.stream().filter(this::accepts).toList();
    }
}
