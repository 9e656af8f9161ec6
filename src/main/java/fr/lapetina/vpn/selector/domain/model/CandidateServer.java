package fr.lapetina.vpn.selector.domain.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A VPN server under evaluation for one run.
 * Immutable once built; the builder rejects missing or out-of-range fields.
 */
public final class CandidateServer {
    private final String domain;
    private final String countryCode;
    private final int load;
    private final List<String> categories;
    private final Set<Protocol> protocols;

    private CandidateServer(Builder builder) {
        this.domain = requireText(builder.domain, "domain");
        this.countryCode = requireText(builder.countryCode, "countryCode");
        if (builder.load == null) {
            throw new InvalidCandidateException("load is required: domain=" + domain);
        }
        if (builder.load < 0 || builder.load > 100) {
            throw new InvalidCandidateException(
                    "load must be within [0, 100]: domain=" + domain + ", load=" + builder.load);
        }
        this.load = builder.load;
        this.categories = Collections.unmodifiableList(new ArrayList<>(builder.categories));
        this.protocols = builder.protocols.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(builder.protocols));
    }

    private static String requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new InvalidCandidateException(field + " is required");
        }
        return value.trim();
    }

    public String getDomain() {
        return domain;
    }

    /**
     * First dot-separated label of the domain, e.g. {@code us1234} for {@code us1234.nordvpn.com}.
     */
    public String getShortName() {
        int dot = domain.indexOf('.');
        return dot < 0 ? domain : domain.substring(0, dot);
    }

    public String getCountryCode() {
        return countryCode;
    }

    public int getLoad() {
        return load;
    }

    public List<String> getCategories() {
        return categories;
    }

    public Set<Protocol> getProtocols() {
        return protocols;
    }

    public boolean supports(Protocol protocol) {
        return protocols.contains(protocol);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CandidateServer that = (CandidateServer) o;
        return domain.equals(that.domain);
    }

    @Override
    public int hashCode() {
        return Objects.hash(domain);
    }

    @Override
    public String toString() {
        return "CandidateServer{" +
                "domain='" + domain + '\'' +
                ", country=" + countryCode +
                ", load=" + load +
                ", categories=" + categories +
                ", protocols=" + protocols +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String domain;
        private String countryCode;
        private Integer load;
        private final List<String> categories = new ArrayList<>();
        private final Set<Protocol> protocols = EnumSet.noneOf(Protocol.class);

        public Builder domain(String domain) {
            this.domain = domain;
            return this;
        }

        public Builder countryCode(String countryCode) {
            this.countryCode = countryCode;
            return this;
        }

        public Builder load(int load) {
            this.load = load;
            return this;
        }

        public Builder addCategory(String category) {
            if (category == null || category.isBlank()) {
                throw new InvalidCandidateException("category must not be blank: domain=" + domain);
            }
            if (!categories.contains(category)) {
                categories.add(category);
            }
            return this;
        }

        public Builder categories(Collection<String> categories) {
            categories.forEach(this::addCategory);
            return this;
        }

        public Builder addProtocol(Protocol protocol) {
            this.protocols.add(Objects.requireNonNull(protocol, "protocol"));
            return this;
        }

        public Builder protocols(Collection<Protocol> protocols) {
            protocols.forEach(this::addProtocol);
            return this;
        }

        public CandidateServer build() {
            return new CandidateServer(this);
        }
    }
}
