package fr.lapetina.vpn.selector.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ProviderCatalogTest {

    private final ProviderCatalog catalog = ProviderCatalog.nordVpn();

    @Test
    @DisplayName("should resolve tags, labels and unknown values")
    void shouldResolveCategories() {
        assertThat(catalog.categoryLabel("normal")).isEqualTo("Standard VPN servers");
        assertThat(catalog.categoryLabel("Standard VPN servers")).isEqualTo("Standard VPN servers");
        assertThat(catalog.categoryLabel("Obfuscated Servers")).isEqualTo("Obfuscated Servers");
    }

    @Test
    @DisplayName("should expose protocol labels")
    void shouldResolveProtocols() {
        assertThat(catalog.protocolLabel(Protocol.UDP)).isEqualTo("OpenVPN UDP");
        assertThat(catalog.protocolLabel(Protocol.TCP)).isEqualTo("OpenVPN TCP");
        assertThat(Protocol.fromId(" UDP ")).contains(Protocol.UDP);
        assertThat(Protocol.fromId("ikev2")).isEmpty();
    }
}
