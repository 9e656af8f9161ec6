package fr.lapetina.vpn.selector.infrastructure.probe;

import fr.lapetina.vpn.selector.domain.model.ProbeResult;
import fr.lapetina.vpn.selector.infrastructure.config.SelectorConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ServerSocket;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class ProberFactoryTest {

    @Test
    @DisplayName("should create built-in probers by name")
    void shouldCreateBuiltIns() {
        SelectorConfig.ProbeConfig config = new SelectorConfig.ProbeConfig();

        assertThat(ProberFactory.create("ping", config)).get().isInstanceOf(SystemPingProber.class);
        assertThat(ProberFactory.create("REACHABLE", config)).get().isInstanceOf(ReachabilityProber.class);
        assertThat(ProberFactory.create("tcp-connect", config)).get().isInstanceOf(TcpConnectProber.class);
        assertThat(ProberFactory.create("carrier-pigeon", config)).isEmpty();
    }

    @Test
    @DisplayName("should pass the configured port to the TCP prober")
    void shouldConfigureTcpPort() {
        SelectorConfig.ProbeConfig config = new SelectorConfig.ProbeConfig();
        config.setTcpPort(1194);

        NetworkProber prober = ProberFactory.create("tcp-connect", config).orElseThrow();

        assertThat(((TcpConnectProber) prober).getPort()).isEqualTo(1194);
    }

    @Test
    @DisplayName("should fall back to ping for unknown types")
    void shouldFallBackToPing() {
        SelectorConfig.ProbeConfig config = new SelectorConfig.ProbeConfig();
        config.setType("carrier-pigeon");

        assertThat(ProberFactory.fromConfig(config).getName()).isEqualTo(ProberFactory.DEFAULT_PROBER);
    }

    @Test
    @DisplayName("should accept custom probers")
    void shouldRegisterCustomProber() {
        ProberFactory.register("fixed", config -> new NetworkProber() {
            @Override
            public String getName() {
                return "fixed";
            }

            @Override
            public ProbeResult probe(String host, int attempts) {
                return ProbeResult.of(1.0, 0.0);
            }
        });

        assertThat(ProberFactory.getRegisteredNames()).contains("fixed", "ping", "reachable", "tcp-connect");
    }

    @Test
    @DisplayName("should measure TCP connects against a local listener")
    void shouldMeasureTcpConnect() throws IOException {
        try (ServerSocket server = new ServerSocket(0)) {
            TcpConnectProber prober = new TcpConnectProber(server.getLocalPort(), Duration.ofMillis(500));

            ProbeResult result = prober.probe("127.0.0.1", 3);

            assertThat(result.isReachable()).isTrue();
            assertThat(result.lossPercent()).isEqualTo(0.0);
        }
    }
}
