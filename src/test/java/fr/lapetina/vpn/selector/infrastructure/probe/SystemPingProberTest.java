package fr.lapetina.vpn.selector.infrastructure.probe;

import fr.lapetina.vpn.selector.domain.model.ProbeResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SystemPingProberTest {

    private static final String LINUX_OUTPUT = "PING us1234.nordvpn.com (192.0.2.10) 56(84) bytes of data.\n" +
            "\n" +
            "--- us1234.nordvpn.com ping statistics ---\n" +
            "5 packets transmitted, 4 received, 20% packet loss, time 4005ms\n" +
            "rtt min/avg/max/mdev = 21.094/23.871/27.420/2.411 ms\n";

    private static final String MAC_OUTPUT = "--- 192.0.2.10 ping statistics ---\n" +
            "5 packets transmitted, 5 packets received, 0.0% packet loss\n" +
            "round-trip min/avg/max/stddev = 10.101/12.500/14.220/1.376 ms\n";

    private static final String ALL_LOST = "--- 192.0.2.99 ping statistics ---\n" +
            "5 packets transmitted, 0 received, 100% packet loss, time 4091ms\n";

    @Test
    @DisplayName("should parse loss and average rtt from iputils output")
    void shouldParseLinuxOutput() {
        Optional<ProbeResult> result = SystemPingProber.parse(LINUX_OUTPUT);

        assertThat(result).isPresent();
        assertThat(result.get().lossPercent()).isEqualTo(20.0);
        assertThat(result.get().roundTripMillis().getAsDouble()).isEqualTo(23.871);
    }

    @Test
    @DisplayName("should parse BSD style summaries")
    void shouldParseBsdOutput() {
        ProbeResult result = SystemPingProber.parse(MAC_OUTPUT).orElseThrow();

        assertThat(result.lossPercent()).isEqualTo(0.0);
        assertThat(result.roundTripMillis().getAsDouble()).isEqualTo(12.5);
    }

    @Test
    @DisplayName("should report unreachable when every packet was lost")
    void shouldParseTotalLoss() {
        ProbeResult result = SystemPingProber.parse(ALL_LOST).orElseThrow();

        assertThat(result.isReachable()).isFalse();
        assertThat(result.lossPercent()).isEqualTo(100.0);
    }

    @Test
    @DisplayName("should not parse unrelated output")
    void shouldRejectGarbage() {
        assertThat(SystemPingProber.parse("ping: unknown host nowhere.invalid")).isEmpty();
    }

    @Test
    @DisplayName("should fold a missing ping binary into full loss")
    void shouldAbsorbMissingCommand() {
        SystemPingProber prober = new SystemPingProber("/nonexistent/ping-binary", Duration.ofMillis(100));

        ProbeResult result = prober.probe("192.0.2.1", 2);

        assertThat(result.isReachable()).isFalse();
        assertThat(result.lossPercent()).isEqualTo(100.0);
    }

    @Test
    @DisplayName("should refuse hosts that look like options")
    void shouldRefuseOptionLikeHosts() {
        SystemPingProber prober = new SystemPingProber(Duration.ofMillis(100));

        assertThat(prober.probe("-f", 1).isReachable()).isFalse();
    }

    @Test
    @DisplayName("should reject fewer than one attempt")
    void shouldRejectZeroAttempts() {
        SystemPingProber prober = new SystemPingProber(Duration.ofMillis(100));

        assertThatThrownBy(() -> prober.probe("192.0.2.1", 0)).isInstanceOf(IllegalArgumentException.class);
    }
}
