/**
 * Network probers measuring round-trip time and packet loss to a candidate server.
 *
 * <p>Probers are shared by every evaluation worker and must be thread-safe. An unreachable
 * host is reported as 100% loss, never as an exception.
 *
 * <h2>Available Probers</h2>
 * <table border="1">
 *   <tr><th>Prober</th><th>Description</th><th>Best For</th></tr>
 *   <tr><td>{@code ping}</td><td>Runs the system {@code ping} and parses its summary</td><td>ICMP, matches what users measure by hand</td></tr>
 *   <tr><td>{@code reachable}</td><td>{@link java.net.InetAddress#isReachable(int)} per attempt</td><td>Hosts without a {@code ping} binary</td></tr>
 *   <tr><td>{@code tcp-connect}</td><td>Times a TCP handshake to a fixed port</td><td>Networks dropping ICMP</td></tr>
 * </table>
 *
 * <h2>Custom Probers</h2>
 * <p>Implement {@link fr.lapetina.vpn.selector.infrastructure.probe.NetworkProber} and register
 * with {@link fr.lapetina.vpn.selector.infrastructure.probe.ProberFactory}.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * NetworkProber prober = ProberFactory.create("tcp-connect", config.getProbe()).orElseThrow();
 * ProbeResult result = prober.probe("us1234.nordvpn.com", 5);
 * }</pre>
 *
 * @see fr.lapetina.vpn.selector.infrastructure.probe.NetworkProber
 * @see fr.lapetina.vpn.selector.infrastructure.probe.ProberFactory
 */
package fr.lapetina.vpn.selector.infrastructure.probe;
