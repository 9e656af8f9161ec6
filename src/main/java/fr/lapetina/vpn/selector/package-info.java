/**
 * VPN Server Selector - picks the best VPN endpoint per country, category and protocol.
 *
 * <p>Every candidate server is probed for round-trip time and packet loss, scored from its
 * load and measurements, and reduced to a single winner per (country, category, protocol).
 * Probes run concurrently on an LMAX Disruptor worker pool sized from the process's
 * file-descriptor headroom.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.vpn.selector.SelectorFactory} - Main entry point for creating
 *       a fully-configured engine from YAML configuration</li>
 *   <li>{@link fr.lapetina.vpn.selector.disruptor.ServerSelectionEngine} - The evaluation run itself</li>
 *   <li>{@link fr.lapetina.vpn.selector.VpnServerSelectorApplication} - Command-line runner</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (SelectorFactory factory = SelectorFactory.create("config.yaml")) {
 *     Map<SelectionKey, ScoredCandidate> best = factory.evaluate(candidates);
 *     best.forEach((key, server) -> System.out.println(key + " -> " + server.connectionName()));
 * }
 * }</pre>
 *
 * @see fr.lapetina.vpn.selector.SelectorFactory
 * @see fr.lapetina.vpn.selector.disruptor.ServerSelectionEngine
 */
package fr.lapetina.vpn.selector;
