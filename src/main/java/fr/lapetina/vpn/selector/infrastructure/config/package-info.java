/**
 * Configuration loading.
 *
 * <p>This package handles YAML configuration parsing into a mutable settings tree.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.vpn.selector.infrastructure.config.SelectorConfig} - Configuration model</li>
 *   <li>{@link fr.lapetina.vpn.selector.infrastructure.config.ConfigLoader} - YAML loading and validation</li>
 * </ul>
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code probe} - Prober type, attempts and per-attempt timeout</li>
 *   <li>{@code scoring} - Loss cutoff and score precision</li>
 *   <li>{@code concurrency} - Descriptor budget per worker, fallbacks and ring buffer settings</li>
 *   <li>{@code selection} - Candidate source, allowed protocols and filters</li>
 *   <li>{@code provider} - Category and protocol label tables</li>
 *   <li>{@code metrics} - Prometheus metrics configuration</li>
 * </ul>
 *
 * @see fr.lapetina.vpn.selector.infrastructure.config.SelectorConfig
 * @see fr.lapetina.vpn.selector.infrastructure.config.ConfigLoader
 */
package fr.lapetina.vpn.selector.infrastructure.config;
