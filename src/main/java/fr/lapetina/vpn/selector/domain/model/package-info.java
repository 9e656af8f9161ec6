/**
 * Value types describing candidate servers and the results of evaluating them.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.vpn.selector.domain.model.CandidateServer} - Immutable server entry, validated on build</li>
 *   <li>{@link fr.lapetina.vpn.selector.domain.model.ProbeResult} - Round-trip time and loss for one host</li>
 *   <li>{@link fr.lapetina.vpn.selector.domain.model.ScoredCandidate} - Named, scored entry of the best-servers table</li>
 *   <li>{@link fr.lapetina.vpn.selector.domain.model.SelectionKey} - (country, category, protocol) bucket</li>
 *   <li>{@link fr.lapetina.vpn.selector.domain.model.ProviderCatalog} - Provider-owned label tables</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * <p>All classes in this package are immutable and may be shared freely between workers.
 */
package fr.lapetina.vpn.selector.domain.model;
