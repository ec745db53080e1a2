/**
 * Provider selection strategies.
 *
 * <p>All strategies break ties by static priority weight (higher first), then by provider id.
 *
 * <h2>Available Strategies</h2>
 * <table border="1">
 *   <tr><th>Strategy</th><th>Orders by</th></tr>
 *   <tr><td>{@code capability}</td><td>Priority weight (default)</td></tr>
 *   <tr><td>{@code cost}</td><td>Cost class, then priority weight</td></tr>
 *   <tr><td>{@code performance}</td><td>Mean recent latency; unsampled providers rank at the median</td></tr>
 *   <tr><td>{@code round-robin}</td><td>Rotation per distinct candidate set</td></tr>
 * </table>
 *
 * <h2>Custom Strategies</h2>
 * <p>Implement {@link fr.lapetina.aimux.domain.strategy.LoadBalancingStrategy} and register
 * with {@link fr.lapetina.aimux.domain.strategy.StrategyFactory}.
 *
 * <pre>{@code
 * LoadBalancingStrategy strategy = StrategyFactory.create("performance").orElseThrow();
 * Optional<Provider> provider = strategy.select(candidates);
 * }</pre>
 */
package fr.lapetina.aimux.domain.strategy;
