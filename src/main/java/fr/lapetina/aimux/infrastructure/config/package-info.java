/**
 * Configuration loading, validation and hot-reload support.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.aimux.infrastructure.config.RouterConfig} - Configuration model bound from YAML</li>
 *   <li>{@link fr.lapetina.aimux.infrastructure.config.ConfigLoader} - YAML loading and file watching</li>
 *   <li>{@link fr.lapetina.aimux.infrastructure.config.ConfigValidator} - Reports every problem of a configuration</li>
 * </ul>
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code server} - Optional status server</li>
 *   <li>{@code providers} - Providers, their bridge type, classes, quota and credentials</li>
 *   <li>{@code strategy} - Provider selection strategy</li>
 *   <li>{@code failover} - Attempt budget, attempt timeout and default deadline</li>
 *   <li>{@code healthCheck} - Circuit breaker thresholds and active probing</li>
 *   <li>{@code performance} - Latency window size</li>
 *   <li>{@code events} - Ring buffer size and wait strategy</li>
 *   <li>{@code metrics} - Prometheus metrics</li>
 * </ul>
 */
package fr.lapetina.aimux.infrastructure.config;
