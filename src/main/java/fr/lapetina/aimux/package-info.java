/**
 * Routing core that multiplexes requests across AI providers.
 *
 * <p>Requests are routed by {@link fr.lapetina.aimux.router.FailoverRouter} over the providers
 * held in {@link fr.lapetina.aimux.infrastructure.registry.ProviderRegistry}, each guarded by a
 * circuit breaker and per-key quotas. Routing events travel to logging, metrics and listeners on
 * an LMAX Disruptor ring buffer.
 *
 * <h2>Package Structure</h2>
 * <ul>
 *   <li>{@code domain.model} - Providers, requests, outcomes</li>
 *   <li>{@code domain.bridge} - Provider bridge contract and catalog</li>
 *   <li>{@code domain.strategy} - Load balancing strategies</li>
 *   <li>{@code domain.event} - Routing events</li>
 *   <li>{@code router} - Failover loop</li>
 *   <li>{@code disruptor} - Event bus and handlers</li>
 *   <li>{@code infrastructure} - Registry, health, config, metrics</li>
 *   <li>{@code api} - Status and admin HTTP endpoint</li>
 * </ul>
 *
 * @see fr.lapetina.aimux.RouterFactory
 */
package fr.lapetina.aimux;
