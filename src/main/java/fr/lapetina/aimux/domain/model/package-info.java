/**
 * Value types shared by the registry, the load balancer and the router.
 *
 * <p>{@link fr.lapetina.aimux.domain.model.Provider} and the request/response records are immutable.
 * Mutable per-provider state (credential windows, circuit state, latency samples) lives in
 * {@code fr.lapetina.aimux.infrastructure.registry} and is only written through
 * {@link fr.lapetina.aimux.domain.model.Outcome} values.
 */
package fr.lapetina.aimux.domain.model;
