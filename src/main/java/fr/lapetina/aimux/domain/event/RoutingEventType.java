package fr.lapetina.aimux.domain.event;

/**
 * Kinds of observable routing events.
 */
public enum RoutingEventType {
    ATTEMPT_SUCCEEDED,
    ATTEMPT_FAILED,
    ROUTE_SUCCEEDED,
    ROUTE_EXHAUSTED,
    NO_ELIGIBLE_PROVIDER,
    NO_CREDENTIAL_AVAILABLE,
    CIRCUIT_TRANSITION,
    CREDENTIAL_AUTH_FAILURE,
    PROVIDER_RESET,
    CONFIG_RELOADED,
    CONFIG_REJECTED
}
