package fr.lapetina.aimux.router.exception;

/**
 * Base class of the failures a routing decision can end with.
 */
public abstract class RoutingException extends RuntimeException {

    private final String requestId;

    protected RoutingException(String requestId, String message) {
        super(message);
        this.requestId = requestId;
    }

    public String getRequestId() {
        return requestId;
    }
}
