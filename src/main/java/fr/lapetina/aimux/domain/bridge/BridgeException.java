package fr.lapetina.aimux.domain.bridge;

import fr.lapetina.aimux.domain.model.FailureCause;

import java.util.Objects;

/**
 * Classified failure raised by a {@link Bridge}.
 * Messages must not contain credential material.
 */
public class BridgeException extends RuntimeException {

    private final FailureCause failureCause;

    public BridgeException(FailureCause failureCause, String message) {
        super(message);
        this.failureCause = Objects.requireNonNull(failureCause, "Failure cause is required");
    }

    public BridgeException(FailureCause failureCause, String message, Throwable cause) {
        super(message, cause);
        this.failureCause = Objects.requireNonNull(failureCause, "Failure cause is required");
    }

    public FailureCause getFailureCause() {
        return failureCause;
    }

    public static BridgeException timeout(String message) {
        return new BridgeException(FailureCause.TIMEOUT, message);
    }

    public static BridgeException rateLimited(String message) {
        return new BridgeException(FailureCause.RATE_LIMITED, message);
    }

    public static BridgeException authError(String message) {
        return new BridgeException(FailureCause.AUTH_ERROR, message);
    }

    public static BridgeException transport(String message, Throwable cause) {
        return new BridgeException(FailureCause.TRANSPORT_ERROR, message, cause);
    }

    public static BridgeException providerError(String message) {
        return new BridgeException(FailureCause.PROVIDER_ERROR, message);
    }
}
