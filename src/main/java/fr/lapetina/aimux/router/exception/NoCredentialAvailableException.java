package fr.lapetina.aimux.router.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Every eligible provider was skipped before dispatch. Transient: quota windows reopen.
 */
public final class NoCredentialAvailableException extends RoutingException {

    private final Map<String, SkipReason> skippedProviders;

    public NoCredentialAvailableException(String requestId, Map<String, SkipReason> skippedProviders) {
        super(requestId, "No credential available: skipped=" + skippedProviders);
        this.skippedProviders = Collections.unmodifiableMap(new LinkedHashMap<>(skippedProviders));
    }

    /**
     * Provider ids in the order they were skipped.
     */
    public Map<String, SkipReason> getSkippedProviders() {
        return skippedProviders;
    }

    public enum SkipReason {
        QUOTA_EXHAUSTED("All credentials at quota"),
        CIRCUIT_UNAVAILABLE("Circuit open or probe already in flight");

        private final String message;

        SkipReason(String message) {
            this.message = message;
        }

        public String getMessage() {
            return message;
        }
    }
}
