package fr.lapetina.aimux.router.exception;

import fr.lapetina.aimux.domain.model.Capability;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * No enabled, healthy provider with the required capabilities exists.
 * Not transient: retrying immediately will fail the same way.
 */
public final class NoEligibleProviderException extends RoutingException {

    private final Set<Capability> requiredCapabilities;

    public NoEligibleProviderException(String requestId, Set<Capability> requiredCapabilities) {
        super(requestId, "No eligible provider for capabilities " + requiredCapabilities);
        this.requiredCapabilities = requiredCapabilities.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(requiredCapabilities));
    }

    public Set<Capability> getRequiredCapabilities() {
        return requiredCapabilities;
    }
}
