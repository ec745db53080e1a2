package fr.lapetina.aimux.domain.bridge;

import fr.lapetina.aimux.domain.model.CredentialRef;
import fr.lapetina.aimux.domain.model.RouteRequest;

import java.time.Duration;
import java.util.Objects;

/**
 * Everything a bridge needs for one attempt.
 *
 * @param timeout how long the router will wait for this attempt
 */
public record Dispatch(RouteRequest request, CredentialRef credential, Duration timeout) {

    public Dispatch {
        Objects.requireNonNull(request, "Request is required");
        Objects.requireNonNull(credential, "Credential is required");
        Objects.requireNonNull(timeout, "Timeout is required");
    }
}
