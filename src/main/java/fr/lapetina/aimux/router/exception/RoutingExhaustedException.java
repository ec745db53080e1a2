package fr.lapetina.aimux.router.exception;

import fr.lapetina.aimux.domain.model.AttemptRecord;
import fr.lapetina.aimux.domain.model.FailureCause;

import java.util.List;

/**
 * Every attempt failed, or the caller's deadline passed.
 * Carries the attempts in order with their classified causes.
 */
public final class RoutingExhaustedException extends RoutingException {

    private final List<AttemptRecord> attempts;

    public RoutingExhaustedException(String requestId, List<AttemptRecord> attempts) {
        super(requestId, buildMessage(attempts));
        this.attempts = List.copyOf(attempts);
    }

    public List<AttemptRecord> getAttempts() {
        return attempts;
    }

    public FailureCause getLastCause() {
        return attempts.isEmpty() ? null : attempts.get(attempts.size() - 1).cause();
    }

    private static String buildMessage(List<AttemptRecord> attempts) {
        StringBuilder sb = new StringBuilder("Routing exhausted after ")
                .append(attempts.size())
                .append(" attempt(s)");
        for (AttemptRecord attempt : attempts) {
            sb.append("; #").append(attempt.attempt())
                    .append(' ').append(attempt.providerId() != null ? attempt.providerId() : "-")
                    .append('=').append(attempt.cause());
        }
        return sb.toString();
    }
}
