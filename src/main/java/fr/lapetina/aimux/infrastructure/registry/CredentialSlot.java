package fr.lapetina.aimux.infrastructure.registry;

import fr.lapetina.aimux.domain.model.CredentialRef;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Quota window of one API key.
 *
 * The window is an immutable (start, used) pair swapped by compare-and-set: a reservation
 * and the reset at the window boundary happen in the same swap, so the count never goes
 * negative and is never observed mid-reset.
 */
final class CredentialSlot {

    private record Window(Instant start, int used) {
        boolean isExpired(Instant now, Duration length) {
            return !now.isBefore(start.plus(length));
        }
    }

    private final String providerId;
    private final String credentialId;
    private final String secret;
    private final int quota;
    private final Duration windowLength;

    private final AtomicReference<Window> window;
    private final AtomicInteger consecutiveFailures = new AtomicInteger(0);
    private volatile Instant lastUsed;

    CredentialSlot(String providerId, String credentialId, String secret,
                   int quota, Duration windowLength, Instant now) {
        this.providerId = Objects.requireNonNull(providerId, "Provider ID is required");
        this.credentialId = Objects.requireNonNull(credentialId, "Credential ID is required");
        this.secret = secret;
        this.quota = quota;
        this.windowLength = Objects.requireNonNull(windowLength, "Window length is required");
        this.window = new AtomicReference<>(new Window(now, 0));
    }

    /**
     * Reserves one request from the current window, starting a new window if the old one ended.
     *
     * @return false if the window is at quota
     */
    boolean tryReserve(Instant now) {
        while (true) {
            Window current = window.get();
            Window base = current.isExpired(now, windowLength) ? new Window(now, 0) : current;
            if (base.used() >= quota) {
                return false;
            }
            Window next = new Window(base.start(), base.used() + 1);
            if (window.compareAndSet(current, next)) {
                lastUsed = now;
                return true;
            }
        }
    }

    /**
     * Gives back one reservation of the current window. A window that already ended is left alone.
     */
    void cancelReservation(Instant now) {
        while (true) {
            Window current = window.get();
            if (current.isExpired(now, windowLength) || current.used() == 0) {
                return;
            }
            if (window.compareAndSet(current, new Window(current.start(), current.used() - 1))) {
                return;
            }
        }
    }

    boolean hasCapacity(Instant now) {
        Window current = window.get();
        return current.isExpired(now, windowLength) || current.used() < quota;
    }

    /**
     * Treats the key as exhausted until its window ends, after a provider-side rate limit.
     */
    void markExhausted(Instant now) {
        while (true) {
            Window current = window.get();
            Window next = current.isExpired(now, windowLength)
                    ? new Window(now, quota)
                    : new Window(current.start(), Math.max(current.used(), quota));
            if (window.compareAndSet(current, next)) {
                return;
            }
        }
    }

    void recordSuccess() {
        consecutiveFailures.set(0);
    }

    void recordFailure() {
        consecutiveFailures.incrementAndGet();
    }

    /**
     * Copies window and failure state from the slot this one replaces on reload.
     */
    void carryOver(CredentialSlot previous) {
        window.set(previous.window.get());
        consecutiveFailures.set(previous.consecutiveFailures.get());
        lastUsed = previous.lastUsed;
    }

    CredentialRef toRef() {
        return new CredentialRef(providerId, credentialId, secret);
    }

    int usedInWindow(Instant now) {
        Window current = window.get();
        return current.isExpired(now, windowLength) ? 0 : current.used();
    }

    Instant windowStart() {
        return window.get().start();
    }

    String getCredentialId() {
        return credentialId;
    }

    int getQuota() {
        return quota;
    }

    int getConsecutiveFailures() {
        return consecutiveFailures.get();
    }

    Instant getLastUsed() {
        return lastUsed;
    }

    @Override
    public String toString() {
        Window current = window.get();
        return "CredentialSlot{" +
                "providerId='" + providerId + '\'' +
                ", credentialId='" + credentialId + '\'' +
                ", used=" + current.used() + "/" + quota +
                '}';
    }
}
