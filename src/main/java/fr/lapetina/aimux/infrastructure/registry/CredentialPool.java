package fr.lapetina.aimux.infrastructure.registry;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * The API keys of one provider. One key is current; when its quota is blown, or the
 * provider rejects it, the pool rotates round-robin to the next key.
 */
final class CredentialPool {

    private final List<CredentialSlot> slots;
    private final AtomicInteger current = new AtomicInteger(0);

    CredentialPool(List<CredentialSlot> slots) {
        this.slots = List.copyOf(slots);
    }

    /**
     * Reserves budget on the current key, or on the next key in rotation that has any.
     */
    Optional<CredentialSlot> acquire(Instant now) {
        int size = slots.size();
        if (size == 0) {
            return Optional.empty();
        }
        int start = current.get();
        for (int i = 0; i < size; i++) {
            int index = (start + i) % size;
            CredentialSlot slot = slots.get(index);
            if (slot.tryReserve(now)) {
                if (index != start) {
                    current.compareAndSet(start, index);
                }
                return Optional.of(slot);
            }
        }
        return Optional.empty();
    }

    /**
     * Moves the rotation past {@code slot} if it is still the current key.
     *
     * @return true if the current key changed
     */
    boolean rotatePast(CredentialSlot slot) {
        int size = slots.size();
        if (size < 2) {
            return false;
        }
        int index = slots.indexOf(slot);
        if (index < 0) {
            return false;
        }
        int start = current.get();
        return start % size == index && current.compareAndSet(start, (index + 1) % size);
    }

    boolean hasCapacity(Instant now) {
        for (CredentialSlot slot : slots) {
            if (slot.hasCapacity(now)) {
                return true;
            }
        }
        return false;
    }

    Optional<CredentialSlot> find(String credentialId) {
        for (CredentialSlot slot : slots) {
            if (slot.getCredentialId().equals(credentialId)) {
                return Optional.of(slot);
            }
        }
        return Optional.empty();
    }

    /**
     * Restores the current index after a reload, pointing at the same key id when it survived.
     */
    void carryOverCurrent(CredentialPool previous) {
        if (previous.slots.isEmpty() || slots.isEmpty()) {
            return;
        }
        String currentId = previous.currentSlot().getCredentialId();
        for (int i = 0; i < slots.size(); i++) {
            if (slots.get(i).getCredentialId().equals(currentId)) {
                current.set(i);
                return;
            }
        }
    }

    CredentialSlot currentSlot() {
        return slots.get(current.get() % slots.size());
    }

    List<CredentialSlot> getSlots() {
        return slots;
    }

    boolean isEmpty() {
        return slots.isEmpty();
    }

    int size() {
        return slots.size();
    }
}
