package fr.lapetina.aimux.domain.bridge;

import fr.lapetina.aimux.domain.model.Capability;
import fr.lapetina.aimux.domain.model.CostClass;
import fr.lapetina.aimux.domain.model.SpeedClass;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * What a bridge reports about its provider.
 */
public record ProviderDescriptor(Set<Capability> capabilities, CostClass costClass, SpeedClass speedClass) {

    public ProviderDescriptor {
        capabilities = capabilities == null || capabilities.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(capabilities));
        costClass = costClass != null ? costClass : CostClass.MEDIUM;
        speedClass = speedClass != null ? speedClass : SpeedClass.MEDIUM;
    }

    public static ProviderDescriptor textOnly() {
        return new ProviderDescriptor(EnumSet.of(Capability.TEXT), CostClass.MEDIUM, SpeedClass.MEDIUM);
    }
}
