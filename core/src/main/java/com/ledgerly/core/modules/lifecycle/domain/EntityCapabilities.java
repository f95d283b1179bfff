package com.ledgerly.core.modules.lifecycle.domain;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Capability queries over arbitrary entity instances.
 */
public final class EntityCapabilities {

    private EntityCapabilities() {
    }

    public static Set<EntityCapability> of(Object entity) {
        EnumSet<EntityCapability> capabilities = EnumSet.noneOf(EntityCapability.class);
        if (entity == null) {
            return Collections.unmodifiableSet(capabilities);
        }
        for (EntityCapability capability : EntityCapability.values()) {
            if (capability.isSupportedBy(entity)) {
                capabilities.add(capability);
            }
        }
        return Collections.unmodifiableSet(capabilities);
    }

    public static boolean supports(Object entity, EntityCapability capability) {
        return entity != null && capability.isSupportedBy(entity);
    }

    public static boolean supportsSoftDelete(Object entity) {
        return supports(entity, EntityCapability.SOFT_DELETE);
    }
}
