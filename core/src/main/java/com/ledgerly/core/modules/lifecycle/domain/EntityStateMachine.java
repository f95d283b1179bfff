package com.ledgerly.core.modules.lifecycle.domain;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Transition table for guarded lifecycle events.
 *
 * <pre>
 * CREATED    --ACTIVATE-->    ACTIVE
 * ACTIVE     --DEACTIVATE-->  INACTIVE
 * INACTIVE   --REACTIVATE-->  ACTIVE
 * ACTIVE     --PROMOTE-->     EFFECTIVE
 * EFFECTIVE  --DEMOTE-->      INACTIVE
 * ACTIVE | INACTIVE | EFFECTIVE --SOFT_DELETE--> TERMINATED
 * TERMINATED --RESTORE-->     ACTIVE
 * </pre>
 *
 * The unconditional operations in {@link EntityLifecycle} ({@code softDelete}, {@code restore}, ...) bypass this table.
 */
public final class EntityStateMachine {

    private static final Map<EntityState, Map<LifecycleEvent, EntityState>> TRANSITIONS = buildTransitions();

    private EntityStateMachine() {
    }

    public static Optional<EntityState> next(EntityState from, LifecycleEvent event) {
        if (from == null || event == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(TRANSITIONS.get(from).get(event));
    }

    public static boolean permits(EntityState from, LifecycleEvent event) {
        return next(from, event).isPresent();
    }

    public static Set<LifecycleEvent> permittedEvents(EntityState from) {
        if (from == null) {
            return Set.of();
        }
        Map<LifecycleEvent, EntityState> outgoing = TRANSITIONS.get(from);
        if (outgoing.isEmpty()) {
            return Set.of();
        }
        return Collections.unmodifiableSet(EnumSet.copyOf(outgoing.keySet()));
    }

    private static Map<EntityState, Map<LifecycleEvent, EntityState>> buildTransitions() {
        Map<EntityState, Map<LifecycleEvent, EntityState>> table = new EnumMap<>(EntityState.class);
        for (EntityState state : EntityState.values()) {
            table.put(state, new EnumMap<>(LifecycleEvent.class));
        }
        table.get(EntityState.CREATED).put(LifecycleEvent.ACTIVATE, EntityState.ACTIVE);
        table.get(EntityState.ACTIVE).put(LifecycleEvent.DEACTIVATE, EntityState.INACTIVE);
        table.get(EntityState.INACTIVE).put(LifecycleEvent.REACTIVATE, EntityState.ACTIVE);
        table.get(EntityState.ACTIVE).put(LifecycleEvent.PROMOTE, EntityState.EFFECTIVE);
        table.get(EntityState.EFFECTIVE).put(LifecycleEvent.DEMOTE, EntityState.INACTIVE);
        for (EntityState live : EnumSet.of(EntityState.ACTIVE, EntityState.INACTIVE, EntityState.EFFECTIVE)) {
            table.get(live).put(LifecycleEvent.SOFT_DELETE, EntityState.TERMINATED);
        }
        table.get(EntityState.TERMINATED).put(LifecycleEvent.RESTORE, EntityState.ACTIVE);

        Map<EntityState, Map<LifecycleEvent, EntityState>> frozen = new EnumMap<>(EntityState.class);
        table.forEach((state, outgoing) -> frozen.put(state, Collections.unmodifiableMap(outgoing)));
        return Collections.unmodifiableMap(frozen);
    }
}
