package com.ledgerly.core.modules.lifecycle.domain;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Objects;

import com.ledgerly.core.global.common.time.UtcTimestamps;
import com.ledgerly.core.global.error.BusinessError;
import com.ledgerly.core.global.error.Result;

/**
 * Lifecycle operations for any {@link SoftDeletable}, including entities that cannot extend
 * {@link com.ledgerly.core.global.jpa.AbstractLifecycleEntity}. When the entity is also {@link Auditable},
 * each operation refreshes {@code updatedAt} without ever moving it backwards.
 */
public final class EntityLifecycle {

    public static final String ILLEGAL_STATE_TRANSITION = "ILLEGAL_STATE_TRANSITION";

    private EntityLifecycle() {
    }

    /**
     * Moves the entity to {@link EntityState#TERMINATED} from any state. Idempotent.
     */
    public static void softDelete(SoftDeletable entity, Clock clock) {
        moveTo(entity, EntityState.TERMINATED, clock);
    }

    /**
     * Moves the entity to {@link EntityState#ACTIVE} from any state.
     */
    public static void restore(SoftDeletable entity, Clock clock) {
        moveTo(entity, EntityState.ACTIVE, clock);
    }

    public static void activate(SoftDeletable entity, Clock clock) {
        moveTo(entity, EntityState.ACTIVE, clock);
    }

    public static void deactivate(SoftDeletable entity, Clock clock) {
        moveTo(entity, EntityState.INACTIVE, clock);
    }

    /**
     * Applies {@code event} only if {@link EntityStateMachine} permits it from the current state.
     * A rejected event leaves the entity untouched.
     */
    public static Result<StateTransition> apply(SoftDeletable entity, LifecycleEvent event, Clock clock) {
        Objects.requireNonNull(entity, "entity must not be null");
        Objects.requireNonNull(event, "event must not be null");
        EntityState from = entity.getState();
        EntityState to = EntityStateMachine.next(from, event).orElse(null);
        if (to == null) {
            return Result.failure(BusinessError.business(ILLEGAL_STATE_TRANSITION,
                    "Cannot apply " + event + " to an entity in state " + from));
        }
        moveTo(entity, to, clock);
        return Result.success(new StateTransition(from, event, to));
    }

    public static void touch(Auditable entity, Clock clock) {
        Objects.requireNonNull(entity, "entity must not be null");
        OffsetDateTime now = UtcTimestamps.now(clock);
        OffsetDateTime current = entity.getUpdatedAt();
        if (current == null || now.isAfter(current)) {
            entity.setUpdatedAt(now);
        }
    }

    private static void moveTo(SoftDeletable entity, EntityState target, Clock clock) {
        Objects.requireNonNull(entity, "entity must not be null");
        Objects.requireNonNull(clock, "clock must not be null");
        entity.setState(target);
        if (entity instanceof Auditable auditable) {
            touch(auditable, clock);
        }
    }
}
