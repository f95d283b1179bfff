package com.ledgerly.core.modules.lifecycle.domain;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class EntityStateMachineTest {

    @ParameterizedTest(name = "{0} --{1}--> {2}")
    @CsvSource({
            "CREATED, ACTIVATE, ACTIVE",
            "ACTIVE, DEACTIVATE, INACTIVE",
            "INACTIVE, REACTIVATE, ACTIVE",
            "ACTIVE, PROMOTE, EFFECTIVE",
            "EFFECTIVE, DEMOTE, INACTIVE",
            "ACTIVE, SOFT_DELETE, TERMINATED",
            "INACTIVE, SOFT_DELETE, TERMINATED",
            "EFFECTIVE, SOFT_DELETE, TERMINATED",
            "TERMINATED, RESTORE, ACTIVE"
    })
    @DisplayName("전이표에 정의된 전이는 허용된다")
    void permittedTransitions(EntityState from, LifecycleEvent event, EntityState to) {
        assertThat(EntityStateMachine.next(from, event)).contains(to);
        assertThat(EntityStateMachine.permits(from, event)).isTrue();
    }

    @Test
    @DisplayName("TERMINATED 상태에서는 RESTORE만 가능하다")
    void terminatedOnlyRestores() {
        assertThat(EntityStateMachine.permittedEvents(EntityState.TERMINATED))
                .containsExactly(LifecycleEvent.RESTORE);
        assertThat(EntityStateMachine.permits(EntityState.TERMINATED, LifecycleEvent.SOFT_DELETE)).isFalse();
        assertThat(EntityStateMachine.permits(EntityState.TERMINATED, LifecycleEvent.REACTIVATE)).isFalse();
    }

    @Test
    @DisplayName("CREATED 상태는 바로 삭제할 수 없다")
    void createdCannotBeSoftDeletedThroughTheTable() {
        assertThat(EntityStateMachine.next(EntityState.CREATED, LifecycleEvent.SOFT_DELETE)).isEmpty();
        assertThat(EntityStateMachine.permittedEvents(EntityState.CREATED)).containsExactly(LifecycleEvent.ACTIVATE);
    }

    @Test
    void activeHasThreeOutgoingEvents() {
        assertThat(EntityStateMachine.permittedEvents(EntityState.ACTIVE))
                .containsExactlyInAnyOrder(LifecycleEvent.DEACTIVATE, LifecycleEvent.PROMOTE,
                        LifecycleEvent.SOFT_DELETE);
    }

    @Test
    void nullInputsHaveNoTransition() {
        assertThat(EntityStateMachine.next(null, LifecycleEvent.ACTIVATE)).isEmpty();
        assertThat(EntityStateMachine.next(EntityState.ACTIVE, null)).isEmpty();
        assertThat(EntityStateMachine.permittedEvents(null)).isEmpty();
    }

    @Test
    void stateTagsFollowDeclarationOrder() {
        assertThat(EntityState.fromTag(0)).contains(EntityState.CREATED);
        assertThat(EntityState.fromTag(4)).contains(EntityState.TERMINATED);
        assertThat(EntityState.fromTag(5)).isEmpty();
        assertThat(EntityState.TERMINATED.description()).isEqualTo("Soft deleted/terminated");
    }
}
