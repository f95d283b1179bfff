package com.ledgerly.core.modules.lifecycle.domain;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Clock;
import java.time.OffsetDateTime;

import com.ledgerly.core.global.error.ErrorKind;
import com.ledgerly.core.global.error.Result;
import com.ledgerly.core.support.TestClocks;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class EntityLifecycleTest {

    private static final OffsetDateTime T1 = TestClocks.T0.plusHours(1);
    private static final OffsetDateTime T2 = TestClocks.T0.plusHours(2);

    @Test
    @DisplayName("기반 클래스를 상속하지 않은 엔터티도 소프트 삭제할 수 있다")
    void softDeletesInterfaceOnlyEntity() {
        ExternalRecord record = new ExternalRecord(EntityState.EFFECTIVE, TestClocks.T0);

        EntityLifecycle.softDelete(record, TestClocks.fixedAt(T1));

        assertThat(record.isTerminated()).isTrue();
        assertThat(record.getUpdatedAt()).isEqualTo(T1);
    }

    @Test
    @DisplayName("소프트 삭제를 반복해도 TERMINATED를 유지하고 updatedAt은 줄어들지 않는다")
    void softDeleteIsIdempotent() {
        ExternalRecord record = new ExternalRecord(EntityState.ACTIVE, TestClocks.T0);

        EntityLifecycle.softDelete(record, TestClocks.fixedAt(T2));
        EntityLifecycle.softDelete(record, TestClocks.fixedAt(T1));
        EntityLifecycle.softDelete(record, TestClocks.fixedAt(T2));

        assertThat(record.getState()).isEqualTo(EntityState.TERMINATED);
        assertThat(record.getUpdatedAt()).isEqualTo(T2);
    }

    @Test
    @DisplayName("복구는 이전 상태와 상관없이 ACTIVE로 되돌린다")
    void restoreAlwaysActivates() {
        for (EntityState state : EntityState.values()) {
            ExternalRecord record = new ExternalRecord(state, TestClocks.T0);

            EntityLifecycle.restore(record, TestClocks.fixedAt(T1));

            assertThat(record.getState()).isEqualTo(EntityState.ACTIVE);
            assertThat(record.getUpdatedAt()).isEqualTo(T1);
        }
    }

    @Test
    void activateAndDeactivateAreUnconditional() {
        ExternalRecord record = new ExternalRecord(EntityState.TERMINATED, TestClocks.T0);

        EntityLifecycle.deactivate(record, TestClocks.fixedAt(T1));
        assertThat(record.isInactive()).isTrue();

        EntityLifecycle.activate(record, TestClocks.fixedAt(T2));
        assertThat(record.isActive()).isTrue();
        assertThat(record.getUpdatedAt()).isEqualTo(T2);
    }

    @Test
    @DisplayName("허용되지 않은 이벤트는 오류 결과를 돌려주고 엔터티를 바꾸지 않는다")
    void rejectsIllegalTransition() {
        ExternalRecord record = new ExternalRecord(EntityState.INACTIVE, TestClocks.T0);

        Result<StateTransition> result = EntityLifecycle.apply(record, LifecycleEvent.PROMOTE, TestClocks.fixedAt(T1));

        assertThat(result.isFailure()).isTrue();
        assertThat(result.error().kind()).isEqualTo(ErrorKind.BUSINESS);
        assertThat(result.error().code()).isEqualTo(EntityLifecycle.ILLEGAL_STATE_TRANSITION);
        assertThat(record.getState()).isEqualTo(EntityState.INACTIVE);
        assertThat(record.getUpdatedAt()).isEqualTo(TestClocks.T0);
    }

    @Test
    void appliesPermittedTransition() {
        ExternalRecord record = new ExternalRecord(EntityState.ACTIVE, TestClocks.T0);

        Result<StateTransition> result = EntityLifecycle.apply(record, LifecycleEvent.PROMOTE, TestClocks.fixedAt(T1));

        assertThat(result.value())
                .isEqualTo(new StateTransition(EntityState.ACTIVE, LifecycleEvent.PROMOTE, EntityState.EFFECTIVE));
        assertThat(record.getState()).isEqualTo(EntityState.EFFECTIVE);
        assertThat(record.getUpdatedAt()).isEqualTo(T1);
    }

    @Test
    void stateOnlyEntityIsMovedWithoutTimestamps() {
        StateOnly stateOnly = new StateOnly();

        EntityLifecycle.softDelete(stateOnly, Clock.systemUTC());

        assertThat(stateOnly.isTerminated()).isTrue();
    }

    private static final class ExternalRecord implements SoftDeletable, Auditable {

        private EntityState state;
        private OffsetDateTime createdAt;
        private OffsetDateTime updatedAt;

        private ExternalRecord(EntityState state, OffsetDateTime timestamp) {
            this.state = state;
            this.createdAt = timestamp;
            this.updatedAt = timestamp;
        }

        @Override
        public EntityState getState() {
            return state;
        }

        @Override
        public void setState(EntityState state) {
            this.state = state;
        }

        @Override
        public OffsetDateTime getCreatedAt() {
            return createdAt;
        }

        @Override
        public void setCreatedAt(OffsetDateTime createdAt) {
            this.createdAt = createdAt;
        }

        @Override
        public OffsetDateTime getUpdatedAt() {
            return updatedAt;
        }

        @Override
        public void setUpdatedAt(OffsetDateTime updatedAt) {
            this.updatedAt = updatedAt;
        }
    }

    private static final class StateOnly implements SoftDeletable {

        private EntityState state = EntityState.ACTIVE;

        @Override
        public EntityState getState() {
            return state;
        }

        @Override
        public void setState(EntityState state) {
            this.state = state;
        }
    }
}
