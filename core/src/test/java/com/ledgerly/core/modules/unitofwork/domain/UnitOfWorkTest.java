package com.ledgerly.core.modules.unitofwork.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.UUID;

import com.ledgerly.core.modules.audit.domain.ChangeKind;
import com.ledgerly.core.modules.lifecycle.domain.Auditable;
import com.ledgerly.core.modules.lifecycle.domain.UserTracked;
import com.ledgerly.core.support.SampleDocument;
import com.ledgerly.core.support.TestClocks;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class UnitOfWorkTest {

    @Test
    void keepsRegistrationOrder() {
        SampleDocument a = new SampleDocument("a");
        SampleDocument b = new SampleDocument("b");
        SampleDocument c = new SampleDocument("c");
        UnitOfWork unitOfWork = new UnitOfWork();

        unitOfWork.registerModified(b);
        unitOfWork.registerNew(a);
        unitOfWork.registerDeleted(c);

        assertThat(unitOfWork.changes())
                .extracting(UnitOfWorkEntry::entity)
                .containsExactly(b, a, c);
        assertThat(unitOfWork.changes())
                .extracting(UnitOfWorkEntry::kind)
                .containsExactly(ChangeKind.UPDATE, ChangeKind.INSERT, ChangeKind.DELETE);
    }

    @Test
    @DisplayName("같은 인스턴스는 한 번만 추적된다")
    void tracksEachInstanceOnce() {
        SampleDocument document = new SampleDocument("a");
        UnitOfWork unitOfWork = new UnitOfWork();

        unitOfWork.registerModified(document);
        unitOfWork.registerModified(document);

        assertThat(unitOfWork.size()).isEqualTo(1);
    }

    @Test
    void newThenModifiedStaysNew() {
        SampleDocument document = new SampleDocument("a");
        UnitOfWork unitOfWork = new UnitOfWork();

        unitOfWork.registerNew(document);
        unitOfWork.registerModified(document);

        assertThat(unitOfWork.changes().get(0).kind()).isEqualTo(ChangeKind.INSERT);
    }

    @Test
    @DisplayName("등록 직후 삭제된 새 엔터티는 변경 집합에서 빠진다")
    void newThenDeletedIsDropped() {
        SampleDocument document = new SampleDocument("a");
        UnitOfWork unitOfWork = new UnitOfWork();

        unitOfWork.registerNew(document);
        unitOfWork.registerDeleted(document);

        assertThat(unitOfWork.isEmpty()).isTrue();
    }

    @Test
    void modifiedThenDeletedBecomesDeleted() {
        SampleDocument document = new SampleDocument("a");
        UnitOfWork unitOfWork = new UnitOfWork();

        unitOfWork.registerModified(document);
        unitOfWork.registerDeleted(document);

        assertThat(unitOfWork.changes()).singleElement()
                .extracting(UnitOfWorkEntry::kind)
                .isEqualTo(ChangeKind.DELETE);
    }

    @Test
    void deletedThenModifiedStaysDeleted() {
        SampleDocument document = new SampleDocument("a");
        UnitOfWork unitOfWork = new UnitOfWork();

        unitOfWork.registerDeleted(document);
        unitOfWork.registerModified(document);

        assertThat(unitOfWork.changes().get(0).kind()).isEqualTo(ChangeKind.DELETE);
    }

    @Test
    void trackedEntityCannotBeRegisteredAsNew() {
        SampleDocument document = new SampleDocument("a");
        UnitOfWork unitOfWork = new UnitOfWork();
        unitOfWork.registerModified(document);

        assertThatThrownBy(() -> unitOfWork.registerNew(document))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("수정 등록 시점의 생성 시각과 작성자를 기억한다")
    void snapshotsCreationFieldsOnRegistration() {
        UUID creator = UUID.randomUUID();
        SampleDocument document = new SampleDocument("a", TestClocks.fixedAt(TestClocks.T0));
        document.setCreatedBy(creator);
        UnitOfWork unitOfWork = new UnitOfWork();

        unitOfWork.registerModified(document);
        document.setCreatedAt(TestClocks.T0.minusYears(1));
        document.setCreatedBy(null);

        UnitOfWorkEntry entry = unitOfWork.changes().get(0);
        assertThat(entry.hasOriginalValue(Auditable.CREATED_AT)).isTrue();
        assertThat(entry.originalValue(Auditable.CREATED_AT)).isEqualTo(TestClocks.T0);
        assertThat(entry.originalValue(UserTracked.CREATED_BY)).isEqualTo(creator);
    }

    @Test
    @DisplayName("커밋된 생성 정보가 있으면 등록 시점 값보다 우선한다")
    void committedCreationWinsOverRegistrationSnapshot() {
        UUID creator = UUID.randomUUID();
        SampleDocument document = new SampleDocument("a", TestClocks.fixedAt(TestClocks.T0));
        document.recordCommittedCreation(TestClocks.T0, creator);
        document.setCreatedAt(TestClocks.T0.minusYears(1));
        document.setCreatedBy(UUID.randomUUID());
        UnitOfWork unitOfWork = new UnitOfWork();

        unitOfWork.registerModified(document);

        UnitOfWorkEntry entry = unitOfWork.changes().get(0);
        assertThat(entry.originalValue(Auditable.CREATED_AT)).isEqualTo(TestClocks.T0);
        assertThat(entry.originalValue(UserTracked.CREATED_BY)).isEqualTo(creator);
    }

    @Test
    void newEntriesHaveNoOriginals() {
        UnitOfWork unitOfWork = new UnitOfWork();
        unitOfWork.registerNew(new SampleDocument("a"));

        assertThat(unitOfWork.changes().get(0).hasOriginalValue(Auditable.CREATED_AT)).isFalse();
    }

    @Test
    void markModifiedConvertsDelete() {
        SampleDocument document = new SampleDocument("a");
        UnitOfWork unitOfWork = new UnitOfWork();
        unitOfWork.registerDeleted(document);

        UnitOfWorkEntry entry = unitOfWork.changes().get(0);
        entry.markModified();

        assertThat(entry.kind()).isEqualTo(ChangeKind.UPDATE);
        assertThat(entry.isConvertedFromDelete()).isTrue();
    }

    @Test
    void rejectsNullEntities() {
        UnitOfWork unitOfWork = new UnitOfWork();

        assertThatThrownBy(() -> unitOfWork.registerNew(null)).isInstanceOf(NullPointerException.class);
    }
}
