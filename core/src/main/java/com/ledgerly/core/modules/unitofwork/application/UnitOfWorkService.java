package com.ledgerly.core.modules.unitofwork.application;

import java.util.Objects;

import com.ledgerly.core.global.config.LedgerlyAuditProperties;
import com.ledgerly.core.global.config.LedgerlyAuditProperties.ActorResolutionFailure;
import com.ledgerly.core.modules.audit.application.AuditEnforcementPolicy;
import com.ledgerly.core.modules.audit.domain.ActorContext;
import com.ledgerly.core.modules.audit.domain.ActorContextProvider;
import com.ledgerly.core.modules.audit.domain.AuditReport;
import com.ledgerly.core.modules.unitofwork.domain.CommitResult;
import com.ledgerly.core.modules.unitofwork.domain.UnitOfWork;
import com.ledgerly.core.modules.unitofwork.domain.UnitOfWorkEntry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.annotation.Transactional;

public class UnitOfWorkService {

    private static final Logger log = LoggerFactory.getLogger(UnitOfWorkService.class);

    private final AuditEnforcementPolicy auditEnforcementPolicy;
    private final EntityStore entityStore;
    private final ActorContextProvider actorContextProvider;
    private final LedgerlyAuditProperties properties;

    public UnitOfWorkService(
            AuditEnforcementPolicy auditEnforcementPolicy,
            EntityStore entityStore,
            ActorContextProvider actorContextProvider,
            LedgerlyAuditProperties properties
    ) {
        this.auditEnforcementPolicy = auditEnforcementPolicy;
        this.entityStore = entityStore;
        this.actorContextProvider = actorContextProvider;
        this.properties = properties;
    }

    @Transactional
    public CommitResult commit(UnitOfWork unitOfWork) {
        return commit(unitOfWork, currentActor());
    }

    /**
     * Runs the audit policy once, writes every entry and flushes. The unit of work is cleared only after the
     * flush succeeded, so a failed commit can be retried as is.
     */
    @Transactional
    public CommitResult commit(UnitOfWork unitOfWork, ActorContext actor) {
        Objects.requireNonNull(unitOfWork, "unitOfWork must not be null");
        AuditReport report = auditEnforcementPolicy.enforce(unitOfWork, actor);

        int persisted = 0;
        int merged = 0;
        int removed = 0;
        for (UnitOfWorkEntry entry : unitOfWork.changes()) {
            switch (entry.kind()) {
                case INSERT -> {
                    entityStore.persist(entry.entity());
                    persisted++;
                }
                case UPDATE -> {
                    entityStore.merge(entry.entity(), entry.excludedProperties());
                    merged++;
                }
                case DELETE -> {
                    entityStore.remove(entry.entity());
                    removed++;
                }
            }
        }
        entityStore.flush();
        unitOfWork.clear();

        log.info("Committed unit of work actor={} persisted={} merged={} removed={}",
                report.actorId(), persisted, merged, removed);
        return new CommitResult(report, persisted, merged, removed);
    }

    private ActorContext currentActor() {
        try {
            ActorContext actor = actorContextProvider.currentActor();
            return actor != null ? actor : ActorContext.anonymous();
        } catch (RuntimeException ex) {
            if (properties.actorResolutionFailure() == ActorResolutionFailure.PROPAGATE) {
                throw ex;
            }
            log.warn("Current actor lookup failed, committing without an actor: {}", ex.getMessage());
            return ActorContext.anonymous();
        }
    }
}
