package com.ledgerly.core.global.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Binds {@code ledgerly.audit.*}.
 *
 * @param softDeleteEnabled      when {@code false}, deletes of soft-deletable entities are removed physically
 * @param actorResolutionFailure what to do when the current actor lookup throws
 */
@ConfigurationProperties(prefix = "ledgerly.audit")
public record LedgerlyAuditProperties(
        @DefaultValue("true") boolean softDeleteEnabled,
        @DefaultValue("IGNORE") ActorResolutionFailure actorResolutionFailure
) {

    public LedgerlyAuditProperties {
        if (actorResolutionFailure == null) {
            actorResolutionFailure = ActorResolutionFailure.IGNORE;
        }
    }

    public static LedgerlyAuditProperties defaults() {
        return new LedgerlyAuditProperties(true, ActorResolutionFailure.IGNORE);
    }

    public enum ActorResolutionFailure {
        /** Log the failure and continue as if no actor were authenticated. */
        IGNORE,
        /** Rethrow and abort the commit. */
        PROPAGATE
    }
}
