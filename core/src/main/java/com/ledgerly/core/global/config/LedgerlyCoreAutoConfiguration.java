package com.ledgerly.core.global.config;

import java.time.Clock;

import com.ledgerly.core.global.common.time.TimeConfig;
import com.ledgerly.core.global.security.SecurityContextActorProvider;
import com.ledgerly.core.global.validation.EntityValidator;
import com.ledgerly.core.modules.audit.application.AuditEnforcementPolicy;
import com.ledgerly.core.modules.audit.domain.ActorContextProvider;
import com.ledgerly.core.modules.unitofwork.application.EntityStore;
import com.ledgerly.core.modules.unitofwork.application.UnitOfWorkService;
import com.ledgerly.core.modules.unitofwork.infrastructure.persistence.JpaEntityStore;

import jakarta.persistence.EntityManagerFactory;
import jakarta.validation.Validation;
import jakarta.validation.Validator;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.orm.jpa.HibernateJpaAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.orm.jpa.SharedEntityManagerCreator;

/**
 * Wires the audit policy and unit of work into a host application. Beans the host already defines
 * ({@link Clock}, {@link ActorContextProvider}, {@link EntityStore}) take precedence.
 */
@AutoConfiguration(after = HibernateJpaAutoConfiguration.class)
@EnableConfigurationProperties(LedgerlyAuditProperties.class)
public class LedgerlyCoreAutoConfiguration {

    @Bean
    public AuditEnforcementPolicy auditEnforcementPolicy(Clock clock, LedgerlyAuditProperties properties) {
        return new AuditEnforcementPolicy(clock, properties);
    }

    @Bean
    @ConditionalOnMissingBean(ActorContextProvider.class)
    public ActorContextProvider actorContextProvider() {
        return new SecurityContextActorProvider();
    }

    @Bean
    @ConditionalOnMissingBean(EntityStore.class)
    @ConditionalOnBean(EntityManagerFactory.class)
    public EntityStore entityStore(EntityManagerFactory entityManagerFactory) {
        return new JpaEntityStore(SharedEntityManagerCreator.createSharedEntityManager(entityManagerFactory));
    }

    @Bean
    @ConditionalOnBean(EntityStore.class)
    public UnitOfWorkService unitOfWorkService(
            AuditEnforcementPolicy auditEnforcementPolicy,
            EntityStore entityStore,
            ActorContextProvider actorContextProvider,
            LedgerlyAuditProperties properties
    ) {
        return new UnitOfWorkService(auditEnforcementPolicy, entityStore, actorContextProvider, properties);
    }

    @Bean
    public EntityValidator entityValidator(ObjectProvider<Validator> validator) {
        return new EntityValidator(validator.getIfAvailable(
                () -> Validation.buildDefaultValidatorFactory().getValidator()));
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnMissingBean(Clock.class)
    @Import(TimeConfig.class)
    static class ClockConfiguration {
    }
}
