package com.alphaguard.config;

import com.alphaguard.audit.GovernanceAuditStore;
import com.alphaguard.audit.InMemoryGovernanceAuditStore;
import com.alphaguard.audit.JpaGovernanceAuditStore;
import com.alphaguard.mapper.GovernanceAuditMapper;
import com.alphaguard.repository.jpa.GovernanceAuditLogJpaRepository;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Infrastructure beans for the governance engine: the clock every component
 * reads time from, and the audit store selected by
 * {@code alphaguard.governance.audit.store}.
 */
@Configuration
public class GovernanceConfig {

    private static final Logger log = LoggerFactory.getLogger(GovernanceConfig.class);

    @Bean
    public Clock governanceClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnProperty(name = "alphaguard.governance.audit.store", havingValue = "jpa", matchIfMissing = true)
    public GovernanceAuditStore jpaGovernanceAuditStore(
            GovernanceAuditLogJpaRepository repository, GovernanceAuditMapper mapper) {
        log.info("Governance audit store: jpa (governance_audit_log)");
        return new JpaGovernanceAuditStore(repository, mapper);
    }

    @Bean
    @ConditionalOnProperty(name = "alphaguard.governance.audit.store", havingValue = "memory")
    public GovernanceAuditStore inMemoryGovernanceAuditStore() {
        log.warn("Governance audit store: memory (entries are lost on restart)");
        return new InMemoryGovernanceAuditStore();
    }
}
