package com.williamcallahan.steam_analytics.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Transaction templates for the load phase: one outer transaction per run and a savepoint
 * per record, so one bad record rolls back alone while a cancelled load rolls back entirely.
 */
@Configuration
public class PersistenceConfig {

    @Bean
    public TransactionTemplate loadTransactionTemplate(PlatformTransactionManager transactionManager) {
        TransactionTemplate template = new TransactionTemplate(transactionManager);
        template.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRED);
        template.setName("star-schema-load");
        return template;
    }

    @Bean
    public TransactionTemplate recordTransactionTemplate(PlatformTransactionManager transactionManager) {
        TransactionTemplate template = new TransactionTemplate(transactionManager);
        template.setPropagationBehavior(TransactionDefinition.PROPAGATION_NESTED);
        template.setName("star-schema-record");
        return template;
    }
}
