package com.flagship.retail_ledger.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Transaction templates used by the ledger.
 *
 * Writes run at READ COMMITTED: correctness comes from the per-account row locks
 * taken at the start of every booking, not from the isolation level.
 * Reads run at REPEATABLE READ so a balance and the rows it was derived from
 * come from one snapshot.
 * Both carry a timeout so a stuck operation fails instead of hanging.
 */
@Configuration
@Slf4j
public class TransactionConfig {

    @Bean(name = "ledgerTransactionTemplate")
    public TransactionTemplate ledgerTransactionTemplate(
            PlatformTransactionManager transactionManager,
            @Value("${ledger.store.transaction-timeout-seconds:10}") int timeoutSeconds) {
        TransactionTemplate template = new TransactionTemplate(transactionManager);
        template.setIsolationLevel(TransactionDefinition.ISOLATION_READ_COMMITTED);
        template.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRED);
        template.setTimeout(timeoutSeconds);
        log.info("Configured ledger write transactions with {}s timeout", timeoutSeconds);
        return template;
    }

    @Bean(name = "ledgerReadOnlyTransactionTemplate")
    public TransactionTemplate ledgerReadOnlyTransactionTemplate(
            PlatformTransactionManager transactionManager,
            @Value("${ledger.store.transaction-timeout-seconds:10}") int timeoutSeconds) {
        TransactionTemplate template = new TransactionTemplate(transactionManager);
        template.setReadOnly(true);
        template.setIsolationLevel(TransactionDefinition.ISOLATION_REPEATABLE_READ);
        template.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRED);
        template.setTimeout(timeoutSeconds);
        return template;
    }
}
