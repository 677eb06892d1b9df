package com.di.bugsummary.config;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionOperations;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Transaction boundaries used by the journal writer and the rollup.
 *
 * <p>{@link #REQUIRED_TX} joins the caller's transaction (or starts one); {@link #NESTED_TX}
 * runs its callback under a savepoint so one failing bucket or one losing insert can be rolled
 * back without aborting the surrounding rollup. {@link #REQUIRES_NEW_TX} is for work started from
 * an after-commit callback, where the finished transaction is still bound to the thread.
 * Without persistence they run on {@code InMemorySummaryTransactionManager}.
 */
@Configuration
public class BugSummaryConfiguration {

    public static final String REQUIRED_TX = "bugSummaryRequiredTx";
    public static final String NESTED_TX = "bugSummaryNestedTx";
    public static final String REQUIRES_NEW_TX = "bugSummaryRequiresNewTx";

    @Bean(REQUIRED_TX)
    public TransactionOperations bugSummaryRequiredTx(ObjectProvider<PlatformTransactionManager> transactionManager) {
        return transactionOperations(transactionManager, TransactionDefinition.PROPAGATION_REQUIRED);
    }

    @Bean(NESTED_TX)
    public TransactionOperations bugSummaryNestedTx(ObjectProvider<PlatformTransactionManager> transactionManager) {
        return transactionOperations(transactionManager, TransactionDefinition.PROPAGATION_NESTED);
    }

    @Bean(REQUIRES_NEW_TX)
    public TransactionOperations bugSummaryRequiresNewTx(ObjectProvider<PlatformTransactionManager> transactionManager) {
        return transactionOperations(transactionManager, TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    private static TransactionOperations transactionOperations(ObjectProvider<PlatformTransactionManager> transactionManager,
                                                               int propagation) {
        PlatformTransactionManager tm = transactionManager.getIfAvailable();
        if (tm == null) {
            return TransactionOperations.withoutTransaction();
        }
        TransactionTemplate template = new TransactionTemplate(tm);
        template.setPropagationBehavior(propagation);
        return template;
    }
}
