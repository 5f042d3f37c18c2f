package com.flagship.restaurant_ledger.common.tx;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.function.Function;

/**
 * Opens the single database transaction of a top-level operation and hands
 * the resulting {@link TransactionContext} to the work. Any runtime
 * exception thrown by the work rolls the transaction back.
 */
@Component
public class TransactionRunner {

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate readWrite;
    private final TransactionTemplate readOnly;
    private final TransactionTemplate requiresNew;

    public TransactionRunner(PlatformTransactionManager transactionManager, JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
        this.readWrite = new TransactionTemplate(transactionManager);
        this.readOnly = new TransactionTemplate(transactionManager);
        this.readOnly.setReadOnly(true);
        this.requiresNew = new TransactionTemplate(transactionManager);
        this.requiresNew.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    public <T> T inTransaction(Function<TransactionContext, T> work) {
        return readWrite.execute(status -> work.apply(new TransactionContext(jdbcTemplate, status)));
    }

    public <T> T readOnly(Function<TransactionContext, T> work) {
        return readOnly.execute(status -> work.apply(new TransactionContext(jdbcTemplate, status)));
    }

    /**
     * Runs work in a fresh transaction, suspending any current one. Used from
     * post-commit callbacks.
     */
    public <T> T inNewTransaction(Function<TransactionContext, T> work) {
        return requiresNew.execute(status -> work.apply(new TransactionContext(jdbcTemplate, status)));
    }
}
