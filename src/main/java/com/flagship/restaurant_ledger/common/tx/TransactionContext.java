package com.flagship.restaurant_ledger.common.tx;

import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.function.Supplier;

/**
 * Handle on the transaction opened by {@link TransactionRunner}.
 *
 * Store methods receive this explicitly and issue all their SQL through
 * {@link #jdbc()}, so every statement of an operation joins the same
 * database transaction.
 */
@Slf4j
public class TransactionContext {

    private final JdbcTemplate jdbcTemplate;
    private final TransactionStatus status;

    TransactionContext(JdbcTemplate jdbcTemplate, TransactionStatus status) {
        this.jdbcTemplate = jdbcTemplate;
        this.status = status;
    }

    public JdbcTemplate jdbc() {
        return jdbcTemplate;
    }

    /**
     * Runs work inside a savepoint. On failure the transaction is rolled back
     * to the savepoint and the exception is rethrown; the enclosing
     * transaction stays usable.
     */
    public <T> T savepoint(Supplier<T> work) {
        Object savepoint = status.createSavepoint();
        try {
            T result = work.get();
            status.releaseSavepoint(savepoint);
            return result;
        } catch (RuntimeException e) {
            status.rollbackToSavepoint(savepoint);
            throw e;
        }
    }

    /**
     * Registers a side effect that runs only once the transaction has
     * committed. Failures are logged and dropped.
     */
    public void afterCommit(String description, Runnable action) {
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                try {
                    action.run();
                } catch (RuntimeException e) {
                    log.warn("Post-commit action '{}' failed: {}", description, e.getMessage());
                }
            }
        });
    }
}
