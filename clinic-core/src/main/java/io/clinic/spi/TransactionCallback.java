package io.clinic.spi;

import io.clinic.Outcome;

import java.sql.Connection;

/**
 * Work executed inside a single unit of work.
 *
 * @param <T> the success payload type
 * @see TransactionRunner
 */
@FunctionalInterface
public interface TransactionCallback<T> {

    /**
     * Runs the work against the transaction's connection.
     *
     * @param conn the connection bound to the current transaction
     * @return a success to commit, or a failure to roll back
     */
    Outcome<T> doInTransaction(Connection conn);
}
