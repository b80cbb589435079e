package io.clinic.spi;

import io.clinic.Outcome;

/**
 * Runs a {@link TransactionCallback} as one atomic unit.
 *
 * <p>The transaction commits if and only if the callback returns
 * {@link Outcome.Success}. A {@link Outcome.Failure} result or a thrown exception
 * rolls back every write made by the callback. After-commit callbacks registered
 * through the paired {@link TxContext} run only after a successful commit.
 *
 * <p>Implementations: {@code io.clinic.jdbc.tx.JdbcTransactionRunner},
 * {@code io.clinic.spring.SpringTransactionRunner}.
 */
public interface TransactionRunner {

    /**
     * Executes the callback in a new transaction.
     *
     * @param callback the unit of work
     * @param <T>      the success payload type
     * @return the callback's outcome, after commit or rollback
     * @throws RuntimeException if the transaction cannot be started, committed or
     *                          rolled back, or if the callback throws
     */
    <T> Outcome<T> inTransaction(TransactionCallback<T> callback);
}
