package io.clinic.jdbc.tx;

import io.clinic.Outcome;
import io.clinic.jdbc.ClinicStoreException;
import io.clinic.spi.TransactionCallback;
import io.clinic.spi.TransactionRunner;

import java.sql.SQLException;
import java.util.Objects;

/**
 * {@link TransactionRunner} over {@link JdbcTransactionManager}: commits when the
 * callback succeeds, rolls back on a failure outcome or an exception.
 *
 * <p>{@link SQLException}s from begin, commit or rollback surface as
 * {@link ClinicStoreException}.
 */
public final class JdbcTransactionRunner implements TransactionRunner {
  private final JdbcTransactionManager txManager;

  public JdbcTransactionRunner(JdbcTransactionManager txManager) {
    this.txManager = Objects.requireNonNull(txManager, "txManager");
  }

  @Override
  public <T> Outcome<T> inTransaction(TransactionCallback<T> callback) {
    Objects.requireNonNull(callback, "callback");
    try (JdbcTransactionManager.Transaction tx = txManager.begin()) {
      Outcome<T> outcome = callback.doInTransaction(tx.connection());
      if (outcome != null && outcome.isSuccess()) {
        tx.commit();
      } else {
        tx.rollback();
      }
      return outcome;
    } catch (SQLException e) {
      throw new ClinicStoreException("Transaction failed", e);
    }
  }
}
