package io.clinic.spring;

import io.clinic.spi.TxContext;
import org.springframework.jdbc.datasource.DataSourceUtils;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import javax.sql.DataSource;
import java.sql.Connection;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link TxContext} over Spring's {@link TransactionSynchronizationManager}.
 *
 * <p>Stores receive the connection Spring has bound for {@code dataSource}, so they
 * write inside the surrounding Spring transaction. After-commit callbacks run as a
 * {@link TransactionSynchronization}. Spring lets an exception thrown from
 * {@code afterCommit} escape {@code commit()}; here it is logged instead, so a
 * committed unit of work is never reported to its caller as failed.
 *
 * <p>Requires synchronization on actual transactions (Spring's default).
 *
 * @see SpringTransactionRunner
 */
public final class SpringTxContext implements TxContext {
  private static final Logger logger = Logger.getLogger(SpringTxContext.class.getName());

  private final DataSource dataSource;

  public SpringTxContext(DataSource dataSource) {
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
  }

  @Override
  public boolean isTransactionActive() {
    return TransactionSynchronizationManager.isActualTransactionActive();
  }

  @Override
  public Connection currentConnection() {
    requireSynchronizedTransaction();
    return DataSourceUtils.getConnection(dataSource);
  }

  @Override
  public void afterCommit(Runnable callback) {
    Objects.requireNonNull(callback, "callback");
    requireSynchronizedTransaction();
    TransactionSynchronizationManager.registerSynchronization(new AfterCommitCallback(callback));
  }

  private void requireSynchronizedTransaction() {
    if (!isTransactionActive()) {
      throw new IllegalStateException("No active transaction");
    }
    if (!TransactionSynchronizationManager.isSynchronizationActive()) {
      throw new IllegalStateException("Transaction synchronization is not active for " + dataSource);
    }
  }

  private static final class AfterCommitCallback implements TransactionSynchronization {
    private final Runnable callback;

    private AfterCommitCallback(Runnable callback) {
      this.callback = callback;
    }

    @Override
    public void afterCommit() {
      try {
        callback.run();
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "afterCommit callback failed", e);
      }
    }
  }
}
