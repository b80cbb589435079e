package io.clinic.jdbc.tx;

import io.clinic.spi.ConnectionProvider;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * Lightweight transaction manager for manual JDBC usage. Obtains a connection,
 * disables auto-commit, and binds it to a {@link ThreadLocalTxContext}.
 *
 * <p>Transactions run at {@link Connection#TRANSACTION_READ_COMMITTED} unless another
 * level is given, so a read that follows a row lock sees rows committed while waiting
 * for it. The connection's previous level is restored before it is closed.
 *
 * <pre>{@code
 * try (var tx = txManager.begin()) {
 *     appointmentStore.updateStatus(txContext.currentConnection(), id, AppointmentStatus.CANCELLED);
 *     tx.commit();
 * }
 * }</pre>
 *
 * @see JdbcTransactionRunner
 */
public final class JdbcTransactionManager {
  private final ConnectionProvider connectionProvider;
  private final ThreadLocalTxContext txContext;
  private final int isolationLevel;

  public JdbcTransactionManager(ConnectionProvider connectionProvider, ThreadLocalTxContext txContext) {
    this(connectionProvider, txContext, Connection.TRANSACTION_READ_COMMITTED);
  }

  /**
   * @param isolationLevel one of the {@code Connection.TRANSACTION_*} constants
   */
  public JdbcTransactionManager(ConnectionProvider connectionProvider, ThreadLocalTxContext txContext,
      int isolationLevel) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.txContext = Objects.requireNonNull(txContext, "txContext");
    this.isolationLevel = isolationLevel;
  }

  public ThreadLocalTxContext txContext() {
    return txContext;
  }

  /**
   * Obtains a connection and binds it to the thread context.
   *
   * @return a new {@link Transaction} handle (use with try-with-resources)
   * @throws SQLException if a connection cannot be obtained or configured
   */
  public Transaction begin() throws SQLException {
    Connection connection = connectionProvider.getConnection();
    int previousIsolation;
    try {
      previousIsolation = connection.getTransactionIsolation();
      if (previousIsolation != isolationLevel) {
        connection.setTransactionIsolation(isolationLevel);
      }
      connection.setAutoCommit(false);
      txContext.bind(connection);
    } catch (SQLException | RuntimeException e) {
      try {
        connection.close();
      } catch (SQLException closeFailure) {
        e.addSuppressed(closeFailure);
      }
      throw e;
    }
    return new Transaction(connection, txContext, previousIsolation);
  }

  /**
   * An active transaction handle. If neither {@link #commit()} nor {@link #rollback()}
   * is called, {@link #close()} rolls back.
   */
  public static final class Transaction implements AutoCloseable {
    private final Connection connection;
    private final ThreadLocalTxContext txContext;
    private final int previousIsolation;
    private boolean completed;

    private Transaction(Connection connection, ThreadLocalTxContext txContext, int previousIsolation) {
      this.connection = connection;
      this.txContext = txContext;
      this.previousIsolation = previousIsolation;
    }

    public Connection connection() {
      return connection;
    }

    public void commit() throws SQLException {
      if (completed) {
        return;
      }
      boolean committed = false;
      try {
        connection.commit();
        committed = true;
      } catch (SQLException e) {
        rollbackQuietly(e);
        throw e;
      } finally {
        finalizeTx(committed);
      }
    }

    public void rollback() throws SQLException {
      if (completed) {
        return;
      }
      try {
        connection.rollback();
      } finally {
        finalizeTx(false);
      }
    }

    @Override
    public void close() throws SQLException {
      if (!completed) {
        rollback();
      }
    }

    private void finalizeTx(boolean committed) throws SQLException {
      completed = true;
      try {
        connection.setAutoCommit(true);
        if (connection.getTransactionIsolation() != previousIsolation) {
          connection.setTransactionIsolation(previousIsolation);
        }
      } finally {
        try {
          connection.close();
        } finally {
          if (committed) {
            txContext.clearAfterCommit();
          } else {
            txContext.clearAfterRollback();
          }
        }
      }
    }

    private void rollbackQuietly(SQLException primary) {
      try {
        connection.rollback();
      } catch (SQLException e) {
        primary.addSuppressed(e);
      }
    }
  }
}
