package io.clinic.jdbc.tx;

import io.clinic.spi.TxContext;

import java.sql.Connection;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link TxContext} implementation that stores transaction state in a {@link ThreadLocal}.
 *
 * <p>Bound and cleared by {@link JdbcTransactionManager}. Callbacks registered with
 * {@link #afterCommit} run once the transaction commits and are discarded on rollback;
 * a failing callback is logged and does not stop the others or reach the caller.
 *
 * @see JdbcTransactionManager
 */
public final class ThreadLocalTxContext implements TxContext {
  private static final Logger logger = Logger.getLogger(ThreadLocalTxContext.class.getName());

  private final ThreadLocal<TxState> state = new ThreadLocal<>();

  @Override
  public boolean isTransactionActive() {
    return state.get() != null;
  }

  @Override
  public Connection currentConnection() {
    return current().connection;
  }

  @Override
  public void afterCommit(Runnable callback) {
    current().afterCommit.add(callback);
  }

  void bind(Connection connection) {
    if (state.get() != null) {
      throw new IllegalStateException("Transaction already active");
    }
    state.set(new TxState(connection));
  }

  void clearAfterCommit() {
    TxState current = state.get();
    if (current == null) {
      return;
    }
    // unbind first so a callback may start its own transaction
    state.remove();
    for (Runnable callback : current.afterCommit) {
      try {
        callback.run();
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "afterCommit callback failed", e);
      }
    }
  }

  void clearAfterRollback() {
    state.remove();
  }

  private TxState current() {
    TxState current = state.get();
    if (current == null) {
      throw new IllegalStateException("No active transaction");
    }
    return current;
  }

  private static final class TxState {
    private final Connection connection;
    private final List<Runnable> afterCommit = new ArrayList<>();

    private TxState(Connection connection) {
      this.connection = connection;
    }
  }
}
