package io.clinic.spring;

import io.clinic.Outcome;
import io.clinic.spi.TransactionCallback;
import io.clinic.spi.TransactionRunner;
import io.clinic.spi.TxContext;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Objects;

/**
 * {@link TransactionRunner} over a Spring {@link TransactionTemplate}.
 *
 * <p>Created from a transaction manager, the template runs at read-committed
 * isolation. A {@link Outcome.Failure} marks the transaction rollback-only; exceptions roll
 * back through the template. With the default propagation
 * ({@code PROPAGATION_REQUIRED}) a call made inside an existing Spring transaction
 * joins it, and a failure outcome then dooms the outer transaction as well.
 */
public final class SpringTransactionRunner implements TransactionRunner {
  private final TransactionTemplate transactionTemplate;
  private final TxContext txContext;

  public SpringTransactionRunner(PlatformTransactionManager transactionManager, TxContext txContext) {
    this(readCommitted(Objects.requireNonNull(transactionManager, "transactionManager")), txContext);
  }

  public SpringTransactionRunner(TransactionTemplate transactionTemplate, TxContext txContext) {
    this.transactionTemplate = Objects.requireNonNull(transactionTemplate, "transactionTemplate");
    this.txContext = Objects.requireNonNull(txContext, "txContext");
  }

  private static TransactionTemplate readCommitted(PlatformTransactionManager transactionManager) {
    TransactionTemplate template = new TransactionTemplate(transactionManager);
    template.setIsolationLevel(TransactionDefinition.ISOLATION_READ_COMMITTED);
    return template;
  }

  @Override
  public <T> Outcome<T> inTransaction(TransactionCallback<T> callback) {
    Objects.requireNonNull(callback, "callback");
    return transactionTemplate.execute(status -> {
      Outcome<T> outcome = callback.doInTransaction(txContext.currentConnection());
      if (outcome == null || !outcome.isSuccess()) {
        status.setRollbackOnly();
      }
      return outcome;
    });
  }
}
