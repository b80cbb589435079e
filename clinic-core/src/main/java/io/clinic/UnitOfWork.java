package io.clinic;

import io.clinic.spi.MetricsExporter;
import io.clinic.spi.TransactionCallback;
import io.clinic.spi.TransactionRunner;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Boundary around {@link TransactionRunner} used by every surface operation.
 *
 * <p>Unexpected runtime failures (driver errors, lock timeouts, constraint
 * violations) are logged, counted and converted into a
 * {@link ClinicError.PersistenceFailure}; the runner has already rolled the unit
 * back by the time the failure is returned.
 */
public final class UnitOfWork {
    private static final Logger logger = Logger.getLogger(UnitOfWork.class.getName());

    private final TransactionRunner runner;
    private final MetricsExporter metrics;

    public UnitOfWork(TransactionRunner runner, MetricsExporter metrics) {
        this.runner = Objects.requireNonNull(runner, "runner");
        this.metrics = metrics == null ? MetricsExporter.NOOP : metrics;
    }

    /**
     * Runs {@code work} in a new transaction.
     *
     * @param operation short operation name used in log lines and failure messages
     * @param work      the unit of work
     * @return the work's outcome, or a persistence failure if it could not commit
     */
    public <T> Outcome<T> run(String operation, TransactionCallback<T> work) {
        Objects.requireNonNull(work, "work");
        try {
            Outcome<T> outcome = runner.inTransaction(work);
            if (outcome == null) {
                throw new IllegalStateException("Unit of work returned no outcome: " + operation);
            }
            if (!outcome.isSuccess() && logger.isLoggable(Level.FINE)) {
                logger.log(Level.FINE, operation + " rejected: " + outcome.error().code());
            }
            return outcome;
        } catch (RuntimeException ex) {
            metrics.incrementPersistenceFailures();
            logger.log(Level.WARNING, operation + " failed, unit of work rolled back", ex);
            return Outcome.failure(new ClinicError.PersistenceFailure(
                "Could not complete " + operation + ", please try again", ex));
        }
    }
}
