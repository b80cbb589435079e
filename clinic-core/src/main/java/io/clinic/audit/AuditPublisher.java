package io.clinic.audit;

import io.clinic.spi.AuditSink;
import io.clinic.spi.MetricsExporter;
import io.clinic.spi.TxContext;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Emits audit events to an {@link AuditSink} once the surrounding unit of work commits.
 *
 * <p>Audit is a best-effort side channel: a sink failure is logged and counted, and
 * never reaches the caller or unwinds the committed operation. Events registered in
 * a unit of work that rolls back are dropped.
 */
public final class AuditPublisher {
    private static final Logger logger = Logger.getLogger(AuditPublisher.class.getName());

    private final TxContext txContext;
    private final AuditSink sink;
    private final MetricsExporter metrics;

    public AuditPublisher(TxContext txContext, AuditSink sink, MetricsExporter metrics) {
        this.txContext = Objects.requireNonNull(txContext, "txContext");
        this.sink = sink == null ? AuditSink.NOOP : sink;
        this.metrics = metrics == null ? MetricsExporter.NOOP : metrics;
    }

    /**
     * Schedules the event for emission after the current transaction commits.
     *
     * @throws IllegalStateException if no transaction is active
     */
    public void publishAfterCommit(AuditEvent event) {
        Objects.requireNonNull(event, "event");
        // emit() reports delivery; after commit nobody is left to act on it
        txContext.afterCommit(() -> emit(event));
    }

    /**
     * Sends the event to the sink immediately.
     *
     * @return {@code true} if the sink accepted the event, {@code false} if it failed
     */
    public boolean emit(AuditEvent event) {
        try {
            sink.record(event);
            return true;
        } catch (RuntimeException ex) {
            metrics.incrementAuditFailures();
            logger.log(Level.WARNING, "Audit sink failed to record " + event.type().code(), ex);
            return false;
        }
    }
}
