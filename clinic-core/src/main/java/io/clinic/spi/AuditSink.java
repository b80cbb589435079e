package io.clinic.spi;

import io.clinic.audit.AuditEvent;

/**
 * Receives audit events emitted after a business operation commits.
 *
 * <p>Delivery is fire-and-forget: implementations may throw, but callers never
 * let such a failure affect the committed operation.
 *
 * @see io.clinic.audit.AuditPublisher
 */
@FunctionalInterface
public interface AuditSink {

    /**
     * Sink that discards every event.
     */
    AuditSink NOOP = event -> {
    };

    /**
     * Records a single audit event.
     *
     * @param event the event to record
     */
    void record(AuditEvent event);
}
