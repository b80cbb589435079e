/**
 * Audit event types and post-commit publishing.
 *
 * @see io.clinic.audit.AuditPublisher
 * @see io.clinic.spi.AuditSink
 */
package io.clinic.audit;
