package io.clinic.spi;

import io.clinic.model.AppointmentStatus;

/**
 * Observability hook for exporting scheduling and attendance counters to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of appointments created.
     */
    void incrementAppointmentsCreated();

    /**
     * Increments the count of create or reschedule attempts rejected by the conflict window.
     */
    void incrementSchedulingConflicts();

    /**
     * Increments the count of attendance outcomes recorded.
     *
     * @param status {@link AppointmentStatus#COMPLETED} or {@link AppointmentStatus#MISSED}
     */
    void incrementAttendanceMarked(AppointmentStatus status);

    /**
     * Increments the count of missed transitions that left a patient restricted.
     */
    void incrementPatientsRestricted();

    /**
     * Increments the count of re-access requests submitted.
     */
    void incrementReaccessSubmitted();

    /**
     * Increments the count of re-access requests approved.
     */
    void incrementReaccessApproved();

    /**
     * Increments the count of re-access requests rejected.
     */
    void incrementReaccessRejected();

    /**
     * Increments the count of audit events the sink failed to record.
     */
    default void incrementAuditFailures() {
    }

    /**
     * Increments the count of units of work that failed with an unexpected error.
     */
    default void incrementPersistenceFailures() {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementAppointmentsCreated() {
        }

        @Override
        public void incrementSchedulingConflicts() {
        }

        @Override
        public void incrementAttendanceMarked(AppointmentStatus status) {
        }

        @Override
        public void incrementPatientsRestricted() {
        }

        @Override
        public void incrementReaccessSubmitted() {
        }

        @Override
        public void incrementReaccessApproved() {
        }

        @Override
        public void incrementReaccessRejected() {
        }
    }
}
