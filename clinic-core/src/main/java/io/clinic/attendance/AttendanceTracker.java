package io.clinic.attendance;

import io.clinic.ClinicError;
import io.clinic.Outcome;
import io.clinic.UnitOfWork;
import io.clinic.audit.AuditEvent;
import io.clinic.audit.AuditEventType;
import io.clinic.audit.AuditPublisher;
import io.clinic.model.AccountStatus;
import io.clinic.model.Actor;
import io.clinic.model.Appointment;
import io.clinic.model.AppointmentStatus;
import io.clinic.model.PatientAccountState;
import io.clinic.spi.AppointmentStore;
import io.clinic.spi.MetricsExporter;
import io.clinic.spi.PatientDirectory;

import java.time.Clock;
import java.util.Objects;
import java.util.Optional;

/**
 * Records whether a patient attended, and applies the three-strikes rule.
 *
 * <p>A {@code missed} marking increments the patient's consecutive-missed counter
 * and re-reads it; at {@link #RESTRICTION_THRESHOLD} or above the account is
 * restricted. A {@code completed} marking resets the counter but leaves an existing
 * restriction in place; only an approved re-access request lifts it.
 *
 * <p>The appointment write and the patient write commit together or not at all.
 * Audit events are emitted only after commit.
 */
public final class AttendanceTracker {

    public static final int RESTRICTION_THRESHOLD = 3;

    private final UnitOfWork unitOfWork;
    private final AppointmentStore appointmentStore;
    private final PatientDirectory patientDirectory;
    private final AuditPublisher audit;
    private final MetricsExporter metrics;
    private final Clock clock;

    public AttendanceTracker(
            UnitOfWork unitOfWork,
            AppointmentStore appointmentStore,
            PatientDirectory patientDirectory,
            AuditPublisher audit,
            MetricsExporter metrics,
            Clock clock
    ) {
        this.unitOfWork = Objects.requireNonNull(unitOfWork, "unitOfWork");
        this.appointmentStore = Objects.requireNonNull(appointmentStore, "appointmentStore");
        this.patientDirectory = Objects.requireNonNull(patientDirectory, "patientDirectory");
        this.audit = Objects.requireNonNull(audit, "audit");
        this.metrics = metrics == null ? MetricsExporter.NOOP : metrics;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public Outcome<AttendanceResult> setStatus(long appointmentId, AppointmentStatus newStatus) {
        return setStatus(appointmentId, newStatus, null);
    }

    /**
     * Marks a scheduled appointment {@code completed} or {@code missed}.
     *
     * @param actor the staff member recording attendance, or {@code null}
     * @return the effect on the patient, or {@code validation_error}, {@code not_found}
     * or {@code invalid_transition} when the appointment is no longer scheduled
     */
    public Outcome<AttendanceResult> setStatus(long appointmentId, AppointmentStatus newStatus, Actor actor) {
        if (newStatus != AppointmentStatus.COMPLETED && newStatus != AppointmentStatus.MISSED) {
            return Outcome.failure(new ClinicError.ValidationError("status",
                "Attendance status must be completed or missed"));
        }

        Outcome<AttendanceResult> outcome = unitOfWork.run("attendance " + newStatus.code(), conn -> {
            Optional<Appointment> current = appointmentStore.findByIdForUpdate(conn, appointmentId);
            if (current.isEmpty()) {
                return Outcome.failure(ClinicError.NotFound.of("appointment", appointmentId));
            }
            Appointment appointment = current.get();
            if (appointment.status() != AppointmentStatus.SCHEDULED) {
                return Outcome.failure(new ClinicError.InvalidTransition("appointment", appointmentId,
                    appointment.status().code(),
                    "Attendance can only be recorded for a scheduled appointment"));
            }
            appointmentStore.updateStatus(conn, appointmentId, newStatus);

            long patientId = appointment.patientId();
            if (newStatus == AppointmentStatus.COMPLETED) {
                if (!patientDirectory.setMissedCount(conn, patientId, 0)) {
                    return Outcome.failure(ClinicError.NotFound.of("patient", patientId));
                }
                Optional<PatientAccountState> state = patientDirectory.getAccountState(conn, patientId);
                AccountStatus status = state.map(PatientAccountState::status).orElse(AccountStatus.ACTIVE);
                return Outcome.success(new AttendanceResult(appointmentId, newStatus, patientId, 0, status,
                    false));
            }

            if (!patientDirectory.incrementMissedCount(conn, patientId)) {
                return Outcome.failure(ClinicError.NotFound.of("patient", patientId));
            }
            Optional<PatientAccountState> reread = patientDirectory.getAccountState(conn, patientId);
            if (reread.isEmpty()) {
                return Outcome.failure(ClinicError.NotFound.of("patient", patientId));
            }
            PatientAccountState state = reread.get();
            boolean restrict = state.missedCount() >= RESTRICTION_THRESHOLD;
            AccountStatus status = state.status();
            if (restrict) {
                if (!state.isRestricted()) {
                    patientDirectory.setAccountState(conn, patientId, AccountStatus.RESTRICTED,
                        state.missedCount());
                }
                status = AccountStatus.RESTRICTED;
                audit.publishAfterCommit(AuditEvent.of(AuditEventType.PATIENT_RESTRICTED,
                    "Patient account restricted due to " + RESTRICTION_THRESHOLD + "+ missed appointments: "
                        + state.displayName(),
                    AuditEvent.TARGET_PATIENT, patientId, clock.instant()).withActor(actor));
            }
            audit.publishAfterCommit(AuditEvent.of(AuditEventType.APPOINTMENT_MISSED,
                "Appointment marked as missed", AuditEvent.TARGET_APPOINTMENT, appointmentId,
                clock.instant()).withActor(actor));
            return Outcome.success(new AttendanceResult(appointmentId, newStatus, patientId,
                state.missedCount(), status, restrict));
        });

        if (outcome.isSuccess()) {
            metrics.incrementAttendanceMarked(newStatus);
            if (outcome.value().restrictionApplied()) {
                metrics.incrementPatientsRestricted();
            }
        }
        return outcome;
    }

    /**
     * Reads a patient's account status and consecutive-missed count.
     */
    public Outcome<PatientAccountState> accountState(long patientId) {
        return unitOfWork.run("account state", conn -> patientDirectory.getAccountState(conn, patientId)
            .<Outcome<PatientAccountState>>map(Outcome::success)
            .orElseGet(() -> Outcome.failure(ClinicError.NotFound.of("patient", patientId))));
    }
}
