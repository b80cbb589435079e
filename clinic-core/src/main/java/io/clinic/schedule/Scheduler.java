package io.clinic.schedule;

import io.clinic.ClinicError;
import io.clinic.Outcome;
import io.clinic.UnitOfWork;
import io.clinic.audit.AuditEvent;
import io.clinic.audit.AuditEventType;
import io.clinic.audit.AuditPublisher;
import io.clinic.model.Actor;
import io.clinic.model.ActorRole;
import io.clinic.model.Appointment;
import io.clinic.model.AppointmentQuery;
import io.clinic.model.AppointmentStatus;
import io.clinic.model.AppointmentView;
import io.clinic.model.ConflictingAppointment;
import io.clinic.model.PatientAccountState;
import io.clinic.spi.AppointmentStore;
import io.clinic.spi.DoctorDirectory;
import io.clinic.spi.MetricsExporter;
import io.clinic.spi.PatientDirectory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Creates, moves, cancels and deletes appointments while keeping every doctor's
 * {@code scheduled} appointments at least {@link #CONFLICT_WINDOW} apart.
 *
 * <p>Each write runs as one unit of work that first locks the doctor's calendar
 * through {@link AppointmentStore#lockDoctorCalendar}, so the conflict check and
 * the write are serialized per doctor. Two requests for different doctors never
 * wait on each other.
 *
 * <p>Failures come back as {@link Outcome.Failure}; nothing is thrown across this
 * boundary.
 */
public final class Scheduler {

    /**
     * Minimum spacing between two scheduled appointments of the same doctor.
     */
    public static final Duration CONFLICT_WINDOW = Duration.ofMinutes(15);

    static final String RESTRICTED_MESSAGE =
        "This patient's account is restricted due to missed appointments and cannot be booked";

    private final UnitOfWork unitOfWork;
    private final AppointmentStore appointmentStore;
    private final PatientDirectory patientDirectory;
    private final DoctorDirectory doctorDirectory;
    private final AuditPublisher audit;
    private final MetricsExporter metrics;
    private final Clock clock;
    private final DateTimeFormatter displayFormat;

    public Scheduler(
            UnitOfWork unitOfWork,
            AppointmentStore appointmentStore,
            PatientDirectory patientDirectory,
            DoctorDirectory doctorDirectory,
            AuditPublisher audit,
            MetricsExporter metrics,
            Clock clock,
            ZoneId displayZone
    ) {
        this.unitOfWork = Objects.requireNonNull(unitOfWork, "unitOfWork");
        this.appointmentStore = Objects.requireNonNull(appointmentStore, "appointmentStore");
        this.patientDirectory = Objects.requireNonNull(patientDirectory, "patientDirectory");
        this.doctorDirectory = Objects.requireNonNull(doctorDirectory, "doctorDirectory");
        this.audit = Objects.requireNonNull(audit, "audit");
        this.metrics = metrics == null ? MetricsExporter.NOOP : metrics;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.displayFormat = DateTimeFormatter.ofPattern("MMM dd, yyyy HH:mm", Locale.ENGLISH)
            .withZone(Objects.requireNonNull(displayZone, "displayZone"));
    }

    /**
     * Books a new appointment.
     *
     * @param doctorAccountId staff login account of the doctor
     * @param patientId       patient to book
     * @param scheduledAt     visit time
     * @param reason          reason for the visit, may be {@code null}
     * @return the new appointment id, or {@code not_found}, {@code patient_restricted},
     * {@code scheduling_conflict} or {@code validation_error}
     */
    public Outcome<Long> create(long doctorAccountId, long patientId, Instant scheduledAt, String reason) {
        if (scheduledAt == null) {
            return Outcome.failure(new ClinicError.ValidationError("appointmentDate",
                "Appointment date and time are required"));
        }
        if (patientId <= 0) {
            return Outcome.failure(new ClinicError.ValidationError("patientId", "Patient is required"));
        }
        String visitReason = reason == null ? "" : reason.trim();

        Outcome<Long> outcome = unitOfWork.run("appointment create", conn -> {
            OptionalLong doctorId = doctorDirectory.resolveDoctor(conn, doctorAccountId);
            if (doctorId.isEmpty()) {
                return Outcome.failure(ClinicError.NotFound.of("doctor", doctorAccountId));
            }
            Optional<PatientAccountState> patient = patientDirectory.getAccountState(conn, patientId);
            if (patient.isEmpty()) {
                return Outcome.failure(ClinicError.NotFound.of("patient", patientId));
            }
            if (patient.get().isRestricted()) {
                return Outcome.failure(new ClinicError.PatientRestricted(patientId, RESTRICTED_MESSAGE));
            }
            if (!appointmentStore.lockDoctorCalendar(conn, doctorId.getAsLong())) {
                return Outcome.failure(ClinicError.NotFound.of("doctor", doctorAccountId));
            }
            Optional<ConflictingAppointment> conflict = appointmentStore.findConflict(conn,
                doctorId.getAsLong(), scheduledAt.minus(CONFLICT_WINDOW), scheduledAt.plus(CONFLICT_WINDOW));
            if (conflict.isPresent()) {
                return Outcome.failure(toError(conflict.get()));
            }

            long appointmentId = appointmentStore.insert(conn, patientId, doctorId.getAsLong(), scheduledAt,
                visitReason, clock.instant());
            audit.publishAfterCommit(AuditEvent.of(AuditEventType.APPOINTMENT_CREATED,
                    "New appointment scheduled for " + displayFormat.format(scheduledAt),
                    AuditEvent.TARGET_APPOINTMENT, appointmentId, clock.instant())
                .withActor(new Actor(doctorAccountId, null, ActorRole.DOCTOR)));
            return Outcome.success(appointmentId);
        });

        countOutcome(outcome);
        if (outcome.isSuccess()) {
            metrics.incrementAppointmentsCreated();
        }
        return outcome;
    }

    /**
     * Moves an appointment to a new time. Status, patient and doctor stay as they are.
     *
     * @param reason new reason, or {@code null} to keep the current one
     * @return the updated appointment, or {@code not_found}, {@code scheduling_conflict}
     * or {@code validation_error}
     */
    public Outcome<Appointment> reschedule(long appointmentId, Instant newScheduledAt, String reason) {
        if (newScheduledAt == null) {
            return Outcome.failure(new ClinicError.ValidationError("appointmentDate",
                "Appointment date and time are required"));
        }

        Outcome<Appointment> outcome = unitOfWork.run("appointment reschedule", conn -> {
            // appointment row first, then the calendar; no write path locks them the other way round
            Optional<Appointment> current = appointmentStore.findByIdForUpdate(conn, appointmentId);
            if (current.isEmpty()) {
                return Outcome.failure(ClinicError.NotFound.of("appointment", appointmentId));
            }
            Appointment appointment = current.get();
            if (!appointmentStore.lockDoctorCalendar(conn, appointment.doctorId())) {
                return Outcome.failure(ClinicError.NotFound.of("doctor", appointment.doctorId()));
            }
            Optional<ConflictingAppointment> conflict = appointmentStore.findConflictExcluding(conn,
                appointment.doctorId(), newScheduledAt.minus(CONFLICT_WINDOW),
                newScheduledAt.plus(CONFLICT_WINDOW), appointmentId);
            if (conflict.isPresent()) {
                return Outcome.failure(toError(conflict.get()));
            }

            String newReason = reason == null ? appointment.reason() : reason.trim();
            if (!appointmentStore.updateSchedule(conn, appointmentId, newScheduledAt, newReason)) {
                return Outcome.failure(ClinicError.NotFound.of("appointment", appointmentId));
            }
            return Outcome.success(new Appointment(appointmentId, appointment.patientId(),
                appointment.doctorId(), newScheduledAt, newReason, appointment.status(),
                appointment.createdAt()));
        });

        countOutcome(outcome);
        return outcome;
    }

    /**
     * Cancels a scheduled appointment. Cancelling never counts as a miss.
     * Cancelling an already cancelled appointment succeeds without writing.
     *
     * @return {@code not_found}, or {@code invalid_transition} for completed or missed appointments
     */
    public Outcome<Void> cancel(long appointmentId) {
        return unitOfWork.run("appointment cancel", conn -> {
            Optional<Appointment> current = appointmentStore.findByIdForUpdate(conn, appointmentId);
            if (current.isEmpty()) {
                return Outcome.failure(ClinicError.NotFound.of("appointment", appointmentId));
            }
            AppointmentStatus status = current.get().status();
            if (status == AppointmentStatus.CANCELLED) {
                return Outcome.success(null);
            }
            if (status.isTerminal()) {
                return Outcome.failure(new ClinicError.InvalidTransition("appointment", appointmentId,
                    status.code(), "A " + status.code() + " appointment cannot be cancelled"));
            }
            appointmentStore.updateStatus(conn, appointmentId, AppointmentStatus.CANCELLED);
            return Outcome.success(null);
        });
    }

    /**
     * Removes an appointment row. Only admins and doctors may delete, and completed
     * appointments are kept because consultation records may refer to them.
     */
    public Outcome<Void> delete(long appointmentId, Actor actor) {
        if (actor == null || !(actor.hasRole(ActorRole.ADMIN) || actor.hasRole(ActorRole.DOCTOR))) {
            return Outcome.failure(new ClinicError.PermissionDenied("appointment delete",
                "Only administrators and doctors can delete appointments"));
        }
        return unitOfWork.run("appointment delete", conn -> {
            Optional<Appointment> current = appointmentStore.findByIdForUpdate(conn, appointmentId);
            if (current.isEmpty()) {
                return Outcome.failure(ClinicError.NotFound.of("appointment", appointmentId));
            }
            if (current.get().status() == AppointmentStatus.COMPLETED) {
                return Outcome.failure(new ClinicError.InvalidTransition("appointment", appointmentId,
                    AppointmentStatus.COMPLETED.code(), "A completed appointment cannot be deleted"));
            }
            appointmentStore.delete(conn, appointmentId);
            return Outcome.success(null);
        });
    }

    /**
     * Lists appointments newest first. An unknown doctor account yields an empty list.
     */
    public Outcome<List<AppointmentView>> appointments(AppointmentQuery query) {
        AppointmentQuery q = query == null ? AppointmentQuery.all() : query;
        return unitOfWork.run("appointment list", conn -> {
            Long doctorId = null;
            if (q.doctorAccountId() != null) {
                OptionalLong resolved = doctorDirectory.resolveDoctor(conn, q.doctorAccountId());
                if (resolved.isEmpty()) {
                    return Outcome.success(List.of());
                }
                doctorId = resolved.getAsLong();
            }
            return Outcome.success(appointmentStore.find(conn, doctorId, q.patientId(), q.status()));
        });
    }

    /**
     * Lists the appointments of the patient behind a login account. An account with
     * no patient record yields an empty list.
     */
    public Outcome<List<AppointmentView>> appointmentsForPatientAccount(long userAccountId) {
        return unitOfWork.run("patient appointment list", conn -> {
            OptionalLong patientId = patientDirectory.resolvePatient(conn, userAccountId);
            if (patientId.isEmpty()) {
                return Outcome.success(List.of());
            }
            return Outcome.success(appointmentStore.find(conn, null, patientId.getAsLong(), null));
        });
    }

    private ClinicError.SchedulingConflict toError(ConflictingAppointment conflict) {
        String name = conflict.patientName() == null ? "another patient" : conflict.patientName();
        return new ClinicError.SchedulingConflict(conflict.appointmentId(), conflict.scheduledAt(),
            conflict.patientName(),
            "Time conflict: You already have an appointment with " + name + " at "
                + displayFormat.format(conflict.scheduledAt()));
    }

    private void countOutcome(Outcome<?> outcome) {
        if (outcome instanceof Outcome.Failure<?> failure
                && failure.error() instanceof ClinicError.SchedulingConflict) {
            metrics.incrementSchedulingConflicts();
        }
    }
}
