package io.clinic.spi;

import io.clinic.model.Appointment;
import io.clinic.model.AppointmentStatus;
import io.clinic.model.AppointmentView;
import io.clinic.model.ConflictingAppointment;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence operations for appointment rows.
 *
 * <p>All methods take an explicit {@link Connection} and run inside the caller's
 * unit of work; implementations must not commit or close it.
 *
 * @see io.clinic.schedule.Scheduler
 * @see io.clinic.attendance.AttendanceTracker
 */
public interface AppointmentStore {

    /**
     * Inserts a new appointment in {@link AppointmentStatus#SCHEDULED} and returns its id.
     */
    long insert(Connection conn, long patientId, long doctorId, Instant scheduledAt, String reason,
                Instant createdAt);

    Optional<Appointment> findById(Connection conn, long appointmentId);

    /**
     * Loads an appointment and locks its row until the transaction ends.
     */
    Optional<Appointment> findByIdForUpdate(Connection conn, long appointmentId);

    /**
     * Locks the doctor's calendar so that conflict check and write for the doctor are
     * serialized across concurrent transactions.
     *
     * @return {@code false} if the doctor does not exist
     */
    boolean lockDoctorCalendar(Connection conn, long doctorId);

    /**
     * Finds a {@code scheduled} appointment for the doctor strictly inside ({@code from}, {@code to}).
     */
    Optional<ConflictingAppointment> findConflict(Connection conn, long doctorId, Instant from, Instant to);

    /**
     * Same as {@link #findConflict} but ignores {@code excludedAppointmentId}.
     */
    Optional<ConflictingAppointment> findConflictExcluding(Connection conn, long doctorId, Instant from,
                                                           Instant to, long excludedAppointmentId);

    /**
     * Updates visit time and reason.
     *
     * @return {@code true} if a row was updated
     */
    boolean updateSchedule(Connection conn, long appointmentId, Instant scheduledAt, String reason);

    /**
     * @return {@code true} if a row was updated
     */
    boolean updateStatus(Connection conn, long appointmentId, AppointmentStatus status);

    /**
     * @return {@code true} if a row was deleted
     */
    boolean delete(Connection conn, long appointmentId);

    /**
     * Lists appointments newest visit time first. Each non-null argument narrows the result.
     *
     * @param doctorId  doctor scheduling id, or {@code null}
     * @param patientId patient id, or {@code null}
     * @param status    lifecycle state, or {@code null}
     */
    List<AppointmentView> find(Connection conn, Long doctorId, Long patientId, AppointmentStatus status);
}
