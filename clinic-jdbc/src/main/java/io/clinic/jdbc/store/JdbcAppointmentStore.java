package io.clinic.jdbc.store;

import io.clinic.jdbc.JdbcTemplate;
import io.clinic.model.AccountStatus;
import io.clinic.model.Appointment;
import io.clinic.model.AppointmentStatus;
import io.clinic.model.AppointmentView;
import io.clinic.model.ConflictingAppointment;
import io.clinic.spi.AppointmentStore;

import java.sql.Connection;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@link AppointmentStore} over the {@code appointments} table using portable SQL
 * (H2, MySQL, PostgreSQL).
 *
 * <p>Row locks use {@code SELECT ... FOR UPDATE}; the doctor calendar lock is taken
 * on the {@code doctors} row.
 */
public final class JdbcAppointmentStore implements AppointmentStore {

  private static final String COLUMNS =
      "a.appointment_id, a.patient_id, a.doctor_id, a.appointment_date, a.reason_for_visit, a.status, a.created_at";

  private static final JdbcTemplate.RowMapper<Appointment> APPOINTMENT_ROW_MAPPER = rs -> new Appointment(
      rs.getLong("appointment_id"),
      rs.getLong("patient_id"),
      rs.getLong("doctor_id"),
      JdbcTemplate.instant(rs, "appointment_date"),
      rs.getString("reason_for_visit"),
      AppointmentStatus.fromCode(rs.getString("status")),
      JdbcTemplate.instant(rs, "created_at"));

  private static final JdbcTemplate.RowMapper<AppointmentView> VIEW_ROW_MAPPER = rs -> {
    String accountStatus = rs.getString("patient_account_status");
    return new AppointmentView(
        APPOINTMENT_ROW_MAPPER.map(rs),
        rs.getString("patient_name"),
        rs.getString("patient_phone"),
        accountStatus == null ? null : AccountStatus.fromCode(accountStatus),
        rs.getString("doctor_name"));
  };

  private static final JdbcTemplate.RowMapper<ConflictingAppointment> CONFLICT_ROW_MAPPER =
      rs -> new ConflictingAppointment(
          rs.getLong("appointment_id"),
          JdbcTemplate.instant(rs, "appointment_date"),
          rs.getString("patient_name"));

  private static final String CONFLICT_SQL =
      "SELECT a.appointment_id, a.appointment_date, p.full_name AS patient_name " +
      "FROM appointments a LEFT JOIN patients p ON p.patient_id = a.patient_id " +
      "WHERE a.doctor_id = ? AND a.status = '" + AppointmentStatus.SCHEDULED.code() + "' " +
      "AND a.appointment_date > ? AND a.appointment_date < ?";

  @Override
  public long insert(Connection conn, long patientId, long doctorId, Instant scheduledAt, String reason,
      Instant createdAt) {
    return JdbcTemplate.insert(conn,
        "INSERT INTO appointments (patient_id, doctor_id, appointment_date, reason_for_visit, status, created_at) " +
            "VALUES (?,?,?,?,?,?)",
        "appointment_id",
        patientId, doctorId, scheduledAt, reason == null ? "" : reason,
        AppointmentStatus.SCHEDULED.code(), createdAt);
  }

  @Override
  public Optional<Appointment> findById(Connection conn, long appointmentId) {
    return JdbcTemplate.queryOne(conn,
        "SELECT " + COLUMNS + " FROM appointments a WHERE a.appointment_id = ?",
        APPOINTMENT_ROW_MAPPER, appointmentId);
  }

  @Override
  public Optional<Appointment> findByIdForUpdate(Connection conn, long appointmentId) {
    return JdbcTemplate.queryOne(conn,
        "SELECT " + COLUMNS + " FROM appointments a WHERE a.appointment_id = ? FOR UPDATE",
        APPOINTMENT_ROW_MAPPER, appointmentId);
  }

  @Override
  public boolean lockDoctorCalendar(Connection conn, long doctorId) {
    return JdbcTemplate.queryOne(conn,
        "SELECT doctor_id FROM doctors WHERE doctor_id = ? FOR UPDATE",
        rs -> rs.getLong(1), doctorId).isPresent();
  }

  @Override
  public Optional<ConflictingAppointment> findConflict(Connection conn, long doctorId, Instant from, Instant to) {
    return JdbcTemplate.queryOne(conn, CONFLICT_SQL + " ORDER BY a.appointment_date",
        CONFLICT_ROW_MAPPER, doctorId, from, to);
  }

  @Override
  public Optional<ConflictingAppointment> findConflictExcluding(Connection conn, long doctorId, Instant from,
      Instant to, long excludedAppointmentId) {
    return JdbcTemplate.queryOne(conn, CONFLICT_SQL + " AND a.appointment_id <> ? ORDER BY a.appointment_date",
        CONFLICT_ROW_MAPPER, doctorId, from, to, excludedAppointmentId);
  }

  @Override
  public boolean updateSchedule(Connection conn, long appointmentId, Instant scheduledAt, String reason) {
    return JdbcTemplate.update(conn,
        "UPDATE appointments SET appointment_date = ?, reason_for_visit = ? WHERE appointment_id = ?",
        scheduledAt, reason == null ? "" : reason, appointmentId) > 0;
  }

  @Override
  public boolean updateStatus(Connection conn, long appointmentId, AppointmentStatus status) {
    return JdbcTemplate.update(conn,
        "UPDATE appointments SET status = ? WHERE appointment_id = ?",
        status.code(), appointmentId) > 0;
  }

  @Override
  public boolean delete(Connection conn, long appointmentId) {
    return JdbcTemplate.update(conn, "DELETE FROM appointments WHERE appointment_id = ?", appointmentId) > 0;
  }

  @Override
  public List<AppointmentView> find(Connection conn, Long doctorId, Long patientId, AppointmentStatus status) {
    StringBuilder sql = new StringBuilder(
        "SELECT " + COLUMNS + ", p.full_name AS patient_name, p.phone_number AS patient_phone, " +
        "p.account_status AS patient_account_status, d.full_name AS doctor_name " +
        "FROM appointments a " +
        "LEFT JOIN patients p ON p.patient_id = a.patient_id " +
        "LEFT JOIN doctors d ON d.doctor_id = a.doctor_id WHERE 1=1");
    List<Object> params = new ArrayList<>(3);
    if (doctorId != null) {
      sql.append(" AND a.doctor_id = ?");
      params.add(doctorId);
    }
    if (patientId != null) {
      sql.append(" AND a.patient_id = ?");
      params.add(patientId);
    }
    if (status != null) {
      sql.append(" AND a.status = ?");
      params.add(status.code());
    }
    sql.append(" ORDER BY a.appointment_date DESC, a.appointment_id DESC");
    return JdbcTemplate.query(conn, sql.toString(), VIEW_ROW_MAPPER, params.toArray());
  }
}
