package io.clinic.jdbc.store;

import io.clinic.jdbc.JdbcTemplate;
import io.clinic.model.AccountStatus;
import io.clinic.model.PatientAccountState;
import io.clinic.spi.PatientDirectory;

import java.sql.Connection;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * {@link PatientDirectory} over the {@code account_status} and
 * {@code consecutive_missed_appointments} columns of {@code patients}.
 */
public final class JdbcPatientDirectory implements PatientDirectory {

  private static final String SELECT_STATE =
      "SELECT patient_id, full_name, account_status, consecutive_missed_appointments FROM patients " +
      "WHERE patient_id = ?";

  private static final JdbcTemplate.RowMapper<PatientAccountState> STATE_ROW_MAPPER = rs -> new PatientAccountState(
      rs.getLong("patient_id"),
      rs.getString("full_name"),
      AccountStatus.fromCode(rs.getString("account_status")),
      rs.getInt("consecutive_missed_appointments"));

  @Override
  public Optional<PatientAccountState> getAccountState(Connection conn, long patientId) {
    return JdbcTemplate.queryOne(conn, SELECT_STATE, STATE_ROW_MAPPER, patientId);
  }

  @Override
  public Optional<PatientAccountState> lockAccountState(Connection conn, long patientId) {
    return JdbcTemplate.queryOne(conn, SELECT_STATE + " FOR UPDATE", STATE_ROW_MAPPER, patientId);
  }

  @Override
  public boolean incrementMissedCount(Connection conn, long patientId) {
    return JdbcTemplate.update(conn,
        "UPDATE patients SET consecutive_missed_appointments = consecutive_missed_appointments + 1 " +
            "WHERE patient_id = ?",
        patientId) > 0;
  }

  @Override
  public boolean setAccountState(Connection conn, long patientId, AccountStatus status, int missedCount) {
    return JdbcTemplate.update(conn,
        "UPDATE patients SET account_status = ?, consecutive_missed_appointments = ? WHERE patient_id = ?",
        status.code(), missedCount, patientId) > 0;
  }

  @Override
  public boolean setMissedCount(Connection conn, long patientId, int missedCount) {
    return JdbcTemplate.update(conn,
        "UPDATE patients SET consecutive_missed_appointments = ? WHERE patient_id = ?",
        missedCount, patientId) > 0;
  }

  @Override
  public OptionalLong resolvePatient(Connection conn, long userAccountId) {
    return JdbcTemplate.queryOne(conn, "SELECT patient_id FROM patients WHERE user_id = ?",
            rs -> rs.getLong(1), userAccountId)
        .map(OptionalLong::of)
        .orElse(OptionalLong.empty());
  }
}
