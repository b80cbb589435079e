package io.clinic.jdbc.store;

import io.clinic.jdbc.JdbcTemplate;
import io.clinic.model.ReaccessRequest;
import io.clinic.model.ReaccessRequestView;
import io.clinic.model.ReaccessStatus;
import io.clinic.spi.ReaccessStore;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * {@link ReaccessStore} over the {@code reaccess_requests} table.
 */
public final class JdbcReaccessStore implements ReaccessStore {

  private static final String COLUMNS =
      "r.request_id, r.patient_id, r.reason, r.contact_phone, r.status, r.admin_response, " +
      "r.created_at, r.processed_at, r.processed_by";

  private static final String PENDING = ReaccessStatus.PENDING.code();

  private static final JdbcTemplate.RowMapper<ReaccessRequest> REQUEST_ROW_MAPPER = rs -> new ReaccessRequest(
      rs.getLong("request_id"),
      rs.getLong("patient_id"),
      rs.getString("reason"),
      rs.getString("contact_phone"),
      ReaccessStatus.fromCode(rs.getString("status")),
      rs.getString("admin_response"),
      JdbcTemplate.instant(rs, "created_at"),
      JdbcTemplate.instant(rs, "processed_at"),
      JdbcTemplate.nullableLong(rs, "processed_by"));

  private static final JdbcTemplate.RowMapper<ReaccessRequestView> VIEW_ROW_MAPPER = rs -> new ReaccessRequestView(
      REQUEST_ROW_MAPPER.map(rs),
      rs.getString("full_name"),
      rs.getString("national_id"),
      rs.getString("phone_number"),
      rs.getInt("consecutive_missed_appointments"));

  private static final String VIEW_SELECT =
      "SELECT " + COLUMNS + ", p.full_name, p.national_id, p.phone_number, p.consecutive_missed_appointments " +
      "FROM reaccess_requests r LEFT JOIN patients p ON p.patient_id = r.patient_id";

  @Override
  public long insert(Connection conn, long patientId, String reason, String contactPhone, Instant submittedAt) {
    return JdbcTemplate.insert(conn,
        "INSERT INTO reaccess_requests (patient_id, reason, contact_phone, status, created_at) VALUES (?,?,?,?,?)",
        "request_id",
        patientId, reason, contactPhone, PENDING, submittedAt);
  }

  @Override
  public Optional<ReaccessRequest> findById(Connection conn, long requestId) {
    return JdbcTemplate.queryOne(conn,
        "SELECT " + COLUMNS + " FROM reaccess_requests r WHERE r.request_id = ?",
        REQUEST_ROW_MAPPER, requestId);
  }

  @Override
  public Optional<ReaccessRequest> findByIdForUpdate(Connection conn, long requestId) {
    return JdbcTemplate.queryOne(conn,
        "SELECT " + COLUMNS + " FROM reaccess_requests r WHERE r.request_id = ? FOR UPDATE",
        REQUEST_ROW_MAPPER, requestId);
  }

  @Override
  public Optional<ReaccessRequest> findPending(Connection conn, long patientId) {
    return JdbcTemplate.queryOne(conn,
        "SELECT " + COLUMNS + " FROM reaccess_requests r WHERE r.patient_id = ? AND r.status = ? " +
            "ORDER BY r.created_at DESC, r.request_id DESC",
        REQUEST_ROW_MAPPER, patientId, PENDING);
  }

  @Override
  public boolean markProcessed(Connection conn, long requestId, ReaccessStatus status, String adminResponse,
      long processedBy, Instant processedAt) {
    return JdbcTemplate.update(conn,
        "UPDATE reaccess_requests SET status = ?, admin_response = ?, processed_at = ?, processed_by = ? " +
            "WHERE request_id = ? AND status = ?",
        status.code(), adminResponse, processedAt, processedBy, requestId, PENDING) > 0;
  }

  @Override
  public List<ReaccessRequestView> findPendingQueue(Connection conn) {
    return JdbcTemplate.query(conn,
        VIEW_SELECT + " WHERE r.status = ? ORDER BY r.created_at DESC, r.request_id DESC",
        VIEW_ROW_MAPPER, PENDING);
  }

  @Override
  public List<ReaccessRequestView> findAll(Connection conn) {
    return JdbcTemplate.query(conn,
        VIEW_SELECT + " ORDER BY r.created_at DESC, r.request_id DESC",
        VIEW_ROW_MAPPER);
  }
}
