package io.clinic.jdbc.store;

import io.clinic.jdbc.JdbcTemplate;
import io.clinic.spi.DoctorDirectory;

import java.sql.Connection;
import java.util.OptionalLong;

/**
 * Resolves staff accounts through {@code doctors.user_id}.
 */
public final class JdbcDoctorDirectory implements DoctorDirectory {

  @Override
  public OptionalLong resolveDoctor(Connection conn, long staffAccountId) {
    return JdbcTemplate.queryOne(conn, "SELECT doctor_id FROM doctors WHERE user_id = ?",
            rs -> rs.getLong(1), staffAccountId)
        .map(OptionalLong::of)
        .orElse(OptionalLong.empty());
  }
}
