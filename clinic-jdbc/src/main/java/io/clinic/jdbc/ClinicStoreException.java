package io.clinic.jdbc;

/**
 * Unchecked exception wrapping JDBC errors thrown by {@link JdbcTemplate} and the
 * stores in {@link io.clinic.jdbc.store}.
 */
public final class ClinicStoreException extends RuntimeException {
  public ClinicStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
