/**
 * JDBC implementations of the appointment, patient, doctor and re-access store SPIs.
 *
 * <p>All SQL is portable across H2, MySQL and PostgreSQL. Listing queries append
 * parameterized conditions from a fixed set; no caller text reaches the SQL.
 */
package io.clinic.jdbc.store;
