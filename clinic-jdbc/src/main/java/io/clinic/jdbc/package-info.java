/**
 * JDBC plumbing shared by the stores: connection provider, {@link io.clinic.jdbc.JdbcTemplate}
 * helpers and {@link io.clinic.jdbc.ClinicStoreException}.
 *
 * <p>Schema scripts for H2, MySQL and PostgreSQL ship under {@code schema/} on the classpath.
 *
 * @see io.clinic.jdbc.store
 * @see io.clinic.jdbc.tx
 */
package io.clinic.jdbc;
