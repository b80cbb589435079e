/**
 * Manual JDBC transaction management.
 *
 * <p>{@link io.clinic.jdbc.tx.JdbcTransactionRunner} is the {@link io.clinic.spi.TransactionRunner}
 * to use without Spring; it drives {@link io.clinic.jdbc.tx.JdbcTransactionManager}, which binds
 * each connection to a {@link io.clinic.jdbc.tx.ThreadLocalTxContext}.
 */
package io.clinic.jdbc.tx;
