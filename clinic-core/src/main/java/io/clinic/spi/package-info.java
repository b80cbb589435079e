/**
 * Service provider interfaces: unit of work, persistence seams, audit sink and metrics.
 *
 * <p>JDBC implementations live in {@code clinic-jdbc}; Spring-managed transactions
 * in {@code clinic-spring-adapter}.
 */
package io.clinic.spi;
