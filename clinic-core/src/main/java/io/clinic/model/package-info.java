/**
 * Value types for appointments, patient account state and re-access requests.
 *
 * <p>Records in this package mirror persisted rows; they carry no behavior beyond
 * simple predicates. Status enums expose the lowercase {@code code()} stored in the
 * database.
 */
package io.clinic.model;
