/**
 * Appointment scheduling, attendance policy and re-access workflow.
 *
 * <p>Start with {@link io.clinic.Clinic#builder()}. Every operation returns an
 * {@link io.clinic.Outcome} carrying either a payload or a {@link io.clinic.ClinicError}.
 */
package io.clinic;
