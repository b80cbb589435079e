package io.clinic.model;

import java.time.Instant;

/**
 * A scheduled appointment that falls inside the conflict window of a requested time.
 *
 * @param appointmentId the blocking appointment
 * @param scheduledAt   its visit time
 * @param patientName   its patient's display name, {@code null} if unknown
 */
public record ConflictingAppointment(long appointmentId, Instant scheduledAt, String patientName) {}
