package io.clinic.model;

import java.time.Instant;

/**
 * Read-only record representing a persisted appointment row.
 *
 * @param appointmentId opaque identifier assigned by the store
 * @param patientId     patient the appointment belongs to
 * @param doctorId      doctor scheduling identity (not the staff account id)
 * @param scheduledAt   visit time
 * @param reason        free-text reason for the visit, never {@code null}
 * @param status        lifecycle state
 * @param createdAt     creation time
 */
public record Appointment(
    long appointmentId,
    long patientId,
    long doctorId,
    Instant scheduledAt,
    String reason,
    AppointmentStatus status,
    Instant createdAt
) {}
