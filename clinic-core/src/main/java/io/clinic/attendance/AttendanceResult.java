package io.clinic.attendance;

import io.clinic.model.AccountStatus;
import io.clinic.model.AppointmentStatus;

/**
 * Effect of one attendance marking on the appointment and its patient.
 *
 * @param appointmentId      the marked appointment
 * @param status             the recorded outcome
 * @param patientId          the appointment's patient
 * @param missedCount        the patient's consecutive-missed count after the marking
 * @param accountStatus      the patient's account status after the marking
 * @param restrictionApplied {@code true} if the miss left the patient at or above the threshold
 */
public record AttendanceResult(
    long appointmentId,
    AppointmentStatus status,
    long patientId,
    int missedCount,
    AccountStatus accountStatus,
    boolean restrictionApplied
) {}
