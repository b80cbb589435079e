package io.clinic.model;

/**
 * Appointment joined with the display fields a schedule screen needs.
 * Name, phone and account status are {@code null} when the referenced row is gone.
 */
public record AppointmentView(
    Appointment appointment,
    String patientName,
    String patientPhone,
    AccountStatus patientAccountStatus,
    String doctorName
) {}
