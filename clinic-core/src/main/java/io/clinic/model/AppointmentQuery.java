package io.clinic.model;

/**
 * Typed appointment filter. Each non-null component adds one fixed, parameterized
 * condition; a query with no components matches every appointment.
 *
 * @param doctorAccountId doctor's staff login account, resolved to a doctor id before querying
 * @param patientId       patient identifier, or {@code null}
 * @param status          lifecycle state, or {@code null}
 */
public record AppointmentQuery(Long doctorAccountId, Long patientId, AppointmentStatus status) {

    public static AppointmentQuery all() {
        return new AppointmentQuery(null, null, null);
    }

    public static AppointmentQuery forPatient(long patientId) {
        return new AppointmentQuery(null, patientId, null);
    }

    public static AppointmentQuery forDoctorAccount(long doctorAccountId) {
        return new AppointmentQuery(doctorAccountId, null, null);
    }

    public AppointmentQuery withDoctorAccount(long doctorAccountId) {
        return new AppointmentQuery(doctorAccountId, patientId, status);
    }

    public AppointmentQuery withPatient(long patientId) {
        return new AppointmentQuery(doctorAccountId, patientId, status);
    }

    public AppointmentQuery withStatus(AppointmentStatus status) {
        return new AppointmentQuery(doctorAccountId, patientId, status);
    }
}
