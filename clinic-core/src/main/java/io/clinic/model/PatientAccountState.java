package io.clinic.model;

/**
 * The facet of a patient record owned by the attendance policy.
 *
 * @param patientId   patient identifier
 * @param displayName the patient's full name, used in audit descriptions
 * @param status      cached restriction flag
 * @param missedCount consecutive missed appointments since the last reset
 */
public record PatientAccountState(long patientId, String displayName, AccountStatus status, int missedCount) {

    public PatientAccountState {
        if (missedCount < 0) {
            throw new IllegalArgumentException("missedCount must not be negative");
        }
    }

    public boolean isRestricted() {
        return status == AccountStatus.RESTRICTED;
    }
}
