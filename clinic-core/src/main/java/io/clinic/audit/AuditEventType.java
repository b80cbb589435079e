package io.clinic.audit;

public enum AuditEventType {
    APPOINTMENT_CREATED("appointment_created"),
    APPOINTMENT_MISSED("appointment_missed"),
    PATIENT_RESTRICTED("patient_restricted"),
    REACCESS_SUBMITTED("reaccess_submitted"),
    REACCESS_APPROVED("reaccess_approved"),
    REACCESS_REJECTED("reaccess_rejected");

    private final String code;

    AuditEventType(String code) {
        this.code = code;
    }

    /**
     * Returns the action type recorded in audit logs.
     */
    public String code() {
        return code;
    }
}
