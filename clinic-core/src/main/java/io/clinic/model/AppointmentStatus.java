package io.clinic.model;

import java.util.Locale;

/**
 * Appointment lifecycle state. {@link #SCHEDULED} is the only non-terminal state.
 */
public enum AppointmentStatus {
    SCHEDULED("scheduled"),
    COMPLETED("completed"),
    MISSED("missed"),
    CANCELLED("cancelled");

    private final String code;

    AppointmentStatus(String code) {
        this.code = code;
    }

    /**
     * Returns the value stored in the {@code status} column.
     */
    public String code() {
        return code;
    }

    public boolean isTerminal() {
        return this != SCHEDULED;
    }

    /**
     * Resolves a stored status code.
     *
     * @throws IllegalArgumentException if the code is unknown
     */
    public static AppointmentStatus fromCode(String code) {
        if (code != null) {
            String normalized = code.trim().toLowerCase(Locale.ROOT);
            for (AppointmentStatus status : values()) {
                if (status.code.equals(normalized)) {
                    return status;
                }
            }
        }
        throw new IllegalArgumentException("Unknown appointment status: " + code);
    }
}
