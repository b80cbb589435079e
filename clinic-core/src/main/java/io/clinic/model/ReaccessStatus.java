package io.clinic.model;

import java.util.Locale;

/**
 * Re-access request state. {@link #APPROVED} and {@link #REJECTED} are terminal.
 */
public enum ReaccessStatus {
    PENDING("pending"),
    APPROVED("approved"),
    REJECTED("rejected");

    private final String code;

    ReaccessStatus(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static ReaccessStatus fromCode(String code) {
        if (code != null) {
            String normalized = code.trim().toLowerCase(Locale.ROOT);
            for (ReaccessStatus status : values()) {
                if (status.code.equals(normalized)) {
                    return status;
                }
            }
        }
        throw new IllegalArgumentException("Unknown re-access status: " + code);
    }
}
