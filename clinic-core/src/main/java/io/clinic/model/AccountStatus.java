package io.clinic.model;

import java.util.Locale;

public enum AccountStatus {
    ACTIVE("active"),
    RESTRICTED("restricted");

    private final String code;

    AccountStatus(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static AccountStatus fromCode(String code) {
        if (code != null) {
            String normalized = code.trim().toLowerCase(Locale.ROOT);
            for (AccountStatus status : values()) {
                if (status.code.equals(normalized)) {
                    return status;
                }
            }
        }
        throw new IllegalArgumentException("Unknown account status: " + code);
    }
}
