package io.clinic.model;

import java.util.Locale;

public enum ActorRole {
    ADMIN("admin"),
    DOCTOR("doctor"),
    NURSE("nurse"),
    PATIENT("patient");

    private final String code;

    ActorRole(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static ActorRole fromCode(String code) {
        if (code != null) {
            String normalized = code.trim().toLowerCase(Locale.ROOT);
            for (ActorRole role : values()) {
                if (role.code.equals(normalized)) {
                    return role;
                }
            }
        }
        throw new IllegalArgumentException("Unknown role: " + code);
    }
}
