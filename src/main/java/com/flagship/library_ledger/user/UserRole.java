package com.flagship.library_ledger.user;

import java.util.Arrays;

/**
 * Account role. Persisted as its lowercase name.
 */
public enum UserRole {
    READER("reader"),
    ADMIN("admin"),
    SUPERADMIN("superadmin");

    private final String dbValue;

    UserRole(String dbValue) {
        this.dbValue = dbValue;
    }

    public String dbValue() {
        return dbValue;
    }

    public static UserRole fromDbValue(String value) {
        return Arrays.stream(values())
            .filter(role -> role.dbValue.equalsIgnoreCase(value))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Invalid role: " + value));
    }
}
