package com.flagship.library_ledger.user;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Administrative permissions an admin account may hold.
 *
 * Stored in {@code users.permissions} as a comma-separated list of keys,
 * e.g. {@code "add_book,view_reports"}.
 */
public enum Permission {
    ADD_BOOK("add_book"),
    UPDATE_BOOK("update_book"),
    DELETE_BOOK("delete_book"),
    ADD_USER("add_user"),
    UPDATE_USER("update_user"),
    DELETE_USER("delete_user"),
    VIEW_REPORTS("view_reports");

    private final String key;

    Permission(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static Optional<Permission> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        String trimmed = key.trim();
        return Arrays.stream(values())
            .filter(p -> p.key.equals(trimmed))
            .findFirst();
    }

    /**
     * Parses a stored permissions blob. Unknown keys are ignored, since the
     * column is free-form and may hold entries written by other tools.
     */
    public static Set<Permission> parseStored(String blob) {
        if (blob == null || blob.isBlank()) {
            return Collections.unmodifiableSet(EnumSet.noneOf(Permission.class));
        }
        EnumSet<Permission> result = EnumSet.noneOf(Permission.class);
        for (String part : blob.split(",")) {
            fromKey(part).ifPresent(result::add);
        }
        return Collections.unmodifiableSet(result);
    }

    /**
     * Parses permission keys supplied by an administrator.
     *
     * @throws IllegalArgumentException if {@code keys} is null or holds unknown keys, which the message lists
     */
    public static Set<Permission> parseRequested(Collection<String> keys) {
        if (keys == null) {
            throw new IllegalArgumentException("Permissions are required");
        }
        EnumSet<Permission> result = EnumSet.noneOf(Permission.class);
        List<String> invalid = new ArrayList<>();
        for (String key : keys) {
            if (key == null || key.isBlank()) {
                continue;
            }
            fromKey(key).ifPresentOrElse(result::add, () -> invalid.add(key.trim()));
        }
        if (!invalid.isEmpty()) {
            throw new IllegalArgumentException("Invalid permissions: " + String.join(", ", invalid));
        }
        return Collections.unmodifiableSet(result);
    }

    public static String toStored(Set<Permission> permissions) {
        return permissions.stream()
            .sorted()
            .map(Permission::key)
            .collect(Collectors.joining(","));
    }
}
