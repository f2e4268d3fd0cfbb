package com.flagship.library_ledger.user;

import lombok.Value;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * User domain object.
 *
 * Role and permission changes return new instances. Changing the role always
 * clears permissions; only admins carry an explicit permission set.
 */
@Value
public class User {
    Long id;
    String username;
    String passwordHash;
    UserRole role;
    String phone;
    Set<Permission> permissions;
    Instant createdAt;

    public static User register(String username, String passwordHash, UserRole role, String phone) {
        return new User(null, username, passwordHash, role, phone,
            Collections.unmodifiableSet(EnumSet.noneOf(Permission.class)), null);
    }

    /**
     * Superadmins implicitly hold every permission and readers hold none.
     */
    public boolean hasPermission(Permission permission) {
        return switch (role) {
            case SUPERADMIN -> true;
            case ADMIN -> permissions.contains(permission);
            case READER -> false;
        };
    }

    public User withRole(UserRole newRole) {
        return new User(id, username, passwordHash, newRole, phone,
            Collections.unmodifiableSet(EnumSet.noneOf(Permission.class)), createdAt);
    }

    /**
     * @throws IllegalStateException if this user is not an admin
     */
    public User withPermissions(Set<Permission> newPermissions) {
        if (role != UserRole.ADMIN) {
            throw new IllegalStateException(
                String.format("Permissions can only be managed for admin users, user %d is %s",
                    id, role.dbValue()));
        }
        EnumSet<Permission> copy = newPermissions.isEmpty()
            ? EnumSet.noneOf(Permission.class)
            : EnumSet.copyOf(newPermissions);
        return new User(id, username, passwordHash, role, phone,
            Collections.unmodifiableSet(copy), createdAt);
    }

    public User withProfile(String newUsername, String newPhone) {
        return new User(id, newUsername, passwordHash, role, newPhone, permissions, createdAt);
    }
}
