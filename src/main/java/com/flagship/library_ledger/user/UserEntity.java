package com.flagship.library_ledger.user;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * JPA entity for the {@code users} table.
 *
 * No setters: rows are created through {@link #fromDomain(User)} and changed
 * only through {@link #updateFromDomain(User)}.
 */
@Entity
@Table(name = "users")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class UserEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "user_id", nullable = false, updatable = false)
    private Long id;

    @Column(nullable = false, unique = true, length = 50)
    private String username;

    @Column(name = "password_hash", nullable = false)
    private String passwordHash;

    @Convert(converter = UserRoleConverter.class)
    @Column(nullable = false, length = 16)
    private UserRole role;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(length = 20)
    private String phone;

    @Column(columnDefinition = "TEXT")
    private String permissions;

    @PrePersist
    void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
    }

    static UserEntity fromDomain(User user) {
        return new UserEntity(
            null, // id - assigned by the identity column
            user.getUsername(),
            user.getPasswordHash(),
            user.getRole(),
            null, // createdAt - set by @PrePersist
            user.getPhone(),
            Permission.toStored(user.getPermissions())
        );
    }

    public User toDomain() {
        return new User(
            id,
            username,
            passwordHash,
            role,
            phone,
            Permission.parseStored(permissions),
            createdAt
        );
    }

    /**
     * Copies the mutable columns. The credential hash and creation time never change here.
     */
    void updateFromDomain(User user) {
        this.username = user.getUsername();
        this.role = user.getRole();
        this.phone = user.getPhone();
        this.permissions = Permission.toStored(user.getPermissions());
    }
}
