package com.flagship.library_ledger.user;

import com.flagship.library_ledger.config.RowLockTimeout;
import com.flagship.library_ledger.error.ActiveLoansException;
import com.flagship.library_ledger.error.NotFoundException;
import com.flagship.library_ledger.error.StorageErrors;
import com.flagship.library_ledger.ledger.LoanRepository;
import com.flagship.library_ledger.observability.LedgerContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * User account maintenance.
 *
 * Who may call which operation is decided by the caller (see
 * {@link User#hasPermission(Permission)}); this service enforces the rules
 * that hold regardless of the caller: superadmins are never demoted or
 * created by a role change, only admins carry permissions, and users with
 * open loans are not deleted.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class UserAccountService {

    private final UserRepository userRepository;
    private final LoanRepository loanRepository;
    private final PasswordEncoder passwordEncoder;
    private final RowLockTimeout rowLockTimeout;

    /**
     * Registers a user with a hashed password and no permissions.
     *
     * @throws com.flagship.library_ledger.error.ConstraintViolationException if the username is taken
     */
    @Transactional
    public User registerUser(String username, String rawPassword, UserRole role, String phone) {
        if (username == null || username.isBlank() || rawPassword == null || rawPassword.isEmpty()) {
            throw new IllegalArgumentException("Username and password cannot be empty");
        }
        if (role == null) {
            throw new IllegalArgumentException("Role is required");
        }
        String normalizedPhone = normalizePhone(phone);
        if (normalizedPhone != null && !normalizedPhone.chars().allMatch(Character::isDigit)) {
            log.warn("Phone number for '{}' contains non-digit characters", username);
        }

        User user = User.register(username.trim(), passwordEncoder.encode(rawPassword), role, normalizedPhone);
        try {
            UserEntity saved = userRepository.saveAndFlush(UserEntity.fromDomain(user));
            log.info("User registered: userId={}, username='{}', role={}",
                saved.getId(), saved.getUsername(), role.dbValue());
            return saved.toDomain();
        } catch (DataAccessException e) {
            throw StorageErrors.translate("Registering user '" + username + "'", e);
        }
    }

    /**
     * Updates username and phone. A null argument keeps the current value;
     * an empty phone clears it.
     */
    @Transactional
    public User updateProfile(Long userId, String username, String phone) {
        return mutate(userId, "Updating user", current -> {
            String newUsername = username == null || username.isBlank() ? current.getUsername() : username.trim();
            String newPhone = phone == null ? current.getPhone() : normalizePhone(phone);
            return current.withProfile(newUsername, newPhone);
        });
    }

    /**
     * Changes a user's role between reader and admin and clears permissions.
     *
     * @throws IllegalStateException if the target is a superadmin
     * @throws IllegalArgumentException if the new role is superadmin
     */
    @Transactional
    public User assignRole(Long userId, UserRole role) {
        requireAssignableRole(role);
        return mutate(userId, "Assigning role", current -> {
            requireNotSuperadmin(current);
            return current.withRole(role);
        });
    }

    /**
     * Replaces the permission set of an admin.
     *
     * @throws IllegalArgumentException if a key is not a known permission
     * @throws IllegalStateException if the target is not an admin
     */
    @Transactional
    public User assignPermissions(Long userId, Collection<String> permissionKeys) {
        Set<Permission> permissions = Permission.parseRequested(permissionKeys);
        return mutate(userId, "Assigning permissions", current -> current.withPermissions(permissions));
    }

    /**
     * Sets role and permissions in one step. Readers always end up with none.
     */
    @Transactional
    public User assignRoleAndPermissions(Long userId, UserRole role, Collection<String> permissionKeys) {
        requireAssignableRole(role);
        Set<Permission> permissions = role == UserRole.ADMIN
            ? Permission.parseRequested(permissionKeys)
            : Set.of();
        return mutate(userId, "Assigning role and permissions", current -> {
            requireNotSuperadmin(current);
            User changed = current.withRole(role);
            return role == UserRole.ADMIN ? changed.withPermissions(permissions) : changed;
        });
    }

    /**
     * Deletes a user without open loans. Closed loan history is removed with
     * the user by the schema's cascade.
     *
     * @throws NotFoundException if the user does not exist
     * @throws ActiveLoansException if the user has open loans
     */
    @Transactional
    public void deleteUser(Long userId) {
        if (userId == null) {
            throw new IllegalArgumentException("User ID is required");
        }
        LedgerContext.put(LedgerContext.USER_ID_MDC_KEY, userId);
        try {
            // The row lock conflicts with the key-share lock a loan insert takes
            // on its user, so the open-loan count below cannot miss an in-flight loan
            rowLockTimeout.apply();
            UserEntity entity = userRepository.findByIdForUpdate(userId)
                .orElseThrow(() -> NotFoundException.user(userId));
            long openLoans = loanRepository.countByUserIdAndReturnDateIsNull(userId);
            if (openLoans > 0) {
                throw new ActiveLoansException(String.format(
                    "Cannot delete user '%s' with %d active loans", entity.getUsername(), openLoans));
            }
            userRepository.delete(entity);
            userRepository.flush();
            log.info("User deleted: username='{}'", entity.getUsername());
        } catch (DataAccessException e) {
            throw StorageErrors.translate("Deleting user " + userId, e);
        } finally {
            LedgerContext.clear();
        }
    }

    /**
     * Checks a password against the stored hash. No session is created.
     */
    @Transactional(readOnly = true)
    public Optional<User> verifyPassword(String username, String rawPassword) {
        if (username == null || rawPassword == null) {
            return Optional.empty();
        }
        return userRepository.findByUsername(username)
            .map(UserEntity::toDomain)
            .filter(user -> passwordEncoder.matches(rawPassword, user.getPasswordHash()));
    }

    @Transactional(readOnly = true)
    public Optional<User> findUser(Long userId) {
        return userRepository.findById(userId).map(UserEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public Optional<User> findByUsername(String username) {
        return userRepository.findByUsername(username).map(UserEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public List<User> listUsers() {
        return userRepository.findAllByOrderByUsernameAsc().stream()
            .map(UserEntity::toDomain)
            .toList();
    }

    private User mutate(Long userId, String operation, UnaryOperator<User> change) {
        if (userId == null) {
            throw new IllegalArgumentException("User ID is required");
        }
        LedgerContext.put(LedgerContext.USER_ID_MDC_KEY, userId);
        try {
            UserEntity entity = userRepository.findById(userId)
                .orElseThrow(() -> NotFoundException.user(userId));
            User changed = change.apply(entity.toDomain());
            entity.updateFromDomain(changed);
            userRepository.saveAndFlush(entity);
            log.info("{} done: role={}, permissions='{}'",
                operation, changed.getRole().dbValue(), Permission.toStored(changed.getPermissions()));
            return changed;
        } catch (DataAccessException e) {
            throw StorageErrors.translate(operation + " for user " + userId, e);
        } finally {
            LedgerContext.clear();
        }
    }

    private static void requireAssignableRole(UserRole role) {
        if (role == null) {
            throw new IllegalArgumentException("Role is required");
        }
        if (role == UserRole.SUPERADMIN) {
            throw new IllegalArgumentException("Cannot assign 'superadmin' role");
        }
    }

    private static void requireNotSuperadmin(User user) {
        if (user.getRole() == UserRole.SUPERADMIN) {
            throw new IllegalStateException("Cannot modify superadmin role of user " + user.getId());
        }
    }

    private static String normalizePhone(String phone) {
        return phone == null || phone.isBlank() ? null : phone.trim();
    }
}
