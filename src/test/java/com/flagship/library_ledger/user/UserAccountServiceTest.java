package com.flagship.library_ledger.user;

import com.flagship.library_ledger.config.RowLockTimeout;
import com.flagship.library_ledger.error.ActiveLoansException;
import com.flagship.library_ledger.error.ConstraintViolationException;
import com.flagship.library_ledger.error.NotFoundException;
import com.flagship.library_ledger.ledger.LoanRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class UserAccountServiceTest {

    private static final Long USER_ID = 7L;

    @Mock
    private UserRepository userRepository;
    @Mock
    private LoanRepository loanRepository;
    @Mock
    private RowLockTimeout rowLockTimeout;

    // Low cost factor keeps hashing fast in tests
    private final BCryptPasswordEncoder passwordEncoder = new BCryptPasswordEncoder(4);
    private UserAccountService accounts;

    @BeforeEach
    void setUp() {
        accounts = new UserAccountService(userRepository, loanRepository, passwordEncoder, rowLockTimeout);
        when(userRepository.saveAndFlush(any(UserEntity.class))).thenAnswer(invocation -> invocation.getArgument(0));
    }

    private UserEntity stored(UserRole role, Set<Permission> permissions) {
        User user = new User(USER_ID, "alice", passwordEncoder.encode("secret"), role, null, permissions, null);
        UserEntity entity = UserEntity.fromDomain(user);
        when(userRepository.findById(USER_ID)).thenReturn(Optional.of(entity));
        when(userRepository.findByIdForUpdate(USER_ID)).thenReturn(Optional.of(entity));
        return entity;
    }

    @Test
    @DisplayName("Registering stores a BCrypt hash, never the raw password")
    void testRegisterUser() {
        User user = accounts.registerUser(" alice ", "secret", UserRole.READER, " 0123456789 ");

        ArgumentCaptor<UserEntity> saved = ArgumentCaptor.forClass(UserEntity.class);
        verify(userRepository).saveAndFlush(saved.capture());
        assertEquals("alice", user.getUsername());
        assertEquals("0123456789", user.getPhone());
        assertNotEquals("secret", saved.getValue().getPasswordHash());
        assertTrue(passwordEncoder.matches("secret", saved.getValue().getPasswordHash()));
        assertTrue(user.getPermissions().isEmpty());
    }

    @Test
    @DisplayName("A taken username surfaces as CONSTRAINT_VIOLATION")
    void testRegisterUser_UsernameTaken() {
        when(userRepository.saveAndFlush(any(UserEntity.class)))
            .thenThrow(new DataIntegrityViolationException("duplicate key value violates unique constraint"));

        assertThrows(ConstraintViolationException.class,
            () -> accounts.registerUser("alice", "secret", UserRole.READER, null));
    }

    @Test
    @DisplayName("Empty username or password is rejected")
    void testRegisterUser_MissingCredentials() {
        assertThrows(IllegalArgumentException.class,
            () -> accounts.registerUser(" ", "secret", UserRole.READER, null));
        assertThrows(IllegalArgumentException.class,
            () -> accounts.registerUser("alice", "", UserRole.READER, null));
        verify(userRepository, never()).saveAndFlush(any());
    }

    @Test
    @DisplayName("Password verification matches only the right password")
    void testVerifyPassword() {
        UserEntity entity = stored(UserRole.READER, Set.of());
        when(userRepository.findByUsername("alice")).thenReturn(Optional.of(entity));
        when(userRepository.findByUsername("bob")).thenReturn(Optional.empty());

        assertTrue(accounts.verifyPassword("alice", "secret").isPresent());
        assertTrue(accounts.verifyPassword("alice", "wrong").isEmpty());
        assertTrue(accounts.verifyPassword("bob", "secret").isEmpty());
        assertTrue(accounts.verifyPassword(null, "secret").isEmpty());
    }

    @Test
    @DisplayName("Changing role clears permissions")
    void testAssignRole() {
        stored(UserRole.ADMIN, Set.of(Permission.ADD_BOOK, Permission.VIEW_REPORTS));

        User changed = accounts.assignRole(USER_ID, UserRole.READER);

        assertEquals(UserRole.READER, changed.getRole());
        assertTrue(changed.getPermissions().isEmpty());
    }

    @Test
    @DisplayName("Superadmin can neither be assigned nor demoted")
    void testAssignRole_Superadmin() {
        stored(UserRole.SUPERADMIN, Set.of());

        assertThrows(IllegalArgumentException.class, () -> accounts.assignRole(USER_ID, UserRole.SUPERADMIN));
        assertThrows(IllegalStateException.class, () -> accounts.assignRole(USER_ID, UserRole.READER));
    }

    @Test
    @DisplayName("Permissions are managed only for admins and must be known keys")
    void testAssignPermissions() {
        stored(UserRole.ADMIN, Set.of());

        User changed = accounts.assignPermissions(USER_ID, List.of("add_book", "view_reports"));
        assertEquals(Set.of(Permission.ADD_BOOK, Permission.VIEW_REPORTS), changed.getPermissions());

        IllegalArgumentException unknown = assertThrows(IllegalArgumentException.class,
            () -> accounts.assignPermissions(USER_ID, List.of("add_book", "fly")));
        assertEquals("Invalid permissions: fly", unknown.getMessage());

        stored(UserRole.READER, Set.of());
        assertThrows(IllegalStateException.class,
            () -> accounts.assignPermissions(USER_ID, List.of("add_book")));
    }

    @Test
    @DisplayName("Promoting to admin with permissions happens in one step")
    void testAssignRoleAndPermissions() {
        stored(UserRole.READER, Set.of());

        User changed = accounts.assignRoleAndPermissions(USER_ID, UserRole.ADMIN, List.of("delete_user"));

        assertEquals(UserRole.ADMIN, changed.getRole());
        assertEquals(Set.of(Permission.DELETE_USER), changed.getPermissions());
    }

    @Test
    @DisplayName("Updating the profile keeps unspecified fields and clears an empty phone")
    void testUpdateProfile() {
        UserEntity entity = stored(UserRole.READER, Set.of());
        entity.updateFromDomain(entity.toDomain().withProfile("alice", "555"));

        assertEquals("555", accounts.updateProfile(USER_ID, null, null).getPhone());
        User changed = accounts.updateProfile(USER_ID, "alice2", "");
        assertEquals("alice2", changed.getUsername());
        assertNull(changed.getPhone());
    }

    @Test
    @DisplayName("A user with open loans cannot be deleted")
    void testDeleteUser_WithOpenLoans() {
        UserEntity entity = stored(UserRole.READER, Set.of());
        when(loanRepository.countByUserIdAndReturnDateIsNull(USER_ID)).thenReturn(2L);

        assertThrows(ActiveLoansException.class, () -> accounts.deleteUser(USER_ID));
        verify(userRepository, never()).delete(entity);

        when(loanRepository.countByUserIdAndReturnDateIsNull(USER_ID)).thenReturn(0L);
        accounts.deleteUser(USER_ID);
        verify(userRepository).delete(entity);
    }

    @Test
    @DisplayName("Deleting locks the user row before counting open loans")
    void testDeleteUser_LocksBeforeCounting() {
        UserEntity entity = stored(UserRole.READER, Set.of());
        when(loanRepository.countByUserIdAndReturnDateIsNull(USER_ID)).thenReturn(0L);

        accounts.deleteUser(USER_ID);

        var order = inOrder(rowLockTimeout, userRepository, loanRepository);
        order.verify(rowLockTimeout).apply();
        order.verify(userRepository).findByIdForUpdate(USER_ID);
        order.verify(loanRepository).countByUserIdAndReturnDateIsNull(USER_ID);
        order.verify(userRepository).delete(entity);
        verify(userRepository, never()).findById(USER_ID);
    }

    @Test
    @DisplayName("Null permission lists are rejected as malformed arguments")
    void testAssignPermissions_Null() {
        stored(UserRole.ADMIN, Set.of());

        assertThrows(IllegalArgumentException.class, () -> accounts.assignPermissions(USER_ID, null));
        assertThrows(IllegalArgumentException.class,
            () -> accounts.assignRoleAndPermissions(USER_ID, UserRole.ADMIN, null));
        verify(userRepository, never()).saveAndFlush(any());
    }

    @Test
    @DisplayName("Deleting an unknown user fails NOT_FOUND")
    void testDeleteUser_NotFound() {
        when(userRepository.findByIdForUpdate(USER_ID)).thenReturn(Optional.empty());

        assertThrows(NotFoundException.class, () -> accounts.deleteUser(USER_ID));
    }
}
