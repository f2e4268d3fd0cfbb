package com.flagship.library_ledger.user;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class UserTest {

    private User user(UserRole role, Set<Permission> permissions) {
        return new User(1L, "alice", "hash", role, null, permissions, null);
    }

    @Test
    @DisplayName("Superadmin holds every permission, reader none, admin its stored set")
    void testHasPermission() {
        User superadmin = user(UserRole.SUPERADMIN, Set.of());
        User admin = user(UserRole.ADMIN, EnumSet.of(Permission.ADD_BOOK));
        User reader = user(UserRole.READER, EnumSet.of(Permission.ADD_BOOK));

        for (Permission permission : Permission.values()) {
            assertTrue(superadmin.hasPermission(permission));
            assertFalse(reader.hasPermission(permission));
        }
        assertTrue(admin.hasPermission(Permission.ADD_BOOK));
        assertFalse(admin.hasPermission(Permission.DELETE_USER));
    }

    @Test
    @DisplayName("Changing role clears permissions")
    void testWithRole_ClearsPermissions() {
        User admin = user(UserRole.ADMIN, EnumSet.of(Permission.VIEW_REPORTS, Permission.ADD_USER));

        User reader = admin.withRole(UserRole.READER);
        assertTrue(reader.getPermissions().isEmpty());

        User stillAdmin = admin.withRole(UserRole.ADMIN);
        assertTrue(stillAdmin.getPermissions().isEmpty());
    }

    @Test
    @DisplayName("Only admins accept a permission set")
    void testWithPermissions() {
        User admin = user(UserRole.ADMIN, Set.of()).withPermissions(EnumSet.of(Permission.UPDATE_BOOK));
        assertEquals(Set.of(Permission.UPDATE_BOOK), admin.getPermissions());

        assertThrows(IllegalStateException.class,
            () -> user(UserRole.READER, Set.of()).withPermissions(EnumSet.of(Permission.ADD_BOOK)));
    }

    @Test
    @DisplayName("Stored blob parsing ignores whitespace and unknown keys")
    void testParseStored() {
        assertEquals(EnumSet.of(Permission.ADD_BOOK, Permission.VIEW_REPORTS),
            Permission.parseStored(" add_book , view_reports,legacy_flag"));
        assertTrue(Permission.parseStored(null).isEmpty());
        assertTrue(Permission.parseStored("").isEmpty());
    }

    @Test
    @DisplayName("Requested keys must all be known")
    void testParseRequested() {
        assertEquals(EnumSet.of(Permission.DELETE_BOOK),
            Permission.parseRequested(List.of("delete_book", " ")));

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> Permission.parseRequested(List.of("add_book", "fly", "teleport")));
        assertEquals("Invalid permissions: fly, teleport", e.getMessage());
    }

    @Test
    @DisplayName("Stored form is sorted and comma separated")
    void testToStored() {
        assertEquals("add_book,view_reports",
            Permission.toStored(EnumSet.of(Permission.VIEW_REPORTS, Permission.ADD_BOOK)));
        assertEquals("", Permission.toStored(Set.of()));
    }

    @Test
    @DisplayName("Role names map to their lowercase column values")
    void testRoleDbValue() {
        UserRoleConverter converter = new UserRoleConverter();

        assertEquals("superadmin", converter.convertToDatabaseColumn(UserRole.SUPERADMIN));
        assertEquals(UserRole.READER, converter.convertToEntityAttribute("reader"));
        assertThrows(IllegalArgumentException.class, () -> UserRole.fromDbValue("librarian"));
    }
}
