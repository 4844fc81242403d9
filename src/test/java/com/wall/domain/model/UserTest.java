package com.wall.domain.model;

import com.wall.domain.error.ValidationError.UserValidationError;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class UserTest {

    @Test
    void shouldCreateUserWithTimestamp() {
        UUID id = UUID.randomUUID();

        User user = User.create(id, "ada@example.com", "ada_l", "hash");

        assertEquals(id, user.id());
        assertEquals("ada_l", user.username());
        assertNotNull(user.createdAt());
        assertEquals(0, user.createdAt().getNano() % 1000);
    }

    @Test
    void shouldLowercaseEmailDomainOnly() {
        var result = User.normalizeEmail("  Ada.Lovelace@Example.COM ");

        assertEquals("Ada.Lovelace@example.com", result.getOrThrow());
    }

    @Test
    void shouldRejectMalformedEmail() {
        assertInstanceOf(UserValidationError.InvalidEmail.class, User.normalizeEmail("no-at-sign").errorOrNull());
        assertInstanceOf(UserValidationError.InvalidEmail.class, User.normalizeEmail("a@b").errorOrNull());
        assertInstanceOf(UserValidationError.InvalidEmail.class, User.normalizeEmail(null).errorOrNull());
    }

    @Test
    void shouldRejectOverlongEmail() {
        String email = "a".repeat(310) + "@example.com";

        assertEquals("USER_EMAIL_INVALID", User.normalizeEmail(email).errorOrNull().code());
    }

    @Test
    void shouldTrimUsername() {
        assertEquals("grace", User.normalizeUsername("  grace ").getOrThrow());
    }

    @Test
    void shouldRejectUsernameOutsideBounds() {
        var tooShort = User.normalizeUsername("ab");
        var tooLong = User.normalizeUsername("x".repeat(51));

        assertEquals(new UserValidationError.InvalidUsername(2, 3, 50), tooShort.errorOrNull());
        assertEquals(new UserValidationError.InvalidUsername(51, 3, 50), tooLong.errorOrNull());
    }

    @Test
    void shouldRejectUsernameWithSpaces() {
        assertEquals("USER_USERNAME_INVALID", User.normalizeUsername("grace hopper").errorOrNull().code());
    }

    @Test
    void shouldKeepPasswordAsTyped() {
        assertEquals("  spaced out  ", User.checkPassword("  spaced out  ").getOrThrow());
    }

    @Test
    void shouldRejectShortPassword() {
        assertEquals(new UserValidationError.InvalidPassword(8, 200), User.checkPassword("short").errorOrNull());
        assertTrue(User.checkPassword(null).isFailure());
    }
}
