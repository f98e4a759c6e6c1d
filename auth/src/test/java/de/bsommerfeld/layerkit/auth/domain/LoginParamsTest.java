package de.bsommerfeld.layerkit.auth.domain;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LoginParamsTest {

    @Test
    void constructor_shouldTrimEmail() {
        assertEquals("a@b.c", new LoginParams("  a@b.c ", "x").email());
    }

    @Test
    void constructor_shouldRejectBlankEmail() {
        assertThrows(IllegalArgumentException.class, () -> new LoginParams("   ", "x"));
        assertThrows(IllegalArgumentException.class, () -> new LoginParams(null, "x"));
    }

    @Test
    void constructor_shouldRejectNullPassword() {
        assertThrows(NullPointerException.class, () -> new LoginParams("a@b.c", null));
    }

    @Test
    void toString_shouldNotLeakPassword() {
        String printed = new LoginParams("a@b.c", "hunter2").toString();

        assertTrue(printed.contains("a@b.c"));
        assertFalse(printed.contains("hunter2"));
    }

    @Test
    void equals_shouldCompareByValue() {
        assertEquals(new LoginParams("a@b.c", "x"), new LoginParams("a@b.c", "x"));
        assertEquals(new UserEntity("1", "a@b.c"), new UserEntity("1", "a@b.c"));
    }
}
