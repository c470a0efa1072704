package com.barte.sdk.decode;

import org.junit.jupiter.api.Test;

import java.util.NoSuchElementException;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class FieldTest {

    @Test
    void absentAndNullHaveNoValue() {
        assertThrows(NoSuchElementException.class, () -> Field.absent().get());
        assertThrows(NoSuchElementException.class, () -> Field.ofNull().get());
        assertEquals("fallback", Field.<String>absent().orElse("fallback"));
        assertEquals(Optional.empty(), Field.ofNull().toOptional());
        assertNotEquals(Field.absent(), Field.ofNull());
    }

    @Test
    void mapKeepsState() {
        assertEquals(Field.of(4), Field.of("abcd").map(String::length));
        assertTrue(Field.<String>ofNull().map(String::length).isNull());
        assertTrue(Field.<String>absent().map(String::length).isAbsent());
    }

    @Test
    void presentValueMustNotBeNull() {
        assertThrows(NullPointerException.class, () -> Field.of(null));
    }
}
