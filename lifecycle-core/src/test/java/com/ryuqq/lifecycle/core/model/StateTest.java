package com.ryuqq.lifecycle.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * State Value Object 테스트.
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
class StateTest {

    @Test
    void of_ValidName_CreatesState() {
        // When
        State state = State.of("Draft");

        // Then
        assertEquals("Draft", state.getValue());
    }

    @Test
    void of_NameWithHyphenAndUnderscore_CreatesState() {
        // When & Then
        assertDoesNotThrow(() -> State.of("in-review_2"));
    }

    @Test
    void of_BlankName_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> State.of(" ")
        );
        assertTrue(exception.getMessage().contains("cannot be null or blank"));
    }

    @Test
    void of_NameWithSpace_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> State.of("In Review"));
    }

    @Test
    void of_NameExceeds64Characters_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> State.of("S".repeat(65)));
    }

    @Test
    void equals_IsCaseSensitive() {
        // When & Then
        assertEquals(State.of("Draft"), State.of("Draft"));
        assertNotEquals(State.of("Draft"), State.of("DRAFT"));
    }
}
