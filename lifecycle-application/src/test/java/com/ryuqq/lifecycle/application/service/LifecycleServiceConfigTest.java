package com.ryuqq.lifecycle.application.service;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * LifecycleServiceConfig 테스트.
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
class LifecycleServiceConfigTest {

    @Test
    void defaultConstructor_UsesDefaults() {
        // When
        LifecycleServiceConfig config = new LifecycleServiceConfig();

        // Then
        assertEquals(3, config.maxConflictRetries());
        assertEquals(0, config.retryBackoffMs());
    }

    @Test
    void withMethods_ReturnNewInstance() {
        // Given
        LifecycleServiceConfig config = new LifecycleServiceConfig();

        // When
        LifecycleServiceConfig changed = config.withMaxConflictRetries(0).withRetryBackoffMs(5);

        // Then
        assertEquals(0, changed.maxConflictRetries());
        assertEquals(5, changed.retryBackoffMs());
        assertEquals(3, config.maxConflictRetries());
    }

    @Test
    void negativeRetries_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> new LifecycleServiceConfig(-1, 0)
        );
        assertTrue(exception.getMessage().contains("maxConflictRetries must be non-negative"));
    }

    @Test
    void negativeBackoff_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new LifecycleServiceConfig(3, -1));
    }
}
