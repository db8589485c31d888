package com.ryuqq.lifecycle.core.result;

import com.ryuqq.lifecycle.core.model.Action;
import com.ryuqq.lifecycle.core.model.State;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * TransitionResult / RejectKind 테스트.
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
class TransitionResultTest {

    private static final State DRAFT = State.of("Draft");
    private static final State MODERATION = State.of("Moderation");

    @Test
    void committed_IsCommitted_HasNoRejectKind() {
        // Given
        TransitionResult result = new Committed(DRAFT, MODERATION);

        // When & Then
        assertTrue(result.isCommitted());
        assertFalse(result.isRejected());
        assertNull(result.rejectKind());
    }

    @Test
    void rejected_ExposesKind() {
        // Given
        RejectKind kind = new GuardDenied("email exists", "EmailExistsGuard");

        // When
        TransitionResult result = Rejected.of(kind);

        // Then
        assertTrue(result.isRejected());
        assertSame(kind, result.rejectKind());
    }

    @Test
    void isRetryable_OnlyConcurrencyConflict() {
        assertTrue(new ConcurrencyConflict(DRAFT, MODERATION).isRetryable());
        assertFalse(new GuardDenied("no", "A").isRetryable());
        assertFalse(new StructurallyIllegal(DRAFT, Action.of("publish")).isRetryable());
    }

    @Test
    void structurallyIllegal_NotEqualToGuardDenied() {
        assertNotEquals(
            Rejected.of(new StructurallyIllegal(DRAFT, Action.of("publish"))),
            Rejected.of(new GuardDenied("no rule", "Table")));
    }

    @Test
    void rejected_NullKind_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> Rejected.of(null)
        );
        assertTrue(exception.getMessage().contains("kind cannot be null"));
    }

    @Test
    void committed_NullState_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new Committed(null, MODERATION));
        assertThrows(IllegalArgumentException.class, () -> new Committed(DRAFT, null));
    }
}
