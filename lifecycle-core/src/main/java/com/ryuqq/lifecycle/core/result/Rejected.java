package com.ryuqq.lifecycle.core.result;

/**
 * 거부된 전이.
 *
 * @param kind 거부 사유
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public record Rejected(RejectKind kind) implements TransitionResult {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException kind가 null인 경우
     */
    public Rejected {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
    }

    public static Rejected of(RejectKind kind) {
        return new Rejected(kind);
    }
}
