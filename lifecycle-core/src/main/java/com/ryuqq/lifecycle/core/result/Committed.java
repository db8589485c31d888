package com.ryuqq.lifecycle.core.result;

import com.ryuqq.lifecycle.core.model.State;

/**
 * 확정된 전이.
 *
 * @param from 전이 전 상태
 * @param to 전이 후 상태 (엔티티의 새 현재 상태)
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public record Committed(State from, State to) implements TransitionResult {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     */
    public Committed {
        if (from == null) {
            throw new IllegalArgumentException("from cannot be null");
        }
        if (to == null) {
            throw new IllegalArgumentException("to cannot be null");
        }
    }
}
