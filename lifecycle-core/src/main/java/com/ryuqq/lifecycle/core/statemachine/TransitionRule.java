package com.ryuqq.lifecycle.core.statemachine;

import com.ryuqq.lifecycle.core.model.Action;
import com.ryuqq.lifecycle.core.model.State;

/**
 * 전이 규칙: (fromState, action) → toState.
 *
 * <p>한 Transition Table 안에서 (fromState, action) 쌍은 최대 하나의 규칙만 가집니다.</p>
 *
 * @param from 출발 상태
 * @param action 동작
 * @param to 도착 상태
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public record TransitionRule(State from, Action action, State to) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필드가 null인 경우
     */
    public TransitionRule {
        if (from == null || action == null || to == null) {
            throw new IllegalArgumentException(
                "Rule fields cannot be null (from: " + from + ", action: " + action + ", to: " + to + ")");
        }
    }

    @Override
    public String toString() {
        return String.format("%s --%s--> %s", from, action, to);
    }
}
