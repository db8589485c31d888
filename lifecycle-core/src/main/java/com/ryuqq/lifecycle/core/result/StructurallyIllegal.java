package com.ryuqq.lifecycle.core.result;

import com.ryuqq.lifecycle.core.model.Action;
import com.ryuqq.lifecycle.core.model.State;

/**
 * 구조적으로 허용되지 않는 전이.
 *
 * <p>Transition Table에 (state, action) 규칙이 없습니다. Guard는 평가되지 않습니다.</p>
 *
 * @param state 요청 시점의 현재 상태
 * @param action 요청 동작
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public record StructurallyIllegal(State state, Action action) implements RejectKind {

    public StructurallyIllegal {
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
    }
}
