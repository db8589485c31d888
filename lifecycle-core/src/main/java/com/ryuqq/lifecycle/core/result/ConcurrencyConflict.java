package com.ryuqq.lifecycle.core.result;

import com.ryuqq.lifecycle.core.model.State;

/**
 * 동시 전이 경합에서 밀린 요청.
 *
 * <p>검증은 expected 상태를 기준으로 통과했지만, 확정 시점에 엔티티는 이미 다른 전이로
 * actual 상태가 되어 있었습니다. 엔티티 상태는 덮어쓰지 않습니다.</p>
 *
 * @param expected 검증 기준 상태
 * @param actual 확정 시점의 실제 상태
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public record ConcurrencyConflict(State expected, State actual) implements RejectKind {

    public ConcurrencyConflict {
        if (expected == null) {
            throw new IllegalArgumentException("expected cannot be null");
        }
        if (actual == null) {
            throw new IllegalArgumentException("actual cannot be null");
        }
    }
}
