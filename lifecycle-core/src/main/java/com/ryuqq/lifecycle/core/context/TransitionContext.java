package com.ryuqq.lifecycle.core.context;

import com.ryuqq.lifecycle.core.model.Action;
import com.ryuqq.lifecycle.core.model.EntityKind;
import com.ryuqq.lifecycle.core.model.State;

/**
 * 진행 중인 전이 요청 하나를 설명하는 읽기 전용 컨텍스트.
 *
 * <p>LifecycleEngine이 엔티티, 요청 Action, Transition Table에서 찾은 규칙,
 * 호출자의 {@link Attributes}로부터 생성하여 Guard와 TransitionListener에 전달합니다.</p>
 *
 * <p><strong>필드 구성:</strong></p>
 * <ul>
 *   <li><strong>entityKind / entityId:</strong> 대상 엔티티</li>
 *   <li><strong>action:</strong> 요청된 동작</li>
 *   <li><strong>fromState / toState:</strong> 규칙상 출발/도착 상태</li>
 *   <li><strong>attributes:</strong> 호출자가 제공한 데이터</li>
 * </ul>
 *
 * @param entityKind 엔티티 종류
 * @param entityId 엔티티 식별자
 * @param action 요청된 동작
 * @param fromState 전이 전 상태
 * @param toState 전이 후 상태
 * @param attributes 호출자 제공 데이터
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public record TransitionContext(
    EntityKind entityKind,
    String entityId,
    Action action,
    State fromState,
    State toState,
    Attributes attributes
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null인 경우
     */
    public TransitionContext {
        if (entityKind == null) {
            throw new IllegalArgumentException("entityKind cannot be null");
        }
        if (entityId == null || entityId.isBlank()) {
            throw new IllegalArgumentException("entityId cannot be null or blank");
        }
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
        if (fromState == null) {
            throw new IllegalArgumentException("fromState cannot be null");
        }
        if (toState == null) {
            throw new IllegalArgumentException("toState cannot be null");
        }
        if (attributes == null) {
            throw new IllegalArgumentException("attributes cannot be null");
        }
    }

    /**
     * 속성 조회 단축 메서드.
     *
     * @param key 키
     * @param <T> 값 타입
     * @return 값
     * @throws IllegalStateException 속성이 없는 경우
     */
    public <T> T require(ContextKey<T> key) {
        return attributes.require(key);
    }
}
