package com.ryuqq.lifecycle.core.engine;

import com.ryuqq.lifecycle.core.context.TransitionContext;

/**
 * 전이 확정 후 호출되는 후처리 훅.
 *
 * <p>LifecycleEngine이 상태를 확정한 뒤 등록 순서대로 호출합니다.
 * 훅이 예외를 던져도 로그만 남기며, 이미 확정된 전이는 되돌리지 않습니다.</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface TransitionListener {

    /**
     * 전이 확정 통지.
     *
     * @param context 확정된 전이의 컨텍스트 (fromState → toState)
     */
    void onCommitted(TransitionContext context);

    /**
     * 로그 식별용 이름.
     *
     * <p>기본값은 구현 클래스의 단순 이름이며, 익명 클래스와 람다는 클래스 이름을 사용합니다.</p>
     *
     * @return 리스너 이름
     */
    default String name() {
        String simpleName = getClass().getSimpleName();
        return simpleName.isEmpty() ? getClass().getName() : simpleName;
    }
}
