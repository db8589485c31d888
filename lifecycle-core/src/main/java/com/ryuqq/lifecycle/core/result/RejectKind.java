package com.ryuqq.lifecycle.core.result;

/**
 * 전이 거부 사유 분류.
 *
 * <ul>
 *   <li>{@link StructurallyIllegal}: 현재 상태에서 해당 동작의 규칙이 없음 (호출자 오류 또는 오래된 상태 기반 요청, 자동 재시도 대상 아님)</li>
 *   <li>{@link GuardDenied}: 특정 Guard가 거부 (입력을 고쳐 다시 요청 가능)</li>
 *   <li>{@link ConcurrencyConflict}: 같은 엔티티에 대한 다른 전이가 먼저 확정됨 (상태를 다시 읽고 제한된 횟수만 재시도)</li>
 * </ul>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public sealed interface RejectKind permits StructurallyIllegal, GuardDenied, ConcurrencyConflict {

    /**
     * 재시도로 해결될 수 있는 거부인지 확인.
     *
     * @return ConcurrencyConflict이면 true
     */
    default boolean isRetryable() {
        return this instanceof ConcurrencyConflict;
    }
}
