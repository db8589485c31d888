package com.ryuqq.lifecycle.core.result;

/**
 * 전이 요청 결과.
 *
 * <ul>
 *   <li>{@link Committed}: 전이 확정, 엔티티 상태 변경됨</li>
 *   <li>{@link Rejected}: 전이 거부, 엔티티 상태 그대로 ({@link RejectKind}로 사유 구분)</li>
 * </ul>
 *
 * <p>일반적인 도메인 거부는 예외가 아니라 이 값으로 전달되며, 호출자가 반드시 처리해야 합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * TransitionResult result = engine.requestTransition(article, PUBLISH, attributes);
 *
 * if (result instanceof Committed committed) {
 *     // committed.to()
 * } else if (result.rejectKind() instanceof GuardDenied denied) {
 *     // denied.reason(), denied.guardName()
 * }
 * </pre>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public sealed interface TransitionResult permits Committed, Rejected {

    /**
     * 전이가 확정되었는지 확인.
     *
     * @return Committed이면 true
     */
    default boolean isCommitted() {
        return this instanceof Committed;
    }

    /**
     * 전이가 거부되었는지 확인.
     *
     * @return Rejected이면 true
     */
    default boolean isRejected() {
        return this instanceof Rejected;
    }

    /**
     * 거부 사유 조회.
     *
     * @return RejectKind (Committed이면 null)
     */
    default RejectKind rejectKind() {
        return this instanceof Rejected rejected ? rejected.kind() : null;
    }
}
