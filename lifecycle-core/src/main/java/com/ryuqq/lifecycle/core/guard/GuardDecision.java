package com.ryuqq.lifecycle.core.guard;

/**
 * 단일 Guard의 판정 결과.
 *
 * <ul>
 *   <li>{@link Approve}: 전이 허용</li>
 *   <li>{@link Deny}: 전이 거부 (사유 포함)</li>
 * </ul>
 *
 * <p>사유 문자열은 호스트가 사용자 메시지로 변환할 원본 데이터이며,
 * 이 라이브러리는 내용을 해석하거나 지역화하지 않습니다.</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public sealed interface GuardDecision permits GuardDecision.Approve, GuardDecision.Deny {

    /**
     * 허용 판정.
     *
     * @return Approve 인스턴스
     */
    static GuardDecision approve() {
        return Approve.INSTANCE;
    }

    /**
     * 거부 판정.
     *
     * @param reason 거부 사유
     * @return Deny 인스턴스
     * @throws IllegalArgumentException reason이 null이거나 빈 문자열인 경우
     */
    static GuardDecision deny(String reason) {
        return new Deny(reason);
    }

    /**
     * 허용 여부 확인.
     *
     * @return 허용이면 true
     */
    default boolean isApproved() {
        return this instanceof Approve;
    }

    /**
     * 전이 허용.
     */
    record Approve() implements GuardDecision {

        private static final Approve INSTANCE = new Approve();
    }

    /**
     * 전이 거부.
     *
     * @param reason 거부 사유
     */
    record Deny(String reason) implements GuardDecision {

        public Deny {
            if (reason == null || reason.isBlank()) {
                throw new IllegalArgumentException("reason cannot be null or blank");
            }
        }
    }
}
