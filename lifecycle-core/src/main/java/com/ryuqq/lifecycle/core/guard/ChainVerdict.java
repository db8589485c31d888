package com.ryuqq.lifecycle.core.guard;

/**
 * GuardChain 평가 결과.
 *
 * <ul>
 *   <li>{@link Approved}: 모든 Guard가 허용 (빈 Chain 포함)</li>
 *   <li>{@link Denied}: 처음으로 거부한 Guard의 사유와 이름</li>
 * </ul>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public sealed interface ChainVerdict permits ChainVerdict.Approved, ChainVerdict.Denied {

    /**
     * 허용 결과.
     *
     * @return Approved 인스턴스
     */
    static ChainVerdict approved() {
        return Approved.INSTANCE;
    }

    /**
     * 거부 결과.
     *
     * @param reason 거부 사유
     * @param guardName 거부한 Guard 이름
     * @return Denied 인스턴스
     */
    static ChainVerdict denied(String reason, String guardName) {
        return new Denied(reason, guardName);
    }

    default boolean isApproved() {
        return this instanceof Approved;
    }

    /**
     * 모든 Guard 통과.
     */
    record Approved() implements ChainVerdict {

        private static final Approved INSTANCE = new Approved();
    }

    /**
     * Guard 거부.
     *
     * @param reason 거부 사유
     * @param guardName 거부한 Guard 이름
     */
    record Denied(String reason, String guardName) implements ChainVerdict {

        public Denied {
            if (reason == null || reason.isBlank()) {
                throw new IllegalArgumentException("reason cannot be null or blank");
            }
            if (guardName == null || guardName.isBlank()) {
                throw new IllegalArgumentException("guardName cannot be null or blank");
            }
        }
    }
}
