package com.ryuqq.lifecycle.core.result;

/**
 * Guard에 의한 거부.
 *
 * <p>reason은 호스트가 사용자 메시지로 변환할 원본 문자열입니다.</p>
 *
 * @param reason 거부 사유
 * @param guardName 거부한 Guard 이름
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public record GuardDenied(String reason, String guardName) implements RejectKind {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException reason 또는 guardName이 null이거나 빈 문자열인 경우
     */
    public GuardDenied {
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reason cannot be null or blank");
        }
        if (guardName == null || guardName.isBlank()) {
            throw new IllegalArgumentException("guardName cannot be null or blank");
        }
    }
}
