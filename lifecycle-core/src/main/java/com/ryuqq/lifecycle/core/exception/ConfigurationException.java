package com.ryuqq.lifecycle.core.exception;

/**
 * 설정 단계 오류.
 *
 * <p>Transition Table 또는 Guard Chain을 구성하는 과정에서만 발생합니다.
 * 요청 처리 중에는 발생하지 않으며, 애플리케이션 시작 실패로 취급해야 합니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>같은 (fromState, action)에 대한 규칙 중복 등록</li>
 *   <li>선언되지 않은 State를 참조하는 규칙</li>
 *   <li>등록되지 않은 EntityKind 또는 Action에 Guard 등록</li>
 *   <li>한 Chain 안에서 같은 이름의 Guard 중복 등록</li>
 *   <li>시작(start) 이후 Transition Table 변경 시도</li>
 * </ul>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public class ConfigurationException extends RuntimeException {

    /**
     * 생성자.
     *
     * @param message 오류 메시지
     */
    public ConfigurationException(String message) {
        super(message);
    }

    /**
     * 생성자 (원인 포함).
     *
     * @param message 오류 메시지
     * @param cause 원인
     */
    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
