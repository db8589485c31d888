package com.ryuqq.lifecycle.application.service;

/**
 * LifecycleService 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxConflictRetries: ConcurrencyConflict 발생 시 추가 시도 횟수 (기본 3, 0이면 재시도 없음)</li>
 *   <li>retryBackoffMs: 재시도 사이 대기 시간 (기본 0ms)</li>
 * </ul>
 *
 * <p>StructurallyIllegal과 GuardDenied는 재시도하지 않습니다.</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 * @param maxConflictRetries 최대 재시도 횟수 (0 이상)
 * @param retryBackoffMs 재시도 대기 시간 (밀리초, 0 이상)
 */
public record LifecycleServiceConfig(int maxConflictRetries, long retryBackoffMs) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: maxConflictRetries=3, retryBackoffMs=0</p>
     */
    public LifecycleServiceConfig() {
        this(3, 0);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public LifecycleServiceConfig {
        if (maxConflictRetries < 0) {
            throw new IllegalArgumentException(
                "maxConflictRetries must be non-negative (current: " + maxConflictRetries + ")"
            );
        }
        if (retryBackoffMs < 0) {
            throw new IllegalArgumentException(
                "retryBackoffMs must be non-negative (current: " + retryBackoffMs + ")"
            );
        }
    }

    /**
     * maxConflictRetries만 변경한 새 인스턴스 생성.
     *
     * @param maxConflictRetries 새로운 최대 재시도 횟수
     * @return 새 LifecycleServiceConfig 인스턴스
     */
    public LifecycleServiceConfig withMaxConflictRetries(int maxConflictRetries) {
        return new LifecycleServiceConfig(maxConflictRetries, this.retryBackoffMs);
    }

    /**
     * retryBackoffMs만 변경한 새 인스턴스 생성.
     *
     * @param retryBackoffMs 새로운 재시도 대기 시간 (밀리초)
     * @return 새 LifecycleServiceConfig 인스턴스
     */
    public LifecycleServiceConfig withRetryBackoffMs(long retryBackoffMs) {
        return new LifecycleServiceConfig(this.maxConflictRetries, retryBackoffMs);
    }
}
