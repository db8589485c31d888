package com.ryuqq.lifecycle.sample.registration;

/**
 * 가입 검증에 필요한 사용자 조회 포트.
 *
 * <p>Guard는 이 포트를 통해서만 외부 사실을 확인합니다. 구현체는 동기적이고
 * 빠르게 응답해야 하며, 조회 메서드는 상태를 변경하지 않아야 합니다.</p>
 *
 * <p><strong>구현 가이드:</strong></p>
 * <ul>
 *   <li>이메일 비교는 대소문자를 구분하지 않음</li>
 *   <li>record 메서드는 가입 확정 후 후처리 리스너에서만 호출됨</li>
 *   <li>Thread-safe해야 함</li>
 * </ul>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public interface UserDirectory {

    /**
     * 이메일 사용 여부.
     *
     * @param email 이메일
     * @return 이미 가입된 이메일이면 true
     */
    boolean emailExists(String email);

    /**
     * 추천 코드 유효 여부.
     *
     * @param referralCode 추천 코드
     * @return 발급된 코드이면 true
     */
    boolean referralCodeExists(String referralCode);

    /**
     * 가입 기록.
     *
     * @param accountId 계정 ID
     * @param email 이메일
     * @throws IllegalStateException 이메일이 이미 다른 계정에 기록된 경우
     */
    void recordRegistration(String accountId, String email);

    /**
     * 추천 코드 사용 기록.
     *
     * @param referralCode 추천 코드
     * @param accountId 코드를 사용한 계정 ID
     */
    void recordReferralUse(String referralCode, String accountId);
}
