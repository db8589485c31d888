package com.ryuqq.lifecycle.sample.registration;

import com.ryuqq.lifecycle.core.context.Attributes;

/**
 * 가입 요청 데이터.
 *
 * @param email 이메일 (필수)
 * @param password 비밀번호 (필수)
 * @param referralCode 추천 코드 (선택, null 허용)
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public record RegistrationRequest(String email, String password, String referralCode) {

    public RegistrationRequest {
        if (email == null || email.isBlank()) {
            throw new IllegalArgumentException("email cannot be null or blank");
        }
        if (password == null) {
            throw new IllegalArgumentException("password cannot be null");
        }
    }

    public static RegistrationRequest of(String email, String password) {
        return new RegistrationRequest(email, password, null);
    }

    /**
     * 전이 컨텍스트 속성으로 변환.
     *
     * @return Attributes (추천 코드가 없으면 해당 키 생략)
     */
    public Attributes toAttributes() {
        Attributes.Builder builder = Attributes.builder()
            .put(RegistrationKeys.EMAIL, email)
            .put(RegistrationKeys.PASSWORD, password);
        if (referralCode != null && !referralCode.isBlank()) {
            builder.put(RegistrationKeys.REFERRAL_CODE, referralCode);
        }
        return builder.build();
    }

    @Override
    public String toString() {
        return "RegistrationRequest{email=" + email + ", referralCode=" + referralCode + '}';
    }
}
