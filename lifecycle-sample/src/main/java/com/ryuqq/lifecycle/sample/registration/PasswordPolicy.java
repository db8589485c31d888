package com.ryuqq.lifecycle.sample.registration;

import java.util.Optional;

/**
 * 비밀번호 정책 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>minLength: 최소 길이 (기본 8)</li>
 *   <li>requireDigit: 숫자 포함 필수 여부 (기본 true)</li>
 * </ul>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 * @param minLength 최소 길이 (1 이상)
 * @param requireDigit 숫자 포함 필수 여부
 */
public record PasswordPolicy(int minLength, boolean requireDigit) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: minLength=8, requireDigit=true</p>
     */
    public PasswordPolicy() {
        this(8, true);
    }

    public PasswordPolicy {
        if (minLength <= 0) {
            throw new IllegalArgumentException("minLength must be positive (current: " + minLength + ")");
        }
    }

    public PasswordPolicy withMinLength(int minLength) {
        return new PasswordPolicy(minLength, this.requireDigit);
    }

    public PasswordPolicy withRequireDigit(boolean requireDigit) {
        return new PasswordPolicy(this.minLength, requireDigit);
    }

    /**
     * 정책 위반 사유 확인.
     *
     * @param password 비밀번호
     * @return 위반 사유 (정책을 만족하면 empty)
     */
    public Optional<String> violation(String password) {
        if (password == null || password.length() < minLength) {
            return Optional.of("password must be at least " + minLength + " characters");
        }
        if (requireDigit && password.chars().noneMatch(Character::isDigit)) {
            return Optional.of("password must contain a digit");
        }
        return Optional.empty();
    }
}
