package com.ryuqq.lifecycle.core.model;

import java.util.regex.Pattern;

/**
 * 생명주기를 관리받는 엔티티의 종류.
 *
 * <p>EntityKind는 Transition Table과 Guard Chain을 묶는 단위입니다.
 * 같은 종류의 엔티티는 하나의 Transition Table을 공유합니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>EntityKind.of("ARTICLE") - 게시글</li>
 *   <li>EntityKind.of("ACCOUNT") - 회원 계정</li>
 * </ul>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~50자</li>
 *   <li>패턴: 대문자, 숫자, 언더스코어만 허용 (대문자로 시작)</li>
 * </ul>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public final class EntityKind {

    private static final Pattern VALID_PATTERN = Pattern.compile("^[A-Z][A-Z0-9_]*$");

    private final String value;

    private EntityKind(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("EntityKind cannot be null or blank");
        }
        if (value.length() > 50) {
            throw new IllegalArgumentException("EntityKind length cannot exceed 50 characters");
        }
        if (!VALID_PATTERN.matcher(value).matches()) {
            throw new IllegalArgumentException(
                "EntityKind must start with an uppercase letter and contain only uppercase letters, digits and underscores: " + value);
        }
        this.value = value;
    }

    /**
     * EntityKind 생성.
     *
     * @param value EntityKind 값 (예: ARTICLE, ACCOUNT)
     * @return EntityKind 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static EntityKind of(String value) {
        return new EntityKind(value);
    }

    /**
     * EntityKind 값 조회.
     *
     * @return EntityKind 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        EntityKind that = (EntityKind) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
