package com.ryuqq.lifecycle.core.model;

import java.util.regex.Pattern;

/**
 * 상태 전이를 요청하는 동작(동사).
 *
 * <p>예: submit-for-review, publish, revert-to-draft</p>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~64자</li>
 *   <li>패턴: 소문자로 시작, 소문자, 숫자, 하이픈(-), 언더스코어(_)만 허용</li>
 * </ul>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public final class Action {

    private static final Pattern VALID_PATTERN = Pattern.compile("^[a-z][a-z0-9\\-_]*$");

    private final String value;

    private Action(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Action cannot be null or blank");
        }
        if (value.length() > 64) {
            throw new IllegalArgumentException("Action length cannot exceed 64 characters");
        }
        if (!VALID_PATTERN.matcher(value).matches()) {
            throw new IllegalArgumentException(
                "Action must start with a lowercase letter and contain only lowercase letters, digits, hyphen, and underscore: " + value);
        }
        this.value = value;
    }

    /**
     * Action 생성.
     *
     * @param value Action 이름 (예: publish)
     * @return Action 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static Action of(String value) {
        return new Action(value);
    }

    /**
     * Action 이름 조회.
     *
     * @return Action 이름
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Action action = (Action) o;
        return value.equals(action.value);
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
