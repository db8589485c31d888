package com.ryuqq.lifecycle.core.model;

import java.util.regex.Pattern;

/**
 * 엔티티 생명주기의 한 단계.
 *
 * <p>State는 엔티티 종류별로 닫힌 집합을 이룹니다. 집합은 Transition Table을
 * 구성할 때 고정되며, 런타임에 새로운 State가 추가되지 않습니다.</p>
 *
 * <p><strong>예시:</strong> State.of("Draft"), State.of("Moderation"), State.of("Published")</p>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~64자</li>
 *   <li>패턴: 영문자로 시작, 영숫자, 하이픈(-), 언더스코어(_)만 허용</li>
 * </ul>
 *
 * <p>State는 대소문자를 구분합니다. ("Draft"와 "DRAFT"는 서로 다른 State)</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public final class State {

    private static final Pattern VALID_PATTERN = Pattern.compile("^[A-Za-z][A-Za-z0-9\\-_]*$");

    private final String value;

    private State(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("State cannot be null or blank");
        }
        if (value.length() > 64) {
            throw new IllegalArgumentException("State length cannot exceed 64 characters");
        }
        if (!VALID_PATTERN.matcher(value).matches()) {
            throw new IllegalArgumentException(
                "State must start with a letter and contain only alphanumeric, hyphen, and underscore characters: " + value);
        }
        this.value = value;
    }

    /**
     * State 생성.
     *
     * @param value State 이름
     * @return State 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static State of(String value) {
        return new State(value);
    }

    /**
     * State 이름 조회.
     *
     * @return State 이름
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        State state = (State) o;
        return value.equals(state.value);
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
