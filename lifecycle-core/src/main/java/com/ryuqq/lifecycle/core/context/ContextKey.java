package com.ryuqq.lifecycle.core.context;

/**
 * 타입이 지정된 컨텍스트 속성 키.
 *
 * <p>Guard는 읽는 속성을 ContextKey로 선언합니다. 두 Guard 사이에 데이터 의존이 있다면
 * 암묵적인 실행 순서가 아니라 이 키를 통해서만 드러나야 합니다.</p>
 *
 * <pre>{@code
 * ContextKey<String> EMAIL = ContextKey.of("email", String.class);
 *
 * Attributes attributes = Attributes.builder()
 *     .put(EMAIL, "user@example.com")
 *     .build();
 *
 * String email = attributes.require(EMAIL);
 * }</pre>
 *
 * @param name 속성 이름
 * @param type 속성 값 타입
 * @param <T> 속성 값 타입
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public record ContextKey<T>(String name, Class<T> type) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException name이 null이거나 빈 문자열이거나 type이 null인 경우
     */
    public ContextKey {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
    }

    /**
     * ContextKey 생성.
     *
     * @param name 속성 이름
     * @param type 속성 값 타입
     * @param <T> 속성 값 타입
     * @return ContextKey 인스턴스
     */
    public static <T> ContextKey<T> of(String name, Class<T> type) {
        return new ContextKey<>(name, type);
    }

    @Override
    public String toString() {
        return name + ":" + type.getSimpleName();
    }
}
