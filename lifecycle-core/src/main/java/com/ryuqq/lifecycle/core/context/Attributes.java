package com.ryuqq.lifecycle.core.context;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 호출자가 구성하는 전이 요청 데이터 묶음.
 *
 * <p>등록 요청의 필드, 요청자의 역할 등 Guard가 판단에 사용하는 값을 담습니다.
 * 생성 후에는 변경할 수 없으며, Guard는 읽기만 할 수 있습니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>키 이름은 묶음 안에서 유일</li>
 *   <li>값은 null 불가 (속성이 없으면 넣지 않음)</li>
 *   <li>값은 키가 선언한 타입이어야 함</li>
 * </ul>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public final class Attributes {

    private static final Attributes EMPTY = new Attributes(Map.of());

    private final Map<String, Entry<?>> entries;

    private Attributes(Map<String, Entry<?>> entries) {
        this.entries = entries;
    }

    /**
     * 빈 Attributes.
     *
     * @return 속성이 없는 Attributes
     */
    public static Attributes empty() {
        return EMPTY;
    }

    /**
     * 속성 하나로 Attributes 생성.
     *
     * @param key 키
     * @param value 값
     * @param <T> 값 타입
     * @return Attributes 인스턴스
     */
    public static <T> Attributes of(ContextKey<T> key, T value) {
        return builder().put(key, value).build();
    }

    /**
     * Builder 생성.
     *
     * @return 새 Builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * 속성 조회.
     *
     * @param key 키
     * @param <T> 값 타입
     * @return 값 (없으면 empty)
     * @throws IllegalArgumentException key가 null인 경우
     * @throws IllegalStateException 같은 이름으로 다른 타입의 값이 저장된 경우
     */
    public <T> Optional<T> find(ContextKey<T> key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        Entry<?> entry = entries.get(key.name());
        if (entry == null) {
            return Optional.empty();
        }
        if (!entry.key().equals(key)) {
            throw new IllegalStateException(
                String.format("Attribute '%s' is stored as %s, not %s",
                    key.name(), entry.key().type().getSimpleName(), key.type().getSimpleName()));
        }
        return Optional.of(key.type().cast(entry.value()));
    }

    /**
     * 필수 속성 조회.
     *
     * @param key 키
     * @param <T> 값 타입
     * @return 값
     * @throws IllegalStateException 속성이 없는 경우
     */
    public <T> T require(ContextKey<T> key) {
        return find(key).orElseThrow(
            () -> new IllegalStateException("Missing context attribute: " + key.name()));
    }

    /**
     * 속성 존재 여부 확인 (이름과 타입 모두 일치해야 함).
     *
     * @param key 키
     * @return 존재하면 true
     */
    public boolean contains(ContextKey<?> key) {
        if (key == null) {
            return false;
        }
        Entry<?> entry = entries.get(key.name());
        return entry != null && entry.key().equals(key);
    }

    /**
     * 저장된 속성 이름 목록.
     *
     * @return 속성 이름 (불변, 삽입 순서)
     */
    public Set<String> names() {
        return entries.keySet();
    }

    /**
     * 비어있는지 확인.
     *
     * @return 속성이 없으면 true
     */
    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * 기존 속성에 하나를 더한 새 Attributes 생성.
     *
     * @param key 키
     * @param value 값
     * @param <T> 값 타입
     * @return 새 Attributes (원본은 변경되지 않음)
     */
    public <T> Attributes with(ContextKey<T> key, T value) {
        Builder builder = new Builder();
        builder.entries.putAll(entries);
        builder.entries.remove(key == null ? null : key.name());
        return builder.put(key, value).build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Attributes that = (Attributes) o;
        return entries.equals(that.entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        // 값은 출력하지 않음 (비밀번호 등)
        return "Attributes" + entries.keySet();
    }

    private record Entry<T>(ContextKey<T> key, T value) {
    }

    /**
     * Attributes Builder.
     */
    public static final class Builder {

        private final Map<String, Entry<?>> entries = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * 속성 추가.
         *
         * @param key 키
         * @param value 값
         * @param <T> 값 타입
         * @return this
         * @throws IllegalArgumentException key 또는 value가 null이거나, 같은 이름의 키가 이미 있거나,
         *                                  value가 키 타입이 아닌 경우
         */
        public <T> Builder put(ContextKey<T> key, T value) {
            if (key == null) {
                throw new IllegalArgumentException("key cannot be null");
            }
            if (value == null) {
                throw new IllegalArgumentException("value cannot be null (key: " + key.name() + ")");
            }
            if (!key.type().isInstance(value)) {
                throw new IllegalArgumentException(
                    String.format("value for '%s' must be %s but was %s",
                        key.name(), key.type().getSimpleName(), value.getClass().getSimpleName()));
            }
            if (entries.containsKey(key.name())) {
                throw new IllegalArgumentException("Duplicate attribute: " + key.name());
            }
            entries.put(key.name(), new Entry<>(key, value));
            return this;
        }

        /**
         * Attributes 생성.
         *
         * @return 불변 Attributes
         */
        public Attributes build() {
            if (entries.isEmpty()) {
                return EMPTY;
            }
            return new Attributes(Collections.unmodifiableMap(new LinkedHashMap<>(entries)));
        }
    }
}
