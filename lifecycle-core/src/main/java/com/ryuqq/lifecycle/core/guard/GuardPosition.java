package com.ryuqq.lifecycle.core.guard;

import com.ryuqq.lifecycle.core.exception.ConfigurationException;

/**
 * GuardChain 안에서 Guard를 넣을 위치.
 *
 * <ul>
 *   <li>{@link #append()}: 맨 뒤</li>
 *   <li>{@link #first()}: 맨 앞</li>
 *   <li>{@link #at(int)}: 지정 인덱스 (0 ≤ index ≤ size)</li>
 * </ul>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public final class GuardPosition {

    private static final int APPEND = -1;

    private static final GuardPosition APPEND_POSITION = new GuardPosition(APPEND);
    private static final GuardPosition FIRST_POSITION = new GuardPosition(0);

    private final int index;

    private GuardPosition(int index) {
        this.index = index;
    }

    public static GuardPosition append() {
        return APPEND_POSITION;
    }

    public static GuardPosition first() {
        return FIRST_POSITION;
    }

    /**
     * 명시적 인덱스 위치.
     *
     * @param index 삽입 인덱스 (0 이상)
     * @return GuardPosition 인스턴스
     * @throws IllegalArgumentException index가 음수인 경우
     */
    public static GuardPosition at(int index) {
        if (index < 0) {
            throw new IllegalArgumentException("index must be non-negative (current: " + index + ")");
        }
        return index == 0 ? FIRST_POSITION : new GuardPosition(index);
    }

    public boolean isAppend() {
        return index == APPEND;
    }

    /**
     * 현재 Chain 크기 기준 실제 삽입 인덱스 계산.
     *
     * @param size 현재 Chain 크기
     * @return 삽입 인덱스
     * @throws ConfigurationException 인덱스가 Chain 크기를 넘는 경우
     */
    int resolve(int size) {
        if (index == APPEND) {
            return size;
        }
        if (index > size) {
            throw new ConfigurationException(
                String.format("Guard position %d is out of range for a chain of %d guards", index, size));
        }
        return index;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return index == ((GuardPosition) o).index;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(index);
    }

    @Override
    public String toString() {
        return index == APPEND ? "GuardPosition{append}" : "GuardPosition{" + index + '}';
    }
}
