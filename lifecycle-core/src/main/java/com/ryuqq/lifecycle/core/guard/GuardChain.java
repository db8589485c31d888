package com.ryuqq.lifecycle.core.guard;

import com.ryuqq.lifecycle.core.context.ContextKey;
import com.ryuqq.lifecycle.core.context.TransitionContext;
import com.ryuqq.lifecycle.core.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 순서가 있는 Guard 목록.
 *
 * <p><strong>평가 알고리즘:</strong></p>
 * <ol>
 *   <li>평가 시작 시점의 Guard 목록 스냅샷 확보</li>
 *   <li>등록 순서대로 Guard 평가</li>
 *   <li>처음 거부한 Guard에서 즉시 중단 → Denied(reason, guardName)</li>
 *   <li>모두 허용 → Approved (빈 Chain은 항상 Approved)</li>
 * </ol>
 *
 * <p>거부 이후의 Guard는 호출되지 않으므로, Guard의 부수 효과에 의존해서는 안 됩니다.</p>
 *
 * <p><strong>동시성:</strong></p>
 * <ul>
 *   <li>Copy-on-write: 변경 시 새 불변 목록으로 교체 (변경끼리는 lock으로 직렬화)</li>
 *   <li>진행 중인 evaluate()는 시작 시점 스냅샷만 보므로 동시 변경에 영향받지 않음</li>
 * </ul>
 *
 * <p><strong>오류 처리:</strong></p>
 * <ul>
 *   <li>Guard가 선언한 필수 키가 없으면 Guard를 호출하지 않고 거부</li>
 *   <li>Guard가 RuntimeException을 던지면 해당 Guard의 거부로 처리하고 로그 기록</li>
 * </ul>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public final class GuardChain {

    private static final Logger log = LoggerFactory.getLogger(GuardChain.class);

    private final Object lock = new Object();
    private volatile List<Guard> guards;

    private GuardChain(List<Guard> guards) {
        this.guards = guards;
    }

    /**
     * 빈 GuardChain 생성.
     *
     * @return 빈 GuardChain
     */
    public static GuardChain empty() {
        return new GuardChain(List.of());
    }

    /**
     * Guard 목록으로 GuardChain 생성.
     *
     * @param guards Guard 목록 (순서 유지)
     * @return GuardChain 인스턴스
     * @throws IllegalArgumentException guards 또는 원소가 null인 경우
     * @throws ConfigurationException 같은 이름의 Guard가 있는 경우
     */
    public static GuardChain of(Guard... guards) {
        if (guards == null) {
            throw new IllegalArgumentException("guards cannot be null");
        }
        GuardChain chain = empty();
        for (Guard guard : guards) {
            chain.append(guard);
        }
        return chain;
    }

    /**
     * 이름 유일성 검증 없이 고정된 스냅샷 Chain 생성.
     *
     * <p>GuardRegistry가 종류 공통 Guard와 동작별 Guard를 합칠 때 사용합니다.</p>
     *
     * @param guards Guard 목록
     * @return GuardChain 인스턴스
     */
    static GuardChain snapshotOf(List<Guard> guards) {
        return new GuardChain(List.copyOf(guards));
    }

    /**
     * Chain 평가.
     *
     * @param context 전이 컨텍스트
     * @return Approved 또는 Denied(reason, guardName)
     * @throws IllegalArgumentException context가 null인 경우
     */
    public ChainVerdict evaluate(TransitionContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }

        List<Guard> snapshot = this.guards;

        for (Guard guard : snapshot) {
            ChainVerdict.Denied denied = evaluateGuard(guard, context);
            if (denied != null) {
                log.debug("Guard {} denied {} of {}[{}]: {}",
                    denied.guardName(), context.action(), context.entityKind(), context.entityId(), denied.reason());
                return denied;
            }
        }
        return ChainVerdict.approved();
    }

    /**
     * Guard 하나 평가.
     *
     * @return 거부 시 Denied, 허용 시 null
     */
    private ChainVerdict.Denied evaluateGuard(Guard guard, TransitionContext context) {
        String name = guard.name();

        for (ContextKey<?> key : guard.requiredKeys()) {
            if (!context.attributes().contains(key)) {
                return new ChainVerdict.Denied("missing context attribute: " + key.name(), name);
            }
        }

        GuardDecision decision;
        try {
            decision = guard.evaluate(context);
        } catch (RuntimeException e) {
            log.warn("Guard {} failed while evaluating {} of {}[{}]",
                name, context.action(), context.entityKind(), context.entityId(), e);
            return new ChainVerdict.Denied("guard failed: " + e.getMessage(), name);
        }

        if (decision == null) {
            log.warn("Guard {} returned no decision for {} of {}[{}]",
                name, context.action(), context.entityKind(), context.entityId());
            return new ChainVerdict.Denied("guard returned no decision", name);
        }
        if (decision instanceof GuardDecision.Deny deny) {
            return new ChainVerdict.Denied(deny.reason(), name);
        }
        return null;
    }

    /**
     * 맨 뒤에 Guard 추가.
     *
     * @param guard Guard
     * @return this
     * @throws ConfigurationException 같은 이름의 Guard가 이미 있는 경우
     */
    public GuardChain append(Guard guard) {
        return add(guard, GuardPosition.append());
    }

    /**
     * 지정 인덱스에 Guard 삽입.
     *
     * @param index 삽입 인덱스
     * @param guard Guard
     * @return this
     * @throws ConfigurationException 인덱스가 범위를 벗어나거나 같은 이름의 Guard가 이미 있는 경우
     */
    public GuardChain insert(int index, Guard guard) {
        return add(guard, GuardPosition.at(index));
    }

    /**
     * 지정 위치에 Guard 추가.
     *
     * @param guard Guard
     * @param position 위치
     * @return this
     * @throws IllegalArgumentException guard 또는 position이 null인 경우
     * @throws ConfigurationException 인덱스가 범위를 벗어나거나 같은 이름의 Guard가 이미 있는 경우
     */
    public GuardChain add(Guard guard, GuardPosition position) {
        if (guard == null) {
            throw new IllegalArgumentException("guard cannot be null");
        }
        if (position == null) {
            throw new IllegalArgumentException("position cannot be null");
        }
        String name = guard.name();
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("Guard name cannot be null or blank: " + guard);
        }

        synchronized (lock) {
            List<Guard> current = this.guards;
            if (indexOf(current, name) >= 0) {
                throw new ConfigurationException("Guard already registered in chain: " + name);
            }
            List<Guard> next = new ArrayList<>(current);
            next.add(position.resolve(current.size()), guard);
            this.guards = Collections.unmodifiableList(next);
        }
        return this;
    }

    /**
     * 이름으로 Guard 제거.
     *
     * @param name Guard 이름
     * @return 제거했으면 true, 해당 이름이 없으면 false
     */
    public boolean remove(String name) {
        synchronized (lock) {
            List<Guard> current = this.guards;
            int index = indexOf(current, name);
            if (index < 0) {
                return false;
            }
            List<Guard> next = new ArrayList<>(current);
            next.remove(index);
            this.guards = Collections.unmodifiableList(next);
            return true;
        }
    }

    /**
     * Guard 순서 변경.
     *
     * @param name 옮길 Guard 이름
     * @param newIndex 새 인덱스 (0 ≤ newIndex &lt; size)
     * @throws IllegalArgumentException 해당 이름의 Guard가 없는 경우
     * @throws ConfigurationException newIndex가 범위를 벗어나는 경우
     */
    public void move(String name, int newIndex) {
        synchronized (lock) {
            List<Guard> current = this.guards;
            int index = indexOf(current, name);
            if (index < 0) {
                throw new IllegalArgumentException("No guard named " + name + " in chain");
            }
            if (newIndex < 0 || newIndex >= current.size()) {
                throw new ConfigurationException(
                    String.format("Guard index %d is out of range for a chain of %d guards", newIndex, current.size()));
            }
            List<Guard> next = new ArrayList<>(current);
            Guard guard = next.remove(index);
            next.add(newIndex, guard);
            this.guards = Collections.unmodifiableList(next);
        }
    }

    /**
     * 모든 Guard 제거.
     */
    public void clear() {
        synchronized (lock) {
            this.guards = List.of();
        }
    }

    /**
     * 현재 Guard 목록 스냅샷.
     *
     * @return 불변 Guard 목록
     */
    public List<Guard> guards() {
        return guards;
    }

    /**
     * 현재 Guard 이름 목록.
     *
     * @return Guard 이름 (순서 유지)
     */
    public List<String> names() {
        List<Guard> snapshot = this.guards;
        List<String> names = new ArrayList<>(snapshot.size());
        for (Guard guard : snapshot) {
            names.add(guard.name());
        }
        return Collections.unmodifiableList(names);
    }

    public boolean contains(String name) {
        return indexOf(guards, name) >= 0;
    }

    public int size() {
        return guards.size();
    }

    public boolean isEmpty() {
        return guards.isEmpty();
    }

    private static int indexOf(List<Guard> guards, String name) {
        for (int i = 0; i < guards.size(); i++) {
            if (guards.get(i).name().equals(name)) {
                return i;
            }
        }
        return -1;
    }

    @Override
    public String toString() {
        return "GuardChain" + names();
    }
}
