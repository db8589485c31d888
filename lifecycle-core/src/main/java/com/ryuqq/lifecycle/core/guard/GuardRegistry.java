package com.ryuqq.lifecycle.core.guard;

import com.ryuqq.lifecycle.core.exception.ConfigurationException;
import com.ryuqq.lifecycle.core.model.Action;
import com.ryuqq.lifecycle.core.model.EntityKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * GuardChain 저장소.
 *
 * <p>두 종류의 Chain을 보관합니다:</p>
 * <ul>
 *   <li><strong>동작별 Chain:</strong> (EntityKind, Action)마다 하나</li>
 *   <li><strong>종류 공통 Chain:</strong> EntityKind의 모든 동작에 먼저 적용 (예: 인증 확인)</li>
 * </ul>
 *
 * <p><strong>해석 규칙 ({@link #resolve}):</strong> 종류 공통 Guard → 동작별 Guard 순서로 합친
 * 불변 스냅샷. 아무것도 등록되지 않았으면 빈 Chain (항상 허용).</p>
 *
 * <p>같은 종류에 대해 공통 Chain과 동작별 Chain 사이에서도 Guard 이름은 유일해야 합니다.
 * 등록 메서드는 직렬화되며, 조회와 평가는 lock 없이 수행됩니다.</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public final class GuardRegistry {

    private final Map<GuardBinding, GuardChain> actionChains = new ConcurrentHashMap<>();
    private final Map<EntityKind, GuardChain> kindChains = new ConcurrentHashMap<>();

    /**
     * 동작별 Chain에 Guard 등록.
     *
     * @param entityKind 엔티티 종류
     * @param action 동작
     * @param guard Guard
     * @param position 삽입 위치
     * @throws IllegalArgumentException 인자가 null인 경우
     * @throws ConfigurationException 같은 이름의 Guard가 공통 Chain 또는 동작별 Chain에 이미 있는 경우
     */
    public synchronized void register(EntityKind entityKind, Action action, Guard guard, GuardPosition position) {
        GuardBinding binding = GuardBinding.of(entityKind, action);
        requireGuard(guard);

        GuardChain kindChain = kindChains.get(entityKind);
        if (kindChain != null && kindChain.contains(guard.name())) {
            throw new ConfigurationException(String.format(
                "Guard %s is already registered for all actions of %s", guard.name(), entityKind));
        }
        actionChains.computeIfAbsent(binding, ignored -> GuardChain.empty()).add(guard, position);
    }

    /**
     * 종류 공통 Chain에 Guard 등록.
     *
     * @param entityKind 엔티티 종류
     * @param guard Guard
     * @param position 삽입 위치
     * @throws ConfigurationException 같은 이름의 Guard가 해당 종류의 어떤 Chain에든 이미 있는 경우
     */
    public synchronized void registerForAllActions(EntityKind entityKind, Guard guard, GuardPosition position) {
        if (entityKind == null) {
            throw new IllegalArgumentException("entityKind cannot be null");
        }
        requireGuard(guard);

        for (Map.Entry<GuardBinding, GuardChain> entry : actionChains.entrySet()) {
            if (entry.getKey().entityKind().equals(entityKind) && entry.getValue().contains(guard.name())) {
                throw new ConfigurationException(String.format(
                    "Guard %s is already registered for %s", guard.name(), entry.getKey()));
            }
        }
        kindChains.computeIfAbsent(entityKind, ignored -> GuardChain.empty()).add(guard, position);
    }

    /**
     * 동작별 Chain에서 Guard 제거.
     *
     * @return 제거했으면 true
     */
    public synchronized boolean unregister(EntityKind entityKind, Action action, String guardName) {
        GuardChain chain = actionChains.get(GuardBinding.of(entityKind, action));
        return chain != null && chain.remove(guardName);
    }

    /**
     * 종류 공통 Chain에서 Guard 제거.
     *
     * @return 제거했으면 true
     */
    public synchronized boolean unregisterForAllActions(EntityKind entityKind, String guardName) {
        GuardChain chain = kindChains.get(entityKind);
        return chain != null && chain.remove(guardName);
    }

    /**
     * 동작별 Chain 조회 (없으면 빈 Chain 생성).
     *
     * <p>반환된 Chain은 실시간 객체이며 순서 변경 등에 사용할 수 있습니다.
     * Guard 추가는 이름 유일성 검증을 위해 {@link #register}를 사용해야 합니다.</p>
     *
     * @param entityKind 엔티티 종류
     * @param action 동작
     * @return 실시간 GuardChain
     */
    public GuardChain chain(EntityKind entityKind, Action action) {
        return actionChains.computeIfAbsent(GuardBinding.of(entityKind, action), ignored -> GuardChain.empty());
    }

    /**
     * 종류 공통 Chain 조회 (없으면 빈 Chain 생성).
     *
     * @param entityKind 엔티티 종류
     * @return 실시간 GuardChain
     */
    public GuardChain kindChain(EntityKind entityKind) {
        if (entityKind == null) {
            throw new IllegalArgumentException("entityKind cannot be null");
        }
        return kindChains.computeIfAbsent(entityKind, ignored -> GuardChain.empty());
    }

    /**
     * 동작별 Chain 조회 (생성하지 않음).
     *
     * @return GuardChain (없으면 empty)
     */
    public Optional<GuardChain> findChain(EntityKind entityKind, Action action) {
        return Optional.ofNullable(actionChains.get(GuardBinding.of(entityKind, action)));
    }

    /**
     * 평가용 Chain 해석.
     *
     * <p>종류 공통 Guard와 동작별 Guard를 합친 불변 스냅샷을 반환합니다.
     * 이후 등록 변경은 반환된 Chain에 영향을 주지 않습니다.</p>
     *
     * @param entityKind 엔티티 종류
     * @param action 동작
     * @return 스냅샷 GuardChain (등록된 Guard가 없으면 빈 Chain)
     */
    public GuardChain resolve(EntityKind entityKind, Action action) {
        GuardBinding binding = GuardBinding.of(entityKind, action);
        GuardChain kindChain = kindChains.get(entityKind);
        GuardChain actionChain = actionChains.get(binding);

        List<Guard> kindGuards = kindChain == null ? List.of() : kindChain.guards();
        List<Guard> actionGuards = actionChain == null ? List.of() : actionChain.guards();
        if (kindGuards.isEmpty() && actionGuards.isEmpty()) {
            return GuardChain.empty();
        }

        List<Guard> merged = new ArrayList<>(kindGuards.size() + actionGuards.size());
        merged.addAll(kindGuards);
        merged.addAll(actionGuards);
        return GuardChain.snapshotOf(merged);
    }

    /**
     * 동작별 Guard가 하나 이상 등록된 바인딩 목록.
     *
     * @return 바인딩 집합 (불변)
     */
    public Set<GuardBinding> bindings() {
        Set<GuardBinding> bindings = new LinkedHashSet<>();
        for (Map.Entry<GuardBinding, GuardChain> entry : actionChains.entrySet()) {
            if (!entry.getValue().isEmpty()) {
                bindings.add(entry.getKey());
            }
        }
        return Collections.unmodifiableSet(bindings);
    }

    /**
     * 공통 Guard가 하나 이상 등록된 엔티티 종류 목록.
     *
     * @return 엔티티 종류 집합 (불변)
     */
    public Set<EntityKind> kindsWithSharedGuards() {
        Set<EntityKind> kinds = new LinkedHashSet<>();
        for (Map.Entry<EntityKind, GuardChain> entry : kindChains.entrySet()) {
            if (!entry.getValue().isEmpty()) {
                kinds.add(entry.getKey());
            }
        }
        return Collections.unmodifiableSet(kinds);
    }

    private static void requireGuard(Guard guard) {
        if (guard == null) {
            throw new IllegalArgumentException("guard cannot be null");
        }
    }
}
