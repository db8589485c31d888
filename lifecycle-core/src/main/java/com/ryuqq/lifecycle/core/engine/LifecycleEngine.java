package com.ryuqq.lifecycle.core.engine;

import com.ryuqq.lifecycle.core.context.Attributes;
import com.ryuqq.lifecycle.core.context.TransitionContext;
import com.ryuqq.lifecycle.core.exception.ConfigurationException;
import com.ryuqq.lifecycle.core.guard.ChainVerdict;
import com.ryuqq.lifecycle.core.guard.Guard;
import com.ryuqq.lifecycle.core.guard.GuardBinding;
import com.ryuqq.lifecycle.core.guard.GuardPosition;
import com.ryuqq.lifecycle.core.guard.GuardRegistry;
import com.ryuqq.lifecycle.core.model.Action;
import com.ryuqq.lifecycle.core.model.EntityKind;
import com.ryuqq.lifecycle.core.model.State;
import com.ryuqq.lifecycle.core.result.Committed;
import com.ryuqq.lifecycle.core.result.ConcurrencyConflict;
import com.ryuqq.lifecycle.core.result.GuardDenied;
import com.ryuqq.lifecycle.core.result.Rejected;
import com.ryuqq.lifecycle.core.result.StructurallyIllegal;
import com.ryuqq.lifecycle.core.result.TransitionResult;
import com.ryuqq.lifecycle.core.statemachine.TransitionTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 상태 전이 엔진.
 *
 * <p>엔티티의 현재 상태, Transition Table, GuardChain, 호출자 데이터만으로 전이를 판정합니다.
 * 호출 사이에 요청 이력을 보관하지 않으며, 전이가 끝나면 엔티티를 참조하지 않습니다.</p>
 *
 * <p><strong>requestTransition 처리 흐름:</strong></p>
 * <ol>
 *   <li>(현재 상태, action) 규칙 조회 → 없으면 Rejected(StructurallyIllegal). Guard는 평가하지 않음</li>
 *   <li>(종류, action)에 묶인 GuardChain 해석 (없으면 빈 Chain) 후 평가</li>
 *   <li>거부 → Rejected(GuardDenied(reason, guardName)), 상태 변경 없음</li>
 *   <li>허용 → compare-and-set(1에서 읽은 스냅샷 → 도착 상태)
 *     <ul>
 *       <li>성공 → Committed(from, to), 후처리 리스너 호출</li>
 *       <li>실패 (다른 전이가 먼저 확정) → Rejected(ConcurrencyConflict), 덮어쓰지 않음</li>
 *     </ul>
 *   </li>
 * </ol>
 *
 * <p><strong>동시성:</strong></p>
 * <ul>
 *   <li>서로 다른 엔티티에 대한 요청은 공유 가변 상태 없이 독립적으로 진행</li>
 *   <li>같은 엔티티에 대한 동시 요청은 확정 단계에서 직렬화 (하나만 성공)</li>
 *   <li>Transition Table은 불변, GuardChain은 평가 시작 시점 스냅샷 사용</li>
 * </ul>
 *
 * <p><strong>예외 정책:</strong> StructurallyIllegal, GuardDenied, ConcurrencyConflict는 결과 값으로 반환하며
 * 예외를 던지지 않습니다. 설정 오류만 {@link ConfigurationException}으로 던집니다.</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public final class LifecycleEngine {

    private static final Logger log = LoggerFactory.getLogger(LifecycleEngine.class);

    private final Map<EntityKind, TransitionTable> tables;
    private final GuardRegistry guards;
    private final List<TransitionListener> listeners;

    private LifecycleEngine(Map<EntityKind, TransitionTable> tables, GuardRegistry guards,
                            List<TransitionListener> listeners) {
        this.tables = Collections.unmodifiableMap(new LinkedHashMap<>(tables));
        this.guards = guards;
        this.listeners = new CopyOnWriteArrayList<>(listeners);
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
     * 전이 요청.
     *
     * @param entity 대상 엔티티
     * @param action 요청 동작
     * @param attributes 호출자 제공 데이터
     * @return Committed 또는 Rejected
     * @throws IllegalArgumentException 인자가 null이거나 엔티티 종류가 이 엔진에 등록되지 않은 경우
     */
    public TransitionResult requestTransition(LifecycleEntity entity, Action action, Attributes attributes) {
        if (entity == null) {
            throw new IllegalArgumentException("entity cannot be null");
        }
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
        if (attributes == null) {
            throw new IllegalArgumentException("attributes cannot be null");
        }

        EntityKind kind = entity.getKind();
        TransitionTable table = table(kind);

        // 1. 구조 검증
        LifecycleEntity.Snapshot read = entity.snapshot();
        State from = read.state();
        Optional<State> target = table.allowedTransition(from, action);
        if (target.isEmpty()) {
            log.debug("Rejected {} of {}[{}]: no rule from {}", action, kind, entity.getId(), from);
            return Rejected.of(new StructurallyIllegal(from, action));
        }
        State to = target.get();

        // 2. 의미 검증
        TransitionContext context = new TransitionContext(kind, entity.getId(), action, from, to, attributes);
        ChainVerdict verdict = guards.resolve(kind, action).evaluate(context);
        if (verdict instanceof ChainVerdict.Denied denied) {
            return Rejected.of(new GuardDenied(denied.reason(), denied.guardName()));
        }

        // 3. 확정
        if (!entity.commit(read, to)) {
            State actual = entity.currentState();
            log.warn("Concurrency conflict on {}[{}]: {} validated against {} but state is now {}",
                kind, entity.getId(), action, from, actual);
            return Rejected.of(new ConcurrencyConflict(from, actual));
        }
        log.debug("Committed {}[{}]: {} --{}--> {}", kind, entity.getId(), from, action, to);

        notifyListeners(context);
        return new Committed(from, to);
    }

    /**
     * 속성 없이 전이 요청.
     *
     * @param entity 대상 엔티티
     * @param action 요청 동작
     * @return Committed 또는 Rejected
     */
    public TransitionResult requestTransition(LifecycleEntity entity, Action action) {
        return requestTransition(entity, action, Attributes.empty());
    }

    /**
     * 엔티티의 현재 상태 조회.
     *
     * @param entity 엔티티
     * @return 현재 상태
     */
    public State currentState(LifecycleEntity entity) {
        if (entity == null) {
            throw new IllegalArgumentException("entity cannot be null");
        }
        return entity.currentState();
    }

    /**
     * 구조적으로 허용된 전이 조회.
     *
     * @param kind 엔티티 종류
     * @param from 출발 상태
     * @param action 동작
     * @return 도착 상태 (규칙이 없으면 empty)
     */
    public Optional<State> allowedTransition(EntityKind kind, State from, Action action) {
        return table(kind).allowedTransition(from, action);
    }

    /**
     * 엔티티 종류의 Transition Table 조회.
     *
     * @param kind 엔티티 종류
     * @return Transition Table
     * @throws IllegalArgumentException 등록되지 않은 종류인 경우
     */
    public TransitionTable table(EntityKind kind) {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        TransitionTable table = tables.get(kind);
        if (table == null) {
            throw new IllegalArgumentException("No lifecycle registered for entity kind: " + kind);
        }
        return table;
    }

    /**
     * 엔티티 종류 등록 여부.
     *
     * @param kind 엔티티 종류
     * @return Transition Table이 등록되어 있으면 true
     */
    public boolean manages(EntityKind kind) {
        return tables.containsKey(kind);
    }

    /**
     * 등록된 엔티티 종류 목록.
     *
     * @return 등록 순서를 유지하는 읽기 전용 Set
     */
    public Set<EntityKind> entityKinds() {
        return tables.keySet();
    }

    /**
     * 실시간 Guard 저장소.
     *
     * <p>평가 중에도 안전하게 Chain을 재구성할 수 있습니다.
     * 등록 검증이 필요하면 {@link #registerGuard}를 사용하세요.</p>
     *
     * @return GuardRegistry
     */
    public GuardRegistry guards() {
        return guards;
    }

    /**
     * 동작별 Chain에 Guard 등록 (Transition Table 기준 검증).
     *
     * @param kind 엔티티 종류
     * @param action 동작
     * @param guard Guard
     * @param position 삽입 위치
     * @throws ConfigurationException 종류 또는 동작이 Transition Table에 없거나, Guard 이름이 중복된 경우
     */
    public void registerGuard(EntityKind kind, Action action, Guard guard, GuardPosition position) {
        checkBinding(tables, GuardBinding.of(kind, action));
        guards.register(kind, action, guard, position);
    }

    /**
     * 종류 공통 Chain에 Guard 등록.
     *
     * @param kind 엔티티 종류
     * @param guard Guard
     * @param position 삽입 위치
     * @throws ConfigurationException 종류가 등록되지 않았거나 Guard 이름이 중복된 경우
     */
    public void registerGuardForAllActions(EntityKind kind, Guard guard, GuardPosition position) {
        checkKind(tables, kind);
        guards.registerForAllActions(kind, guard, position);
    }

    /**
     * 후처리 리스너 추가.
     *
     * @param listener 리스너
     */
    public void addListener(TransitionListener listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        listeners.add(listener);
    }

    /**
     * 후처리 리스너 제거.
     *
     * @param listener 리스너
     * @return 제거했으면 true
     */
    public boolean removeListener(TransitionListener listener) {
        return listeners.remove(listener);
    }

    /**
     * 초기 상태 검증.
     *
     * @throws IllegalArgumentException 종류가 등록되지 않았거나 상태가 선언되지 않은 경우
     */
    void validateInitialState(EntityKind kind, State initialState) {
        TransitionTable table = table(kind);
        if (!table.declares(initialState)) {
            throw new IllegalArgumentException(String.format(
                "Initial state %s is not declared for %s (declared: %s)", initialState, kind, table.states()));
        }
    }

    private void notifyListeners(TransitionContext context) {
        for (TransitionListener listener : listeners) {
            try {
                listener.onCommitted(context);
            } catch (RuntimeException e) {
                log.error("Listener {} failed after commit of {}[{}] {} → {}",
                    listener.name(), context.entityKind(), context.entityId(),
                    context.fromState(), context.toState(), e);
            }
        }
    }

    private static void checkKind(Map<EntityKind, TransitionTable> tables, EntityKind kind) {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (!tables.containsKey(kind)) {
            throw new ConfigurationException("Guard bound to unregistered entity kind: " + kind);
        }
    }

    private static void checkBinding(Map<EntityKind, TransitionTable> tables, GuardBinding binding) {
        checkKind(tables, binding.entityKind());
        if (!tables.get(binding.entityKind()).declares(binding.action())) {
            throw new ConfigurationException(String.format(
                "Guard bound to %s, but %s has no rule for action %s",
                binding, binding.entityKind(), binding.action()));
        }
    }

    /**
     * LifecycleEngine Builder.
     *
     * <p><strong>사용 예시:</strong></p>
     * <pre>
     * LifecycleEngine engine = LifecycleEngine.builder()
     *     .table(articleTable)
     *     .guard(ARTICLE, PUBLISH, new ModeratorRoleGuard())
     *     .listener(auditListener)
     *     .build();
     * </pre>
     */
    public static final class Builder {

        private final Map<EntityKind, TransitionTable> tables = new LinkedHashMap<>();
        private final List<TransitionListener> listeners = new ArrayList<>();
        private GuardRegistry guards = new GuardRegistry();

        private Builder() {
        }

        /**
         * Transition Table 등록.
         *
         * @param table Transition Table
         * @return this
         * @throws ConfigurationException 같은 종류의 Table이 이미 등록된 경우
         */
        public Builder table(TransitionTable table) {
            if (table == null) {
                throw new IllegalArgumentException("table cannot be null");
            }
            if (tables.containsKey(table.getEntityKind())) {
                throw new ConfigurationException("TransitionTable already registered for " + table.getEntityKind());
            }
            tables.put(table.getEntityKind(), table);
            return this;
        }

        /**
         * 이미 구성된 GuardRegistry 사용.
         *
         * <p>바인딩 검증은 {@link #build()}에서 수행합니다.
         * {@link #guard} 호출보다 먼저 지정해야 합니다.</p>
         *
         * @param guards GuardRegistry
         * @return this
         * @throws IllegalStateException 이미 Builder에 Guard가 등록된 경우
         */
        public Builder guardRegistry(GuardRegistry guards) {
            if (guards == null) {
                throw new IllegalArgumentException("guards cannot be null");
            }
            if (!this.guards.bindings().isEmpty() || !this.guards.kindsWithSharedGuards().isEmpty()) {
                throw new IllegalStateException("guardRegistry must be set before registering guards on the builder");
            }
            this.guards = guards;
            return this;
        }

        public Builder guard(EntityKind kind, Action action, Guard guard) {
            return guard(kind, action, guard, GuardPosition.append());
        }

        public Builder guard(EntityKind kind, Action action, Guard guard, GuardPosition position) {
            guards.register(kind, action, guard, position);
            return this;
        }

        public Builder guardForAllActions(EntityKind kind, Guard guard, GuardPosition position) {
            guards.registerForAllActions(kind, guard, position);
            return this;
        }

        public Builder listener(TransitionListener listener) {
            if (listener == null) {
                throw new IllegalArgumentException("listener cannot be null");
            }
            listeners.add(listener);
            return this;
        }

        /**
         * LifecycleEngine 생성.
         *
         * @return LifecycleEngine
         * @throws ConfigurationException Table이 없거나, Guard가 등록되지 않은 종류/동작에 묶인 경우
         */
        public LifecycleEngine build() {
            if (tables.isEmpty()) {
                throw new ConfigurationException("At least one TransitionTable must be registered");
            }
            for (GuardBinding binding : guards.bindings()) {
                checkBinding(tables, binding);
            }
            for (EntityKind kind : guards.kindsWithSharedGuards()) {
                checkKind(tables, kind);
            }
            return new LifecycleEngine(tables, guards, listeners);
        }
    }
}
