package com.ryuqq.lifecycle.application.service;

import com.ryuqq.lifecycle.core.context.Attributes;
import com.ryuqq.lifecycle.core.engine.LifecycleEngine;
import com.ryuqq.lifecycle.core.engine.LifecycleEntity;
import com.ryuqq.lifecycle.core.engine.TransitionListener;
import com.ryuqq.lifecycle.core.exception.ConfigurationException;
import com.ryuqq.lifecycle.core.guard.Guard;
import com.ryuqq.lifecycle.core.guard.GuardPosition;
import com.ryuqq.lifecycle.core.model.Action;
import com.ryuqq.lifecycle.core.model.EntityKind;
import com.ryuqq.lifecycle.core.model.State;
import com.ryuqq.lifecycle.core.result.ConcurrencyConflict;
import com.ryuqq.lifecycle.core.result.TransitionResult;
import com.ryuqq.lifecycle.core.statemachine.TransitionTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * LifecycleService 기본 구현.
 *
 * <p>설정 단계의 등록은 내부 Builder에 모아 두고, {@link #start()}에서 한 번에
 * LifecycleEngine을 생성합니다. 설정 메서드와 start는 직렬화되며,
 * 시작 후 전이 요청은 lock 없이 엔진에 위임합니다.</p>
 *
 * <p><strong>ConcurrencyConflict 재시도:</strong></p>
 * <ol>
 *   <li>엔진에 요청 (현재 상태를 다시 읽고 규칙 조회와 Guard 평가부터 다시 수행)</li>
 *   <li>ConcurrencyConflict이면 retryBackoffMs 대기 후 반복</li>
 *   <li>maxConflictRetries 초과 시 마지막 ConcurrencyConflict 반환</li>
 * </ol>
 *
 * <p>재시도 중 다른 전이로 상태가 바뀌면 새 상태 기준으로 판정하므로
 * StructurallyIllegal이나 GuardDenied가 반환될 수 있습니다.</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public final class DefaultLifecycleService implements LifecycleService {

    private static final Logger log = LoggerFactory.getLogger(DefaultLifecycleService.class);

    private final LifecycleServiceConfig config;
    private final Map<EntityKind, TransitionTable.Builder> tableBuilders = new LinkedHashMap<>();
    private final List<PendingGuard> pendingGuards = new ArrayList<>();
    private final List<TransitionListener> pendingListeners = new ArrayList<>();

    private volatile LifecycleEngine engine;

    /**
     * 기본 설정으로 생성.
     */
    public DefaultLifecycleService() {
        this(new LifecycleServiceConfig());
    }

    /**
     * 생성자.
     *
     * @param config 서비스 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public DefaultLifecycleService(LifecycleServiceConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
    }

    @Override
    public synchronized void registerTransition(EntityKind entityKind, State fromState, Action action, State toState) {
        requireConfigurable(entityKind);
        tableBuilder(entityKind).rule(fromState, action, toState);
    }

    @Override
    public synchronized void declareStates(EntityKind entityKind, State... states) {
        requireConfigurable(entityKind);
        tableBuilder(entityKind).states(states);
    }

    @Override
    public synchronized void registerGuard(EntityKind entityKind, Action action, Guard guard, GuardPosition position) {
        if (engine != null) {
            engine.registerGuard(entityKind, action, guard, position);
            log.info("Guard {} registered for {}/{} at runtime", guard.name(), entityKind, action);
            return;
        }
        pendingGuards.add(PendingGuard.forAction(entityKind, action, guard, position));
    }

    @Override
    public synchronized void registerGuardForAllActions(EntityKind entityKind, Guard guard, GuardPosition position) {
        if (engine != null) {
            engine.registerGuardForAllActions(entityKind, guard, position);
            log.info("Guard {} registered for all actions of {} at runtime", guard.name(), entityKind);
            return;
        }
        pendingGuards.add(PendingGuard.forAllActions(entityKind, guard, position));
    }

    @Override
    public synchronized void addListener(TransitionListener listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        if (engine != null) {
            engine.addListener(listener);
            return;
        }
        pendingListeners.add(listener);
    }

    @Override
    public synchronized void start() {
        if (engine != null) {
            throw new IllegalStateException("LifecycleService already started");
        }
        if (tableBuilders.isEmpty()) {
            throw new ConfigurationException("No transitions registered");
        }

        LifecycleEngine.Builder builder = LifecycleEngine.builder();
        for (TransitionTable.Builder tableBuilder : tableBuilders.values()) {
            builder.table(tableBuilder.build());
        }
        for (PendingGuard pending : pendingGuards) {
            if (pending.action() == null) {
                builder.guardForAllActions(pending.entityKind(), pending.guard(), pending.position());
            } else {
                builder.guard(pending.entityKind(), pending.action(), pending.guard(), pending.position());
            }
        }
        for (TransitionListener listener : pendingListeners) {
            builder.listener(listener);
        }

        this.engine = builder.build();
        pendingGuards.clear();
        pendingListeners.clear();

        log.info("LifecycleService started: kinds={}", engine.entityKinds());
    }

    @Override
    public boolean isStarted() {
        return engine != null;
    }

    @Override
    public TransitionResult requestTransition(LifecycleEntity entity, Action action, Attributes attributes) {
        LifecycleEngine started = requireStarted();

        TransitionResult result = started.requestTransition(entity, action, attributes);
        int retries = 0;
        while (result.rejectKind() instanceof ConcurrencyConflict conflict) {
            if (retries >= config.maxConflictRetries()) {
                log.warn("Giving up {} on {}[{}] after {} retries: expected {} but was {}",
                    action, entity.getKind(), entity.getId(), retries, conflict.expected(), conflict.actual());
                return result;
            }
            retries++;
            log.debug("Retrying {} on {}[{}] (attempt {}/{}) after conflict: {} → {}",
                action, entity.getKind(), entity.getId(), retries, config.maxConflictRetries(),
                conflict.expected(), conflict.actual());
            sleep(config.retryBackoffMs());
            result = started.requestTransition(entity, action, attributes);
        }
        return result;
    }

    @Override
    public State currentState(LifecycleEntity entity) {
        return requireStarted().currentState(entity);
    }

    @Override
    public LifecycleEngine engine() {
        return requireStarted();
    }

    public LifecycleServiceConfig getConfig() {
        return config;
    }

    private TransitionTable.Builder tableBuilder(EntityKind entityKind) {
        return tableBuilders.computeIfAbsent(entityKind, TransitionTable::builder);
    }

    private void requireConfigurable(EntityKind entityKind) {
        if (entityKind == null) {
            throw new IllegalArgumentException("entityKind cannot be null");
        }
        if (engine != null) {
            throw new ConfigurationException(
                "LifecycleService already started; transition table of " + entityKind + " is frozen");
        }
    }

    private LifecycleEngine requireStarted() {
        LifecycleEngine started = engine;
        if (started == null) {
            throw new IllegalStateException("LifecycleService not started; call start() first");
        }
        return started;
    }

    /**
     * 재시도 대기.
     *
     * <p>InterruptedException 발생 시 인터럽트 플래그를 복원하고 RuntimeException으로 래핑합니다.</p>
     */
    private void sleep(long millis) {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Conflict retry interrupted", e);
        }
    }

    /**
     * 시작 전 등록된 Guard (action이 null이면 종류 공통).
     */
    private record PendingGuard(EntityKind entityKind, Action action, Guard guard, GuardPosition position) {

        static PendingGuard forAction(EntityKind entityKind, Action action, Guard guard, GuardPosition position) {
            if (entityKind == null || action == null || guard == null || position == null) {
                throw new IllegalArgumentException("entityKind, action, guard and position cannot be null");
            }
            return new PendingGuard(entityKind, action, guard, position);
        }

        static PendingGuard forAllActions(EntityKind entityKind, Guard guard, GuardPosition position) {
            if (entityKind == null || guard == null || position == null) {
                throw new IllegalArgumentException("entityKind, guard and position cannot be null");
            }
            return new PendingGuard(entityKind, null, guard, position);
        }
    }
}
