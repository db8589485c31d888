package com.ryuqq.lifecycle.core.engine;

import com.ryuqq.lifecycle.core.context.Attributes;
import com.ryuqq.lifecycle.core.model.Action;
import com.ryuqq.lifecycle.core.model.EntityKind;
import com.ryuqq.lifecycle.core.model.State;
import com.ryuqq.lifecycle.core.result.TransitionResult;

import java.util.concurrent.atomic.AtomicReference;

/**
 * 생명주기를 관리받는 엔티티.
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>항상 정확히 하나의 현재 상태를 가짐 (생성 시 명시적 초기 상태 필수)</li>
 *   <li>상태는 LifecycleEngine의 확정 단계로만 변경됨 (외부 setter 없음)</li>
 *   <li>확정은 compare-and-set: 검증 기준 스냅샷(상태 + 버전)이 그대로일 때만 성공</li>
 *   <li>확정마다 버전이 증가하므로 자기 전이(X → X)나 A → B → A 이후에도 이전 스냅샷 기준 확정은 실패</li>
 * </ul>
 *
 * <p>도메인 엔티티는 이 클래스를 상속해 동작별 메서드를 제공합니다:</p>
 * <pre>
 * public final class Article extends LifecycleEntity {
 *     public TransitionResult publish(Attributes attributes) {
 *         return requestTransition(ArticleActions.PUBLISH, attributes);
 *     }
 * }
 * </pre>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public class LifecycleEntity {

    private final EntityKind kind;
    private final String id;
    private final LifecycleEngine engine;
    private final AtomicReference<Snapshot> snapshot;

    /**
     * 생성자.
     *
     * @param kind 엔티티 종류 (engine에 Transition Table이 등록되어 있어야 함)
     * @param id 엔티티 식별자
     * @param initialState 초기 상태 (Transition Table에 선언된 상태여야 함)
     * @param engine 전이 요청을 위임할 엔진
     * @throws IllegalArgumentException 인자가 null이거나, 종류가 등록되지 않았거나, 초기 상태가 선언되지 않은 경우
     */
    public LifecycleEntity(EntityKind kind, String id, State initialState, LifecycleEngine engine) {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (initialState == null) {
            throw new IllegalArgumentException("initialState cannot be null");
        }
        if (engine == null) {
            throw new IllegalArgumentException("engine cannot be null");
        }
        engine.validateInitialState(kind, initialState);

        this.kind = kind;
        this.id = id;
        this.engine = engine;
        this.snapshot = new AtomicReference<>(new Snapshot(initialState, 0L));
    }

    /**
     * 현재 상태 조회.
     *
     * @return 현재 상태
     */
    public final State currentState() {
        return snapshot.get().state();
    }

    /**
     * 확정 횟수.
     *
     * @return 생성 이후 확정된 전이 수
     */
    public final long version() {
        return snapshot.get().version();
    }

    /**
     * 전이 요청.
     *
     * @param action 동작
     * @param attributes 호출자 제공 데이터
     * @return Committed 또는 Rejected
     */
    public final TransitionResult requestTransition(Action action, Attributes attributes) {
        return engine.requestTransition(this, action, attributes);
    }

    /**
     * 속성 없이 전이 요청.
     *
     * @param action 동작
     * @return Committed 또는 Rejected
     */
    public final TransitionResult requestTransition(Action action) {
        return engine.requestTransition(this, action, Attributes.empty());
    }

    public final EntityKind getKind() {
        return kind;
    }

    public final String getId() {
        return id;
    }

    /**
     * 검증 기준 스냅샷 조회 (엔진 전용).
     *
     * @return 현재 상태와 버전
     */
    final Snapshot snapshot() {
        return snapshot.get();
    }

    /**
     * 상태 확정 (엔진 전용).
     *
     * @param expected 검증 기준 스냅샷 ({@link #snapshot()}으로 읽은 참조)
     * @param next 새 상태
     * @return 그 사이 다른 확정이 없었으면 true
     */
    final boolean commit(Snapshot expected, State next) {
        return snapshot.compareAndSet(expected, new Snapshot(next, expected.version() + 1));
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" + kind + "[" + id + "], state=" + currentState() + '}';
    }

    /**
     * 상태와 확정 버전의 쌍. 확정마다 새 인스턴스로 교체됩니다.
     */
    record Snapshot(State state, long version) {
    }
}
