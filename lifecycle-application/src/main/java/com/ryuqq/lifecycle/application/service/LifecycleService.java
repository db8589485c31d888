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
import com.ryuqq.lifecycle.core.result.TransitionResult;

/**
 * 호스트 애플리케이션이 사용하는 생명주기 API.
 *
 * <p>두 단계로 사용합니다:</p>
 * <ol>
 *   <li><strong>설정 단계:</strong> 전이 규칙, State 집합, Guard, 리스너 등록</li>
 *   <li><strong>실행 단계:</strong> {@link #start()} 이후 전이 요청. Transition Table은 고정되며,
 *       Guard와 리스너는 계속 추가할 수 있음</li>
 * </ol>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * LifecycleService service = new DefaultLifecycleService();
 * service.registerTransition(ARTICLE, DRAFT, SUBMIT_FOR_REVIEW, MODERATION);
 * service.registerGuard(ARTICLE, SUBMIT_FOR_REVIEW, new ContentPresentGuard(), GuardPosition.append());
 * service.start();
 *
 * Article article = new Article("article-1", service.engine());
 * TransitionResult result = service.requestTransition(article, SUBMIT_FOR_REVIEW, attributes);
 * </pre>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public interface LifecycleService {

    /**
     * 전이 규칙 등록.
     *
     * @param entityKind 엔티티 종류
     * @param fromState 출발 상태
     * @param action 동작
     * @param toState 도착 상태
     * @throws ConfigurationException (fromState, action) 규칙이 이미 있거나, 이미 시작된 경우
     */
    void registerTransition(EntityKind entityKind, State fromState, Action action, State toState);

    /**
     * 엔티티 종류의 State 집합을 명시적으로 선언.
     *
     * <p>나가는 규칙이 없는 State(예: 초기 상태로만 쓰는 상태)를 포함시킬 때 사용합니다.</p>
     *
     * @param entityKind 엔티티 종류
     * @param states State 목록
     * @throws ConfigurationException 이미 시작된 경우
     */
    void declareStates(EntityKind entityKind, State... states);

    /**
     * 동작별 Guard 등록.
     *
     * <p>시작 전 등록은 {@link #start()}에서, 시작 후 등록은 즉시 검증합니다.</p>
     *
     * @param entityKind 엔티티 종류
     * @param action 동작
     * @param guard Guard
     * @param position 삽입 위치
     * @throws ConfigurationException (시작 후) 동작이 Transition Table에 없거나 Guard 이름이 중복된 경우
     */
    void registerGuard(EntityKind entityKind, Action action, Guard guard, GuardPosition position);

    /**
     * 엔티티 종류의 모든 동작에 먼저 적용되는 Guard 등록.
     *
     * @param entityKind 엔티티 종류
     * @param guard Guard
     * @param position 삽입 위치
     */
    void registerGuardForAllActions(EntityKind entityKind, Guard guard, GuardPosition position);

    /**
     * 후처리 리스너 등록.
     *
     * @param listener 리스너
     */
    void addListener(TransitionListener listener);

    /**
     * 설정 검증 후 엔진 생성.
     *
     * @throws ConfigurationException 설정이 잘못된 경우
     * @throws IllegalStateException 이미 시작된 경우
     */
    void start();

    boolean isStarted();

    /**
     * 전이 요청.
     *
     * <p>ConcurrencyConflict는 상태를 다시 읽어 설정된 횟수만큼 재시도합니다.</p>
     *
     * @param entity 대상 엔티티
     * @param action 동작
     * @param attributes 호출자 제공 데이터
     * @return Committed 또는 Rejected
     * @throws IllegalStateException 시작 전인 경우
     */
    TransitionResult requestTransition(LifecycleEntity entity, Action action, Attributes attributes);

    /**
     * 현재 상태 조회.
     *
     * @param entity 엔티티
     * @return 현재 상태
     */
    State currentState(LifecycleEntity entity);

    /**
     * 시작된 엔진 (엔티티 생성용).
     *
     * @return LifecycleEngine
     * @throws IllegalStateException 시작 전인 경우
     */
    LifecycleEngine engine();
}
