/**
 * Lifecycle Application Layer - 호스트용 생명주기 API.
 *
 * <p>설정 단계(전이 규칙, Guard, 리스너 등록)와 실행 단계(전이 요청)를 나누고,
 * ConcurrencyConflict에 대한 제한된 재시도를 제공합니다.</p>
 *
 * <h2>핵심 타입</h2>
 * <ul>
 *   <li>{@link com.ryuqq.lifecycle.application.service.LifecycleService} - 호스트용 API</li>
 *   <li>{@link com.ryuqq.lifecycle.application.service.DefaultLifecycleService} - 기본 구현</li>
 *   <li>{@link com.ryuqq.lifecycle.application.service.LifecycleServiceConfig} - 재시도 설정</li>
 * </ul>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
package com.ryuqq.lifecycle.application.service;
