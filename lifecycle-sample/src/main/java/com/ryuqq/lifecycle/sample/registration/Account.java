package com.ryuqq.lifecycle.sample.registration;

import com.ryuqq.lifecycle.core.engine.LifecycleEngine;
import com.ryuqq.lifecycle.core.engine.LifecycleEntity;
import com.ryuqq.lifecycle.core.result.TransitionResult;

/**
 * 계정 엔티티 (Requested에서 시작).
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public final class Account extends LifecycleEntity {

    public Account(String id, LifecycleEngine engine) {
        super(AccountLifecycle.ACCOUNT, id, AccountLifecycle.REQUESTED, engine);
    }

    /**
     * 가입 요청.
     *
     * @param request 가입 요청 데이터
     * @return Committed 또는 Rejected (GuardDenied면 실패한 검증 이름과 사유 포함)
     */
    public TransitionResult register(RegistrationRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        return requestTransition(AccountLifecycle.REGISTER, request.toAttributes());
    }

    public TransitionResult deactivate() {
        return requestTransition(AccountLifecycle.DEACTIVATE);
    }
}
