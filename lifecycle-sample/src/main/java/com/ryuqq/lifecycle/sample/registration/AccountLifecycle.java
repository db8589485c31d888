package com.ryuqq.lifecycle.sample.registration;

import com.ryuqq.lifecycle.application.service.LifecycleService;
import com.ryuqq.lifecycle.core.guard.GuardPosition;
import com.ryuqq.lifecycle.core.model.Action;
import com.ryuqq.lifecycle.core.model.EntityKind;
import com.ryuqq.lifecycle.core.model.State;

/**
 * 계정 가입 생명주기 정의.
 *
 * <pre>
 * Requested  --register---> Registered   [EmailExistsGuard, PasswordGuard, ReferralGuard]
 * Registered --deactivate-> Deactivated
 * </pre>
 *
 * <p>가입 확정 후 {@link RegistrationRecorder}가 UserDirectory에 기록합니다.</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public final class AccountLifecycle {

    public static final EntityKind ACCOUNT = EntityKind.of("ACCOUNT");

    public static final State REQUESTED = State.of("Requested");
    public static final State REGISTERED = State.of("Registered");
    public static final State DEACTIVATED = State.of("Deactivated");

    public static final Action REGISTER = Action.of("register");
    public static final Action DEACTIVATE = Action.of("deactivate");

    private AccountLifecycle() {
    }

    /**
     * 서비스에 계정 생명주기 등록 (start 전에 호출).
     *
     * @param service 설정 단계의 LifecycleService
     * @param directory 사용자 조회 포트
     * @param passwordPolicy 비밀번호 정책
     */
    public static void configure(LifecycleService service, UserDirectory directory, PasswordPolicy passwordPolicy) {
        if (service == null) {
            throw new IllegalArgumentException("service cannot be null");
        }
        service.declareStates(ACCOUNT, REQUESTED, REGISTERED, DEACTIVATED);
        service.registerTransition(ACCOUNT, REQUESTED, REGISTER, REGISTERED);
        service.registerTransition(ACCOUNT, REGISTERED, DEACTIVATE, DEACTIVATED);

        service.registerGuard(ACCOUNT, REGISTER, new EmailExistsGuard(directory), GuardPosition.append());
        service.registerGuard(ACCOUNT, REGISTER, new PasswordGuard(passwordPolicy), GuardPosition.append());
        service.registerGuard(ACCOUNT, REGISTER, new ReferralGuard(directory), GuardPosition.append());

        service.addListener(new RegistrationRecorder(directory));
    }
}
