package com.ryuqq.lifecycle.sample.registration;

import com.ryuqq.lifecycle.core.context.TransitionContext;
import com.ryuqq.lifecycle.core.engine.TransitionListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 가입 확정 후 이메일과 추천 코드 사용을 UserDirectory에 기록.
 *
 * <p>ACCOUNT의 register 전이에만 반응합니다. 기록 실패는 엔진이 로그로 남기며,
 * 확정된 가입은 되돌리지 않습니다.</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public final class RegistrationRecorder implements TransitionListener {

    private static final Logger log = LoggerFactory.getLogger(RegistrationRecorder.class);

    private final UserDirectory directory;

    public RegistrationRecorder(UserDirectory directory) {
        if (directory == null) {
            throw new IllegalArgumentException("directory cannot be null");
        }
        this.directory = directory;
    }

    @Override
    public void onCommitted(TransitionContext context) {
        if (!AccountLifecycle.ACCOUNT.equals(context.entityKind())
                || !AccountLifecycle.REGISTER.equals(context.action())) {
            return;
        }
        String email = context.require(RegistrationKeys.EMAIL);
        directory.recordRegistration(context.entityId(), email);
        context.attributes().find(RegistrationKeys.REFERRAL_CODE)
            .ifPresent(code -> directory.recordReferralUse(code, context.entityId()));

        log.info("Account {} registered with {}", context.entityId(), email);
    }
}
