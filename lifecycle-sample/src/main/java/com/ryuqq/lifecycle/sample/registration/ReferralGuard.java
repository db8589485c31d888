package com.ryuqq.lifecycle.sample.registration;

import com.ryuqq.lifecycle.core.context.TransitionContext;
import com.ryuqq.lifecycle.core.guard.Guard;
import com.ryuqq.lifecycle.core.guard.GuardDecision;

import java.util.Optional;

/**
 * 추천 코드 검증.
 *
 * <p>추천 코드는 선택 항목입니다. 없으면 허용하고, 있으면 발급된 코드여야 합니다.</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public final class ReferralGuard implements Guard {

    public static final String NAME = "ReferralGuard";

    private final UserDirectory directory;

    public ReferralGuard(UserDirectory directory) {
        if (directory == null) {
            throw new IllegalArgumentException("directory cannot be null");
        }
        this.directory = directory;
    }

    @Override
    public GuardDecision evaluate(TransitionContext context) {
        Optional<String> referralCode = context.attributes().find(RegistrationKeys.REFERRAL_CODE);
        if (referralCode.isEmpty() || directory.referralCodeExists(referralCode.get())) {
            return GuardDecision.approve();
        }
        return GuardDecision.deny("unknown referral code");
    }

    @Override
    public String name() {
        return NAME;
    }
}
