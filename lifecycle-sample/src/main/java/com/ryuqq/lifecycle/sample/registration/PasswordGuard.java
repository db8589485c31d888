package com.ryuqq.lifecycle.sample.registration;

import com.ryuqq.lifecycle.core.context.ContextKey;
import com.ryuqq.lifecycle.core.context.TransitionContext;
import com.ryuqq.lifecycle.core.guard.Guard;
import com.ryuqq.lifecycle.core.guard.GuardDecision;

import java.util.Optional;
import java.util.Set;

/**
 * 비밀번호 정책 검증.
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public final class PasswordGuard implements Guard {

    public static final String NAME = "PasswordGuard";

    private final PasswordPolicy policy;

    public PasswordGuard(PasswordPolicy policy) {
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }
        this.policy = policy;
    }

    @Override
    public GuardDecision evaluate(TransitionContext context) {
        Optional<String> violation = policy.violation(context.require(RegistrationKeys.PASSWORD));
        return violation.map(GuardDecision::deny).orElseGet(GuardDecision::approve);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Set<ContextKey<?>> requiredKeys() {
        return Set.of(RegistrationKeys.PASSWORD);
    }

    public PasswordPolicy getPolicy() {
        return policy;
    }
}
