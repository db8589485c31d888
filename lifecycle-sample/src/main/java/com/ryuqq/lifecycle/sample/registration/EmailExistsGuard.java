package com.ryuqq.lifecycle.sample.registration;

import com.ryuqq.lifecycle.core.context.ContextKey;
import com.ryuqq.lifecycle.core.context.TransitionContext;
import com.ryuqq.lifecycle.core.guard.Guard;
import com.ryuqq.lifecycle.core.guard.GuardDecision;

import java.util.Set;

/**
 * 이미 가입된 이메일이면 거부.
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public final class EmailExistsGuard implements Guard {

    public static final String NAME = "EmailExistsGuard";

    private final UserDirectory directory;

    public EmailExistsGuard(UserDirectory directory) {
        if (directory == null) {
            throw new IllegalArgumentException("directory cannot be null");
        }
        this.directory = directory;
    }

    @Override
    public GuardDecision evaluate(TransitionContext context) {
        if (directory.emailExists(context.require(RegistrationKeys.EMAIL))) {
            return GuardDecision.deny("email exists");
        }
        return GuardDecision.approve();
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Set<ContextKey<?>> requiredKeys() {
        return Set.of(RegistrationKeys.EMAIL);
    }
}
