package com.ryuqq.lifecycle.sample.article;

import com.ryuqq.lifecycle.core.context.ContextKey;
import com.ryuqq.lifecycle.core.context.TransitionContext;
import com.ryuqq.lifecycle.core.guard.Guard;
import com.ryuqq.lifecycle.core.guard.GuardDecision;

import java.util.Set;

/**
 * 게시 권한 확인.
 *
 * <p>요청자 역할({@link ArticleKeys#ACTOR_ROLE})이 허용 역할 중 하나여야 합니다.
 * 기본 허용 역할은 {@code MODERATOR}입니다.</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public final class ModeratorRoleGuard implements Guard {

    public static final String NAME = "ModeratorRoleGuard";
    public static final String MODERATOR = "MODERATOR";

    private final Set<String> allowedRoles;

    public ModeratorRoleGuard() {
        this(Set.of(MODERATOR));
    }

    /**
     * 생성자.
     *
     * @param allowedRoles 게시를 허용할 역할 집합
     * @throws IllegalArgumentException allowedRoles가 null이거나 비어있는 경우
     */
    public ModeratorRoleGuard(Set<String> allowedRoles) {
        if (allowedRoles == null || allowedRoles.isEmpty()) {
            throw new IllegalArgumentException("allowedRoles cannot be null or empty");
        }
        this.allowedRoles = Set.copyOf(allowedRoles);
    }

    @Override
    public GuardDecision evaluate(TransitionContext context) {
        String role = context.require(ArticleKeys.ACTOR_ROLE);
        if (allowedRoles.contains(role)) {
            return GuardDecision.approve();
        }
        return GuardDecision.deny("moderator role required");
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Set<ContextKey<?>> requiredKeys() {
        return Set.of(ArticleKeys.ACTOR_ROLE);
    }
}
