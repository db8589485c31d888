package com.ryuqq.lifecycle.sample.article;

import com.ryuqq.lifecycle.core.context.ContextKey;
import com.ryuqq.lifecycle.core.context.TransitionContext;
import com.ryuqq.lifecycle.core.guard.Guard;
import com.ryuqq.lifecycle.core.guard.GuardDecision;

import java.util.Set;

/**
 * 검토 요청 전 제목과 본문이 채워져 있는지 확인.
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public final class ContentPresentGuard implements Guard {

    public static final String NAME = "ContentPresentGuard";

    @Override
    public GuardDecision evaluate(TransitionContext context) {
        if (context.require(ArticleKeys.TITLE).isBlank()) {
            return GuardDecision.deny("title is empty");
        }
        if (context.require(ArticleKeys.BODY).isBlank()) {
            return GuardDecision.deny("body is empty");
        }
        return GuardDecision.approve();
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Set<ContextKey<?>> requiredKeys() {
        return Set.of(ArticleKeys.TITLE, ArticleKeys.BODY);
    }
}
