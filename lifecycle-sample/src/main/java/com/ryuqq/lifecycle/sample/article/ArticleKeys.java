package com.ryuqq.lifecycle.sample.article;

import com.ryuqq.lifecycle.core.context.ContextKey;

/**
 * Article 전이 컨텍스트 키.
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public final class ArticleKeys {

    public static final ContextKey<String> TITLE = ContextKey.of("title", String.class);
    public static final ContextKey<String> BODY = ContextKey.of("body", String.class);
    public static final ContextKey<String> ACTOR_ROLE = ContextKey.of("actorRole", String.class);

    private ArticleKeys() {
    }
}
