package com.ryuqq.lifecycle.sample.article;

import com.ryuqq.lifecycle.core.context.Attributes;
import com.ryuqq.lifecycle.core.engine.LifecycleEngine;
import com.ryuqq.lifecycle.core.engine.LifecycleEntity;
import com.ryuqq.lifecycle.core.result.TransitionResult;

/**
 * 게시글 엔티티.
 *
 * <p>항상 Draft에서 시작합니다. 제목과 본문은 생성 시 고정됩니다.</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public final class Article extends LifecycleEntity {

    private final String title;
    private final String body;

    /**
     * 생성자.
     *
     * @param id 게시글 ID
     * @param title 제목 (빈 문자열 허용, 검토 요청 시 거부됨)
     * @param body 본문 (빈 문자열 허용, 검토 요청 시 거부됨)
     * @param engine ARTICLE 생명주기가 등록된 엔진
     */
    public Article(String id, String title, String body, LifecycleEngine engine) {
        super(ArticleLifecycle.ARTICLE, id, ArticleLifecycle.DRAFT, engine);
        if (title == null) {
            throw new IllegalArgumentException("title cannot be null");
        }
        if (body == null) {
            throw new IllegalArgumentException("body cannot be null");
        }
        this.title = title;
        this.body = body;
    }

    public TransitionResult submitForReview() {
        Attributes attributes = Attributes.builder()
            .put(ArticleKeys.TITLE, title)
            .put(ArticleKeys.BODY, body)
            .build();
        return requestTransition(ArticleLifecycle.SUBMIT_FOR_REVIEW, attributes);
    }

    /**
     * 게시.
     *
     * @param actorRole 요청자 역할
     * @return Committed 또는 Rejected
     */
    public TransitionResult publish(String actorRole) {
        if (actorRole == null) {
            throw new IllegalArgumentException("actorRole cannot be null");
        }
        return requestTransition(ArticleLifecycle.PUBLISH, Attributes.of(ArticleKeys.ACTOR_ROLE, actorRole));
    }

    public TransitionResult revertToDraft() {
        return requestTransition(ArticleLifecycle.REVERT_TO_DRAFT);
    }

    public String getTitle() {
        return title;
    }

    public String getBody() {
        return body;
    }
}
