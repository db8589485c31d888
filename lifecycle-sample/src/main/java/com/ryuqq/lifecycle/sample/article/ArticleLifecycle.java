package com.ryuqq.lifecycle.sample.article;

import com.ryuqq.lifecycle.application.service.LifecycleService;
import com.ryuqq.lifecycle.core.guard.GuardPosition;
import com.ryuqq.lifecycle.core.model.Action;
import com.ryuqq.lifecycle.core.model.EntityKind;
import com.ryuqq.lifecycle.core.model.State;

/**
 * 게시글 생명주기 정의.
 *
 * <pre>
 * Draft      --submit-for-review--> Moderation   [ContentPresentGuard]
 * Moderation --publish-----------> Published    [ModeratorRoleGuard]
 * Moderation --revert-to-draft---> Draft
 * </pre>
 *
 * <p>Published는 종료 상태입니다.</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public final class ArticleLifecycle {

    public static final EntityKind ARTICLE = EntityKind.of("ARTICLE");

    public static final State DRAFT = State.of("Draft");
    public static final State MODERATION = State.of("Moderation");
    public static final State PUBLISHED = State.of("Published");

    public static final Action SUBMIT_FOR_REVIEW = Action.of("submit-for-review");
    public static final Action PUBLISH = Action.of("publish");
    public static final Action REVERT_TO_DRAFT = Action.of("revert-to-draft");

    private ArticleLifecycle() {
    }

    /**
     * 서비스에 게시글 생명주기 등록 (start 전에 호출).
     *
     * @param service 설정 단계의 LifecycleService
     */
    public static void configure(LifecycleService service) {
        if (service == null) {
            throw new IllegalArgumentException("service cannot be null");
        }
        service.declareStates(ARTICLE, DRAFT, MODERATION, PUBLISHED);
        service.registerTransition(ARTICLE, DRAFT, SUBMIT_FOR_REVIEW, MODERATION);
        service.registerTransition(ARTICLE, MODERATION, PUBLISH, PUBLISHED);
        service.registerTransition(ARTICLE, MODERATION, REVERT_TO_DRAFT, DRAFT);

        service.registerGuard(ARTICLE, SUBMIT_FOR_REVIEW, new ContentPresentGuard(), GuardPosition.append());
        service.registerGuard(ARTICLE, PUBLISH, new ModeratorRoleGuard(), GuardPosition.append());
    }
}
