package com.ryuqq.lifecycle.sample.article;

import com.ryuqq.lifecycle.core.context.Attributes;
import com.ryuqq.lifecycle.core.context.TransitionContext;
import com.ryuqq.lifecycle.core.guard.GuardDecision;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ModeratorRoleGuard / ContentPresentGuard 단위 테스트.
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
class ModeratorRoleGuardTest {

    private static TransitionContext context(Attributes attributes) {
        return new TransitionContext(ArticleLifecycle.ARTICLE, "article-1", ArticleLifecycle.PUBLISH,
            ArticleLifecycle.MODERATION, ArticleLifecycle.PUBLISHED, attributes);
    }

    @Test
    void evaluate_CustomRoles() {
        // Given
        ModeratorRoleGuard guard = new ModeratorRoleGuard(Set.of("EDITOR", "ADMIN"));

        // When & Then
        assertTrue(guard.evaluate(context(Attributes.of(ArticleKeys.ACTOR_ROLE, "ADMIN"))).isApproved());
        assertEquals(GuardDecision.deny("moderator role required"),
            guard.evaluate(context(Attributes.of(ArticleKeys.ACTOR_ROLE, "MODERATOR"))));
    }

    @Test
    void constructor_EmptyRoles_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new ModeratorRoleGuard(Set.of()));
    }

    @Test
    void requiredKeys_DeclaresActorRole() {
        assertEquals(Set.of(ArticleKeys.ACTOR_ROLE), new ModeratorRoleGuard().requiredKeys());
        assertEquals("ModeratorRoleGuard", new ModeratorRoleGuard().name());
    }

    @Test
    void contentPresentGuard_BlankTitle_Denied() {
        // Given
        ContentPresentGuard guard = new ContentPresentGuard();
        Attributes attributes = Attributes.builder()
            .put(ArticleKeys.TITLE, "")
            .put(ArticleKeys.BODY, "text")
            .build();

        // When
        GuardDecision decision = guard.evaluate(context(attributes));

        // Then
        assertEquals(GuardDecision.deny("title is empty"), decision);
    }
}
