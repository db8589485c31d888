package com.ryuqq.lifecycle.core.guard;

import com.ryuqq.lifecycle.core.model.Action;
import com.ryuqq.lifecycle.core.model.EntityKind;

/**
 * GuardChain이 묶이는 (엔티티 종류, 동작) 쌍.
 *
 * @param entityKind 엔티티 종류
 * @param action 동작
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public record GuardBinding(EntityKind entityKind, Action action) {

    public GuardBinding {
        if (entityKind == null) {
            throw new IllegalArgumentException("entityKind cannot be null");
        }
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
    }

    public static GuardBinding of(EntityKind entityKind, Action action) {
        return new GuardBinding(entityKind, action);
    }

    @Override
    public String toString() {
        return entityKind + "/" + action;
    }
}
