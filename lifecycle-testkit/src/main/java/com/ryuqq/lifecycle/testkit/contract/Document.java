package com.ryuqq.lifecycle.testkit.contract;

import com.ryuqq.lifecycle.core.engine.LifecycleEngine;
import com.ryuqq.lifecycle.core.engine.LifecycleEntity;
import com.ryuqq.lifecycle.core.model.State;

/**
 * Test entity following the reference document lifecycle.
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public final class Document extends LifecycleEntity {

    public Document(String id, State initialState, LifecycleEngine engine) {
        super(AbstractLifecycleContractTest.DOCUMENT, id, initialState, engine);
    }
}
