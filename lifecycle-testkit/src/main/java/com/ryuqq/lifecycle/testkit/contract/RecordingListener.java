package com.ryuqq.lifecycle.testkit.contract;

import com.ryuqq.lifecycle.core.context.TransitionContext;
import com.ryuqq.lifecycle.core.engine.TransitionListener;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Post-commit listener that records every committed transition.
 *
 * <p>A failing instance records the transition first and then throws,
 * which lets tests check that a listener failure does not roll back the commit.</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public final class RecordingListener implements TransitionListener {

    private final String name;
    private final boolean failing;
    private final List<TransitionContext> committed = new CopyOnWriteArrayList<>();

    private RecordingListener(String name, boolean failing) {
        this.name = name;
        this.failing = failing;
    }

    public static RecordingListener recording(String name) {
        return new RecordingListener(name, false);
    }

    public static RecordingListener failing(String name) {
        return new RecordingListener(name, true);
    }

    @Override
    public void onCommitted(TransitionContext context) {
        committed.add(context);
        if (failing) {
            throw new IllegalStateException(name + " failed on purpose");
        }
    }

    @Override
    public String name() {
        return name;
    }

    /**
     * Returns the recorded transitions in commit order.
     *
     * @return an immutable copy of the recorded contexts
     */
    public List<TransitionContext> committed() {
        return List.copyOf(committed);
    }

    public void clear() {
        committed.clear();
    }
}
