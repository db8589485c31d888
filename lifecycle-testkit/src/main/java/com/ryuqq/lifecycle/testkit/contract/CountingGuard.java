package com.ryuqq.lifecycle.testkit.contract;

import com.ryuqq.lifecycle.core.context.TransitionContext;
import com.ryuqq.lifecycle.core.guard.Guard;
import com.ryuqq.lifecycle.core.guard.GuardDecision;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Guard with a fixed decision that counts its invocations.
 *
 * <p>Used to observe short-circuiting: a guard placed after a denying guard
 * must report {@code callCount() == 0}.</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public final class CountingGuard implements Guard {

    private final String name;
    private final GuardDecision decision;
    private final AtomicInteger calls = new AtomicInteger();
    private final AtomicReference<TransitionContext> lastContext = new AtomicReference<>();

    private CountingGuard(String name, GuardDecision decision) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        this.name = name;
        this.decision = decision;
    }

    /**
     * Creates a guard that always approves.
     *
     * @param name the guard name
     * @return a new approving guard
     */
    public static CountingGuard approving(String name) {
        return new CountingGuard(name, GuardDecision.approve());
    }

    /**
     * Creates a guard that always denies.
     *
     * @param name the guard name
     * @param reason the denial reason
     * @return a new denying guard
     */
    public static CountingGuard denying(String name, String reason) {
        return new CountingGuard(name, GuardDecision.deny(reason));
    }

    @Override
    public GuardDecision evaluate(TransitionContext context) {
        calls.incrementAndGet();
        lastContext.set(context);
        return decision;
    }

    @Override
    public String name() {
        return name;
    }

    public int callCount() {
        return calls.get();
    }

    public boolean wasInvoked() {
        return calls.get() > 0;
    }

    /**
     * Returns the context of the most recent evaluation.
     *
     * @return the last context, or null if never invoked
     */
    public TransitionContext lastContext() {
        return lastContext.get();
    }

    public void reset() {
        calls.set(0);
        lastContext.set(null);
    }

    @Override
    public String toString() {
        return "CountingGuard{" + name + ", " + decision + ", calls=" + calls.get() + '}';
    }
}
