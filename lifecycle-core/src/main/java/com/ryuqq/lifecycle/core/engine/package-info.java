/**
 * Lifecycle engine package.
 *
 * <p>This package ties the transition table and the guard chains together and owns the
 * only code path that changes an entity's state.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.lifecycle.core.engine.LifecycleEngine} - Validates, evaluates and commits transitions</li>
 *   <li>{@link com.ryuqq.lifecycle.core.engine.LifecycleEntity} - Entity holding exactly one current state</li>
 *   <li>{@link com.ryuqq.lifecycle.core.engine.TransitionListener} - Post-commit hook; failures are logged, never rolled back</li>
 * </ul>
 *
 * <h2>Request Flow</h2>
 * <pre>
 * caller → entity.requestTransition(action, attributes)
 *        → engine: table lookup      → absent  → Rejected(StructurallyIllegal)
 *        → engine: guard chain       → denied  → Rejected(GuardDenied(reason, guard))
 *        → engine: compare-and-set   → lost    → Rejected(ConcurrencyConflict)
 *                                    → won     → Committed(from, to) → listeners
 * </pre>
 *
 * @since 1.0.0
 * @author Lifecycle Team
 */
package com.ryuqq.lifecycle.core.engine;
