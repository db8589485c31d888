/**
 * Data-driven state machine package.
 *
 * <p>This package holds the structural half of a lifecycle: which actions are legal
 * from which states. It carries no behavior beyond lookups.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.lifecycle.core.statemachine.TransitionRule} - (fromState, action) → toState</li>
 *   <li>{@link com.ryuqq.lifecycle.core.statemachine.TransitionTable} - Immutable partial function over rules, one per entity kind</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * TransitionTable table = TransitionTable.builder(EntityKind.of("ARTICLE"))
 *     .rule(DRAFT, SUBMIT_FOR_REVIEW, MODERATION)
 *     .rule(MODERATION, PUBLISH, PUBLISHED)
 *     .build();
 *
 * Optional&lt;State&gt; next = table.allowedTransition(DRAFT, SUBMIT_FOR_REVIEW);
 *
 * // This will throw ConfigurationException
 * TransitionTable.builder(kind)
 *     .rule(DRAFT, SUBMIT_FOR_REVIEW, MODERATION)
 *     .rule(DRAFT, SUBMIT_FOR_REVIEW, PUBLISHED);
 * </pre>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Invariants:</strong> At most one rule per (fromState, action); absent pairs are illegal moves</li>
 *   <li><strong>Fail-Fast:</strong> Ambiguous tables are rejected while building, never at lookup time</li>
 *   <li><strong>Terminal States:</strong> A state without outgoing rules is terminal</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Lifecycle Team
 */
package com.ryuqq.lifecycle.core.statemachine;
