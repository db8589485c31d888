/**
 * Guard, guard chain and guard registry package.
 *
 * <p>This package implements the semantic half of a lifecycle: an ordered,
 * short-circuiting pipeline of independent checks that can each veto a transition.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.lifecycle.core.guard.Guard} - Single-responsibility predicate over a transition context</li>
 *   <li>{@link com.ryuqq.lifecycle.core.guard.GuardDecision} - Approve | Deny(reason)</li>
 *   <li>{@link com.ryuqq.lifecycle.core.guard.GuardChain} - Ordered, copy-on-write guard sequence</li>
 *   <li>{@link com.ryuqq.lifecycle.core.guard.ChainVerdict} - Approved | Denied(reason, guardName)</li>
 *   <li>{@link com.ryuqq.lifecycle.core.guard.GuardPosition} - Append, first, or explicit index</li>
 *   <li>{@link com.ryuqq.lifecycle.core.guard.GuardRegistry} - Chains per (entity kind, action) plus kind-wide chains</li>
 * </ul>
 *
 * <h2>Evaluation Rules</h2>
 * <pre>
 * [A, B, C] where B denies  → Denied(B.reason, "B"), C never evaluated
 * [A, B, C] all approve     → Approved
 * []                        → Approved
 * </pre>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Short-Circuit:</strong> Later guards are never evaluated after a denial</li>
 *   <li><strong>Snapshot Isolation:</strong> Each evaluation iterates an immutable snapshot</li>
 *   <li><strong>Explicit Dependencies:</strong> Guards declare the typed context keys they read</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Lifecycle Team
 */
package com.ryuqq.lifecycle.core.guard;
