/**
 * Transition result package.
 *
 * <p>This package defines the sealed hierarchies returned by
 * {@link com.ryuqq.lifecycle.core.engine.LifecycleEngine#requestTransition}.</p>
 *
 * <h2>Result Cases</h2>
 * <ul>
 *   <li>{@link com.ryuqq.lifecycle.core.result.Committed} - Transition committed, entity state changed</li>
 *   <li>{@link com.ryuqq.lifecycle.core.result.Rejected} - Transition rejected, entity state unchanged</li>
 * </ul>
 *
 * <h2>Reject Kinds</h2>
 * <ul>
 *   <li>{@link com.ryuqq.lifecycle.core.result.StructurallyIllegal} - No rule for (state, action)</li>
 *   <li>{@link com.ryuqq.lifecycle.core.result.GuardDenied} - A named guard vetoed</li>
 *   <li>{@link com.ryuqq.lifecycle.core.result.ConcurrencyConflict} - Another commit won the race</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Values, not Exceptions:</strong> Domain rejections are returned, never thrown</li>
 *   <li><strong>Distinguishable:</strong> A structural rejection is never confused with a guard denial</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Lifecycle Team
 */
package com.ryuqq.lifecycle.core.result;
