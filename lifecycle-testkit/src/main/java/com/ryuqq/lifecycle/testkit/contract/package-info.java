/**
 * Lifecycle Testkit - contract test infrastructure.
 *
 * <p>Provides a base class that starts a fresh lifecycle service with a reference
 * document lifecycle, plus test doubles for guards and post-commit listeners.</p>
 *
 * <h2>Fixtures</h2>
 * <ul>
 *   <li>{@link com.ryuqq.lifecycle.testkit.contract.AbstractLifecycleContractTest} - base class and assertions</li>
 *   <li>{@link com.ryuqq.lifecycle.testkit.contract.CountingGuard} - fixed-decision guard with a call counter</li>
 *   <li>{@link com.ryuqq.lifecycle.testkit.contract.RecordingListener} - recording (optionally failing) listener</li>
 *   <li>{@link com.ryuqq.lifecycle.testkit.contract.Document} - test entity</li>
 * </ul>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
package com.ryuqq.lifecycle.testkit.contract;
