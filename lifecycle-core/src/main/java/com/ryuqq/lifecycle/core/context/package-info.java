/**
 * Read-only data handed to guards and listeners.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.lifecycle.core.context.ContextKey} - Typed attribute key</li>
 *   <li>{@link com.ryuqq.lifecycle.core.context.Attributes} - Caller-built, immutable attribute bundle</li>
 *   <li>{@link com.ryuqq.lifecycle.core.context.TransitionContext} - Entity, action, from/to state and attributes of one request</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * ContextKey&lt;String&gt; ROLE = ContextKey.of("actorRole", String.class);
 *
 * Attributes attributes = Attributes.builder()
 *     .put(ROLE, "MODERATOR")
 *     .build();
 *
 * TransitionResult result = engine.requestTransition(article, Action.of("publish"), attributes);
 * </pre>
 *
 * @since 1.0.0
 * @author Lifecycle Team
 */
package com.ryuqq.lifecycle.core.context;
