/**
 * Exceptions raised while configuring lifecycles.
 *
 * <p>Ordinary domain rejections (structurally illegal moves, guard denials, lost races)
 * are never thrown; they are values of
 * {@link com.ryuqq.lifecycle.core.result.TransitionResult}. Only
 * {@link com.ryuqq.lifecycle.core.exception.ConfigurationException} is thrown, and only
 * at configuration time.</p>
 *
 * @since 1.0.0
 * @author Lifecycle Team
 */
package com.ryuqq.lifecycle.core.exception;
