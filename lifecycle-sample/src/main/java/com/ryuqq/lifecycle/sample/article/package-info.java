/**
 * Article publishing lifecycle.
 *
 * <p>Draft → Moderation → Published, gated by a content check on submission
 * and a role check on publication.</p>
 *
 * @since 1.0.0
 * @author Lifecycle Team
 */
package com.ryuqq.lifecycle.sample.article;
