/**
 * Value objects identifying what a lifecycle is made of.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.lifecycle.core.model.EntityKind} - Kind of managed entity (binds a table and its guard chains)</li>
 *   <li>{@link com.ryuqq.lifecycle.core.model.State} - One member of a kind's closed set of lifecycle stages</li>
 *   <li>{@link com.ryuqq.lifecycle.core.model.Action} - A requested transition verb</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> All value objects are immutable and validated on creation</li>
 *   <li><strong>Value Semantics:</strong> Equality is based on the wrapped identifier</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Lifecycle Team
 */
package com.ryuqq.lifecycle.core.model;
