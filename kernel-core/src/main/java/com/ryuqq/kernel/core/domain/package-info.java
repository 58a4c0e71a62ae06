/**
 * Domain object building blocks.
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.kernel.core.domain.ValueObject} - Immutable, compared by content</li>
 * </ul>
 *
 * <h2>Entities</h2>
 * <ul>
 *   <li>{@link com.ryuqq.kernel.core.domain.Entity} - Mutable per field, compared by identifier</li>
 *   <li>{@link com.ryuqq.kernel.core.domain.Aggregate} - Root entity with a default factory that reports a missing override</li>
 *   <li>{@link com.ryuqq.kernel.core.domain.IdentityState} - NEW or PERSISTED_REFERENCE, fixed at construction</li>
 *   <li>{@link com.ryuqq.kernel.core.domain.HashKey} - Canonical display string {@code [Type@]:id}</li>
 *   <li>{@link com.ryuqq.kernel.core.domain.FieldSetter} - Fluent setter handle bound to one field</li>
 * </ul>
 *
 * <h2>Construction Contract</h2>
 * <p>Concrete types keep their constructor private and expose a public static {@code create}
 * factory returning {@link com.ryuqq.kernel.core.result.Result}. Validation failures are returned,
 * never thrown.</p>
 *
 * @since 1.0.0
 * @author Kernel Team
 */
package com.ryuqq.kernel.core.domain;
