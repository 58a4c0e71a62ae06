/**
 * Structured payload model shared by value objects and entities.
 *
 * <ul>
 *   <li>{@link com.ryuqq.kernel.core.model.PropKey} - Named, typed field key</li>
 *   <li>{@link com.ryuqq.kernel.core.model.Props} - Immutable closed mapping of keys to values</li>
 * </ul>
 *
 * <p>Keys are declared as constants on the owning domain type, so field access is checked
 * by the compiler per key. Access by field name is also available and is checked at runtime.</p>
 *
 * @since 1.0.0
 * @author Kernel Team
 */
package com.ryuqq.kernel.core.model;
