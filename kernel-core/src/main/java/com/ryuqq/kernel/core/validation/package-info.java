/**
 * Stateless boolean checks used inside validated factories.
 *
 * <ul>
 *   <li>{@link com.ryuqq.kernel.core.validation.Validator} - Entry point, shared instance</li>
 *   <li>{@link com.ryuqq.kernel.core.validation.NumberValidator} - Range and sign checks</li>
 *   <li>{@link com.ryuqq.kernel.core.validation.StringValidator} - Emptiness, length and pattern checks</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Kernel Team
 */
package com.ryuqq.kernel.core.validation;
