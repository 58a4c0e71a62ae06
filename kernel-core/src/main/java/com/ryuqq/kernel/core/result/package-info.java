/**
 * Explicit outcome type for fallible domain operations.
 *
 * <h2>Sealed Interface</h2>
 * <ul>
 *   <li>{@link com.ryuqq.kernel.core.result.Result} - Sealed interface (permits Success, Failure)</li>
 * </ul>
 *
 * <h2>Cases</h2>
 * <ul>
 *   <li>{@link com.ryuqq.kernel.core.result.Success} - Carries the payload</li>
 *   <li>{@link com.ryuqq.kernel.core.result.Failure} - Carries a non-blank error message</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * Result&lt;Age&gt; age = Age.create(21);
 * String text = age.isSuccess()
 *     ? "Age: " + age.value().get(Age.VALUE)
 *     : "Rejected: " + age.error();
 * </pre>
 *
 * <p>Domain rule violations travel as {@code Failure} values. Reading the wrong side of a
 * result is a programming error and raises {@link java.lang.IllegalStateException}.</p>
 *
 * @since 1.0.0
 * @author Kernel Team
 */
package com.ryuqq.kernel.core.result;
