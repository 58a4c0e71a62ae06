/**
 * Default identifier generation.
 *
 * @since 1.0.0
 * @author Kernel Team
 */
package com.ryuqq.kernel.core.id;
