/**
 * Service Provider Interfaces of the kernel.
 *
 * <ul>
 *   <li>{@link com.ryuqq.kernel.core.spi.IdGenerator} - Source of globally unique entity identifiers</li>
 * </ul>
 *
 * <p>Implementations must be thread safe. The default is
 * {@link com.ryuqq.kernel.core.id.UuidIdGenerator}.</p>
 *
 * @since 1.0.0
 * @author Kernel Team
 */
package com.ryuqq.kernel.core.spi;
