/**
 * Reusable contract tests for domain types built on the kernel.
 *
 * <h2>Contracts</h2>
 * <ul>
 *   <li>{@link com.ryuqq.kernel.testkit.contract.AbstractValueObjectContractTest} - Validated construction, structural equality</li>
 *   <li>{@link com.ryuqq.kernel.testkit.contract.AbstractAggregateContractTest} - Identity assignment, identity equality, mutation</li>
 * </ul>
 *
 * <h2>Test Doubles</h2>
 * <ul>
 *   <li>{@link com.ryuqq.kernel.testkit.contract.SequenceIdGenerator} - Deterministic identifiers</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Kernel Team
 */
package com.ryuqq.kernel.testkit.contract;
