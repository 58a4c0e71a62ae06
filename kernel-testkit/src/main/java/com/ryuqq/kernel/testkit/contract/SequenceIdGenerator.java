package com.ryuqq.kernel.testkit.contract;

import com.ryuqq.kernel.core.spi.IdGenerator;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Deterministic IdGenerator for tests.
 *
 * <p>Produces {@code prefix-1}, {@code prefix-2}, ... in call order. Thread-safe.</p>
 *
 * @author Kernel Team
 * @since 1.0.0
 */
public class SequenceIdGenerator implements IdGenerator {

    private final String prefix;
    private final AtomicLong sequence = new AtomicLong();

    /**
     * Creates a generator with the given prefix.
     *
     * @param prefix the id prefix (e.g., "user")
     * @throws IllegalArgumentException if prefix is null or blank
     */
    public SequenceIdGenerator(String prefix) {
        if (prefix == null || prefix.isBlank()) {
            throw new IllegalArgumentException("prefix cannot be null or blank");
        }
        this.prefix = prefix;
    }

    @Override
    public String nextId() {
        return prefix + "-" + sequence.incrementAndGet();
    }

    /**
     * Returns how many ids have been issued.
     *
     * @return issued id count
     */
    public long issued() {
        return sequence.get();
    }

    /**
     * Restarts the sequence at 1.
     */
    public void reset() {
        sequence.set(0);
    }
}
