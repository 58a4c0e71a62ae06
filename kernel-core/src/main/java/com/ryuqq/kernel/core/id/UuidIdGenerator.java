package com.ryuqq.kernel.core.id;

import com.ryuqq.kernel.core.spi.IdGenerator;

import java.util.UUID;

/**
 * UUID 기반 기본 식별자 생성기.
 *
 * <p>{@link UUID#randomUUID()}는 스레드 안전하므로 공유 인스턴스를 사용합니다.</p>
 *
 * @author Kernel Team
 * @since 1.0.0
 */
public final class UuidIdGenerator implements IdGenerator {

    private static final UuidIdGenerator INSTANCE = new UuidIdGenerator();

    private UuidIdGenerator() {
    }

    public static UuidIdGenerator getInstance() {
        return INSTANCE;
    }

    @Override
    public String nextId() {
        return UUID.randomUUID().toString();
    }
}
