package com.ryuqq.kernel.core.domain;

/**
 * Entity 식별자의 생애주기 상태.
 *
 * <p>생성 시점에 한 번 결정되며 이후 변하지 않습니다.</p>
 *
 * <pre>
 * create(props)      → NEW                 (식별자 생성됨)
 * create(props, id)  → PERSISTED_REFERENCE (식별자 전달됨)
 *
 * 금지된 전이:
 * - NEW → PERSISTED_REFERENCE ❌
 * - PERSISTED_REFERENCE → NEW ❌
 * </pre>
 *
 * @author Kernel Team
 * @since 1.0.0
 */
public enum IdentityState {

    /**
     * 처음 생성됨 (식별자를 생성기에서 발급).
     */
    NEW,

    /**
     * 기존 식별자로 재구성됨 (호출자가 식별자 전달).
     */
    PERSISTED_REFERENCE;

    public boolean isNew() {
        return this == NEW;
    }
}
