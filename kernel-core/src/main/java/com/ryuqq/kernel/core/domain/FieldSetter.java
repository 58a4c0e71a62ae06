package com.ryuqq.kernel.core.domain;

/**
 * 특정 필드에 바인딩된 setter 핸들.
 *
 * <p>{@link #toValue(Object)}는 값을 대입하고 같은 Entity를 반환하여 호출 체이닝을 허용합니다.</p>
 *
 * <pre>
 * user.set(User.NAME).toValue("Anne").set(User.AGE).toValue(18);
 * </pre>
 *
 * @param <E> Entity 타입
 * @param <V> 필드 값 타입
 *
 * @author Kernel Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface FieldSetter<E, V> {

    /**
     * 필드에 값 대입.
     *
     * @param value 새 값 (Value Object 필드는 검증이 끝난 인스턴스)
     * @return 같은 Entity 인스턴스
     * @throws IllegalArgumentException 값의 타입이 필드와 맞지 않는 경우
     */
    E toValue(V value);
}
