package com.ryuqq.kernel.core.model;

/**
 * {@link Props}의 필드를 가리키는 타입 지정 키.
 *
 * <p>도메인 타입은 자신의 필드를 {@code public static final} 상수로 선언합니다.
 * {@code get}/{@code set}은 키의 타입 파라미터를 따르므로, 필드별 값 타입이 컴파일 타임에 검증됩니다.</p>
 *
 * <pre>
 * public static final PropKey&lt;Integer&gt; VALUE = PropKey.of("value", Integer.class);
 * </pre>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>name: null 또는 빈 문자열 불가</li>
 *   <li>type: null 불가, 원시 타입 불가 (래퍼 타입 사용)</li>
 * </ul>
 *
 * @param <V> 필드 값 타입
 *
 * @author Kernel Team
 * @since 1.0.0
 */
public final class PropKey<V> {

    private final String name;
    private final Class<V> type;

    private PropKey(String name, Class<V> type) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("PropKey name cannot be null or blank");
        }
        if (type == null) {
            throw new IllegalArgumentException("PropKey type cannot be null (name: " + name + ")");
        }
        if (type.isPrimitive()) {
            throw new IllegalArgumentException(
                "PropKey type cannot be primitive, use the wrapper type (name: " + name + ", type: " + type + ")"
            );
        }
        this.name = name;
        this.type = type;
    }

    /**
     * PropKey 생성.
     *
     * @param name 필드 이름
     * @param type 필드 값 타입
     * @param <V> 필드 값 타입
     * @return PropKey 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static <V> PropKey<V> of(String name, Class<V> type) {
        return new PropKey<>(name, type);
    }

    public String getName() {
        return name;
    }

    public Class<V> getType() {
        return type;
    }

    /**
     * 값이 이 키의 타입과 호환되는지 확인.
     *
     * @param value 검사 대상 (null은 항상 호환)
     * @return 호환되면 true
     */
    public boolean accepts(Object value) {
        return value == null || type.isInstance(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PropKey<?> other = (PropKey<?>) o;
        return name.equals(other.name) && type.equals(other.type);
    }

    @Override
    public int hashCode() {
        return 31 * name.hashCode() + type.hashCode();
    }

    @Override
    public String toString() {
        return "PropKey{" + name + ": " + type.getSimpleName() + '}';
    }
}
