package com.ryuqq.kernel.core.domain;

import com.ryuqq.kernel.core.model.PropKey;
import com.ryuqq.kernel.core.model.Props;
import com.ryuqq.kernel.core.validation.Validator;

/**
 * 내용으로 비교되는 불변 도메인 객체.
 *
 * <p>Value Object는 식별자가 없으며, 같은 구체 타입이고 모든 필드가 구조적으로 같으면 동등합니다.
 * 값을 "변경"하려면 정적 팩토리로 새 인스턴스를 만들어야 합니다.</p>
 *
 * <p><strong>하위 클래스 계약:</strong></p>
 * <ul>
 *   <li>생성자는 private (외부에서 직접 생성 불가)</li>
 *   <li>{@code public static Result<구체타입> create(...)} 제공</li>
 *   <li>create는 입력을 검증하고, 실패 시 인스턴스를 만들지 않고 {@code Result.fail(...)} 반환</li>
 * </ul>
 *
 * <p><strong>구현 예시:</strong></p>
 * <pre>
 * public final class Age extends ValueObject {
 *     public static final PropKey&lt;Integer&gt; VALUE = PropKey.of("value", Integer.class);
 *
 *     private Age(Props props) {
 *         super(props);
 *     }
 *
 *     public static boolean isValidValue(Integer value) {
 *         return validator().number(value).isBetween(0, 130);
 *     }
 *
 *     public static Result&lt;Age&gt; create(Integer value) {
 *         if (!isValidValue(value)) return Result.fail("Invalid value");
 *         return Result.success(new Age(Props.of(VALUE, value)));
 *     }
 * }
 * </pre>
 *
 * <p><strong>스레드 안전:</strong> 생성 후 불변이므로 동기화 없이 공유 가능합니다.</p>
 *
 * @author Kernel Team
 * @since 1.0.0
 */
public abstract class ValueObject {

    private final Props props;

    /**
     * 생성자 (하위 클래스의 검증된 팩토리에서만 호출).
     *
     * @param props payload
     * @throws IllegalArgumentException props가 null인 경우
     */
    protected ValueObject(Props props) {
        if (props == null) {
            throw new IllegalArgumentException("props cannot be null");
        }
        this.props = props;
    }

    /**
     * 팩토리 내부 검증용 Validator.
     *
     * @return 공유 Validator
     */
    protected static Validator validator() {
        return Validator.getInstance();
    }

    /**
     * 필드 값 조회.
     *
     * <p>필드가 Value Object이면 {@code get}을 이어서 호출할 수 있습니다.</p>
     *
     * @param key 필드 키
     * @param <T> 필드 값 타입
     * @return 필드 값
     * @throws IllegalArgumentException 선언되지 않은 필드인 경우
     */
    public <T> T get(PropKey<T> key) {
        return props.get(key);
    }

    /**
     * 이름으로 필드 값 조회.
     *
     * @param name 필드 이름
     * @return 필드 값
     * @throws IllegalArgumentException 선언되지 않은 필드인 경우
     */
    public Object get(String name) {
        return props.get(name);
    }

    /**
     * payload 조회 (불변).
     *
     * @return Props
     */
    public Props props() {
        return props;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ValueObject other = (ValueObject) o;
        return props.equals(other.props);
    }

    @Override
    public int hashCode() {
        return 31 * getClass().hashCode() + props.hashCode();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + props;
    }
}
