package com.ryuqq.kernel.core.domain;

import com.ryuqq.kernel.core.model.Props;
import com.ryuqq.kernel.core.result.Result;
import com.ryuqq.kernel.core.spi.IdGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 일관성 경계를 이루는 루트 Entity.
 *
 * <p>동등성, 식별자, 필드 변경 규칙은 {@link Entity}와 같습니다.</p>
 *
 * <p><strong>하위 클래스 계약:</strong></p>
 * <ul>
 *   <li>생성자는 private</li>
 *   <li>{@code public static Result<구체타입> create(Props props[, String id])} 제공</li>
 * </ul>
 *
 * <p>하위 클래스가 자체 팩토리를 정의하지 않으면 상속된
 * {@link #create(Class, Props, String)}가 호출되어, 예외 대신 실패 결과로 계약 위반을 알립니다.</p>
 *
 * <pre>
 * public final class User extends Aggregate&lt;User&gt; {
 *     public static final PropKey&lt;Age&gt; AGE = PropKey.of("age", Age.class);
 *
 *     private User(Props props, String id) {
 *         super(props, id);
 *     }
 *
 *     public static Result&lt;User&gt; create(Props props, String id) {
 *         return Result.success(new User(props, id));
 *     }
 * }
 * </pre>
 *
 * @param <A> 구체 Aggregate 타입
 *
 * @author Kernel Team
 * @since 1.0.0
 */
public abstract class Aggregate<A extends Aggregate<A>> extends Entity<A> {

    private static final Logger log = LoggerFactory.getLogger(Aggregate.class);

    protected Aggregate(Props props, String id) {
        super(props, id);
    }

    protected Aggregate(Props props, String id, IdGenerator idGenerator) {
        super(props, id, idGenerator);
    }

    /**
     * 정적 팩토리를 정의하지 않은 하위 클래스용 기본 팩토리.
     *
     * @see #create(Class, Props, String)
     */
    public static <T extends Aggregate<?>> Result<T> create(Class<T> type, Props props) {
        return create(type, props, null);
    }

    /**
     * 정적 팩토리를 정의하지 않은 하위 클래스용 기본 팩토리.
     *
     * <p>인스턴스를 만들지 않고 항상 실패 결과를 반환합니다.</p>
     *
     * @param type 호출된 구체 Aggregate 타입
     * @param props 무시됨
     * @param id 무시됨
     * @return {@code "Static method [create] not implemented on aggregate " + 타입 이름} 실패
     * @throws IllegalArgumentException type이 null인 경우
     */
    public static <T extends Aggregate<?>> Result<T> create(Class<T> type, Props props, String id) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        log.debug("Default create reached for aggregate {}", type.getName());
        return Result.fail("Static method [create] not implemented on aggregate " + type.getSimpleName());
    }
}
