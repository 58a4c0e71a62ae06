package com.ryuqq.kernel.core.domain;

import com.ryuqq.kernel.core.id.UuidIdGenerator;
import com.ryuqq.kernel.core.model.PropKey;
import com.ryuqq.kernel.core.model.Props;
import com.ryuqq.kernel.core.spi.IdGenerator;
import com.ryuqq.kernel.core.validation.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 식별자로 비교되는 가변 도메인 객체.
 *
 * <p>Entity는 구조화된 payload와 전역 고유 식별자를 가집니다.
 * 같은 구체 타입이고 식별자가 같으면 payload와 무관하게 동등합니다.</p>
 *
 * <p><strong>식별자 할당:</strong></p>
 * <ul>
 *   <li>식별자 전달: 그대로 사용, {@link #isNew()} = false ({@link IdentityState#PERSISTED_REFERENCE})</li>
 *   <li>식별자 생략(null): {@link IdGenerator}로 생성, {@link #isNew()} = true ({@link IdentityState#NEW})</li>
 *   <li>생성 후 식별자는 변경 불가</li>
 * </ul>
 *
 * <p><strong>필드 변경:</strong></p>
 * <pre>
 * user.set(User.AGE).toValue(18).set(User.NAME).toValue("Anne");
 * user.updateTo(User.AGE, 21).updateTo(User.NAME, "Louse");
 * </pre>
 *
 * <p><strong>스레드 안전:</strong> 내부 잠금이 없습니다. 한 인스턴스는 한 번에 하나의 호출자
 * (요청/트랜잭션)가 소유해야 하며, 동시 변경의 직렬화는 호출자의 책임입니다.</p>
 *
 * @param <E> 구체 Entity 타입 (체이닝 반환 타입)
 *
 * @author Kernel Team
 * @since 1.0.0
 */
public abstract class Entity<E extends Entity<E>> {

    private static final Logger log = LoggerFactory.getLogger(Entity.class);

    private final String id;
    private final IdentityState identityState;
    private Props props;

    /**
     * 기본 식별자 생성기({@link UuidIdGenerator})를 사용하는 생성자.
     *
     * @param props payload
     * @param id 식별자 (null이면 생성)
     * @throws IllegalArgumentException props가 null이거나 id가 빈 문자열인 경우
     */
    protected Entity(Props props, String id) {
        this(props, id, UuidIdGenerator.getInstance());
    }

    /**
     * 식별자 생성기를 지정하는 생성자.
     *
     * @param props payload
     * @param id 식별자 (null이면 idGenerator로 생성)
     * @param idGenerator 식별자 생성기
     * @throws IllegalArgumentException props 또는 idGenerator가 null이거나 id가 빈 문자열인 경우
     * @throws IllegalStateException idGenerator가 null 또는 빈 식별자를 반환한 경우
     */
    protected Entity(Props props, String id, IdGenerator idGenerator) {
        if (props == null) {
            throw new IllegalArgumentException("props cannot be null");
        }
        if (idGenerator == null) {
            throw new IllegalArgumentException("idGenerator cannot be null");
        }
        if (id == null) {
            String generated = idGenerator.nextId();
            if (generated == null || generated.isBlank()) {
                throw new IllegalStateException(
                    "IdGenerator returned a null or blank id (generator: " + idGenerator.getClass().getName() + ")"
                );
            }
            this.id = generated;
            this.identityState = IdentityState.NEW;
            log.debug("Generated id {} for {}", generated, getClass().getSimpleName());
        } else {
            if (id.isBlank()) {
                throw new IllegalArgumentException("id cannot be blank");
            }
            this.id = id;
            this.identityState = IdentityState.PERSISTED_REFERENCE;
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

    public String getId() {
        return id;
    }

    public IdentityState getIdentityState() {
        return identityState;
    }

    /**
     * 처음 생성된 Entity인지 확인.
     *
     * @return 식별자를 생성기에서 발급받았으면 true
     */
    public boolean isNew() {
        return identityState.isNew();
    }

    /**
     * 표준 표시 문자열 조회.
     *
     * @return {@code "[" + displayName() + "@]:" + id}
     */
    public HashKey hashKey() {
        return HashKey.of(displayName(), id);
    }

    /**
     * {@link #hashKey()}에 사용되는 표시 이름.
     *
     * <p>기본값은 구체 클래스의 단순 이름입니다. 빈 문자열을 반환하면 {@code "[@]:id"} 형식이 됩니다.</p>
     *
     * @return 표시 이름
     */
    protected String displayName() {
        return getClass().getSimpleName();
    }

    /**
     * 필드 값 조회.
     *
     * @param key 필드 키
     * @param <V> 필드 값 타입
     * @return 현재 필드 값
     * @throws IllegalArgumentException 선언되지 않은 필드인 경우
     */
    public <V> V get(PropKey<V> key) {
        return props.get(key);
    }

    /**
     * 이름으로 필드 값 조회.
     *
     * @param name 필드 이름
     * @return 현재 필드 값
     * @throws IllegalArgumentException 선언되지 않은 필드인 경우
     */
    public Object get(String name) {
        return props.get(name);
    }

    /**
     * 현재 payload 스냅샷 조회 (불변).
     *
     * @return Props
     */
    public Props props() {
        return props;
    }

    /**
     * 필드에 바인딩된 setter 조회.
     *
     * @param key 필드 키
     * @param <V> 필드 값 타입
     * @return setter 핸들
     * @throws IllegalArgumentException 선언되지 않은 필드인 경우
     */
    public <V> FieldSetter<E, V> set(PropKey<V> key) {
        props.requireDeclared(key);
        return value -> assign(key, value);
    }

    /**
     * 이름으로 필드에 바인딩된 setter 조회.
     *
     * <p>값의 타입은 대입 시점에 검증됩니다.</p>
     *
     * @param name 필드 이름
     * @return setter 핸들
     * @throws IllegalArgumentException 선언되지 않은 필드인 경우
     */
    public FieldSetter<E, Object> set(String name) {
        props.keyOf(name);
        return value -> assign(name, value);
    }

    /**
     * {@code set(key).toValue(value)}의 축약형.
     *
     * @return 같은 Entity 인스턴스
     */
    public <V> E updateTo(PropKey<V> key, V value) {
        return set(key).toValue(value);
    }

    /**
     * {@code set(name).toValue(value)}의 축약형.
     *
     * @return 같은 Entity 인스턴스
     */
    public E updateTo(String name, Object value) {
        return set(name).toValue(value);
    }

    private <V> E assign(PropKey<V> key, V value) {
        props = props.with(key, value);
        log.debug("Entity {} field [{}] updated", id, key.getName());
        return self();
    }

    private E assign(String name, Object value) {
        props = props.with(name, value);
        log.debug("Entity {} field [{}] updated", id, name);
        return self();
    }

    private E self() {
        return (E) this;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Entity<?> other = (Entity<?>) o;
        return id.equals(other.id);
    }

    @Override
    public int hashCode() {
        return 31 * getClass().hashCode() + id.hashCode();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{id=" + id + ", props=" + props + '}';
    }
}
