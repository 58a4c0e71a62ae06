package com.ryuqq.kernel.core.model;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 도메인 객체의 구조화된 payload.
 *
 * <p>Props는 이름이 지정된 필드({@link PropKey})와 값의 닫힌 매핑입니다.
 * 값은 원시 래퍼, 문자열, 또는 다른 Value Object일 수 있습니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가. {@link #with(PropKey, Object)}는 새 인스턴스를 반환합니다.
 * 배열 값은 저장 시와 조회 시 복사되고, 필드 타입이 {@code List}/{@code Set}/{@code Map}/{@code Collection}이면
 * 수정 불가 복사본으로 저장됩니다.</p>
 * <p><strong>닫힌 매핑:</strong> 생성 시 선언되지 않은 필드의 조회/변경은 {@link IllegalArgumentException}을 발생시킵니다.</p>
 * <p><strong>동등성:</strong> 모든 필드 값이 구조적으로 같으면 동등 (중첩 Value Object 포함, 재귀적 비교).</p>
 *
 * @author Kernel Team
 * @since 1.0.0
 */
public final class Props {

    private static final Props EMPTY = new Props(new LinkedHashMap<>(), new LinkedHashMap<>());

    private final Map<String, PropKey<?>> keys;
    private final Map<String, Object> values;

    private Props(LinkedHashMap<String, PropKey<?>> keys, LinkedHashMap<String, Object> values) {
        this.keys = Collections.unmodifiableMap(keys);
        this.values = Collections.unmodifiableMap(values);
    }

    /**
     * 빈 Props 조회.
     *
     * @return 필드가 없는 Props
     */
    public static Props empty() {
        return EMPTY;
    }

    public static <A> Props of(PropKey<A> key, A value) {
        return builder().put(key, value).build();
    }

    public static <A, B> Props of(PropKey<A> key1, A value1, PropKey<B> key2, B value2) {
        return builder().put(key1, value1).put(key2, value2).build();
    }

    public static <A, B, C> Props of(PropKey<A> key1, A value1, PropKey<B> key2, B value2, PropKey<C> key3, C value3) {
        return builder().put(key1, value1).put(key2, value2).put(key3, value3).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 필드 값 조회.
     *
     * @param key 필드 키
     * @param <V> 필드 값 타입
     * @return 필드 값 (null 가능)
     * @throws IllegalArgumentException 선언되지 않은 필드이거나 타입이 다른 경우
     */
    public <V> V get(PropKey<V> key) {
        requireDeclared(key);
        return key.getType().cast(copyIfArray(values.get(key.getName())));
    }

    /**
     * 이름으로 필드 값 조회.
     *
     * @param name 필드 이름
     * @return 필드 값 (null 가능)
     * @throws IllegalArgumentException 선언되지 않은 필드인 경우
     */
    public Object get(String name) {
        keyOf(name);
        return copyIfArray(values.get(name));
    }

    /**
     * 필드 하나만 변경한 새 인스턴스 생성.
     *
     * @param key 필드 키
     * @param value 새 값 (null 허용)
     * @param <V> 필드 값 타입
     * @return 새 Props
     * @throws IllegalArgumentException 선언되지 않은 필드이거나 값의 타입이 맞지 않는 경우
     */
    public <V> Props with(PropKey<V> key, V value) {
        requireDeclared(key);
        requireAccepted(key, value);
        LinkedHashMap<String, Object> copy = new LinkedHashMap<>(values);
        copy.put(key.getName(), freeze(key, value));
        return new Props(new LinkedHashMap<>(keys), copy);
    }

    /**
     * 이름으로 필드 하나만 변경한 새 인스턴스 생성.
     *
     * @param name 필드 이름
     * @param value 새 값 (null 허용)
     * @return 새 Props
     * @throws IllegalArgumentException 선언되지 않은 필드이거나 값의 타입이 맞지 않는 경우
     */
    public Props with(String name, Object value) {
        PropKey<?> key = keyOf(name);
        requireAccepted(key, value);
        LinkedHashMap<String, Object> copy = new LinkedHashMap<>(values);
        copy.put(name, freeze(key, value));
        return new Props(new LinkedHashMap<>(keys), copy);
    }

    /**
     * 이름에 해당하는 키 조회.
     *
     * @param name 필드 이름
     * @return 필드 키
     * @throws IllegalArgumentException 선언되지 않은 필드인 경우
     */
    public PropKey<?> keyOf(String name) {
        if (name == null) {
            throw new IllegalArgumentException("field name cannot be null");
        }
        PropKey<?> key = keys.get(name);
        if (key == null) {
            throw new IllegalArgumentException("Unknown field [" + name + "] (declared: " + keys.keySet() + ")");
        }
        return key;
    }

    public boolean has(String name) {
        return name != null && keys.containsKey(name);
    }

    public boolean has(PropKey<?> key) {
        return key != null && key.equals(keys.get(key.getName()));
    }

    /**
     * 선언된 키 목록 (선언 순서).
     *
     * @return 수정 불가 목록
     */
    public List<PropKey<?>> keys() {
        return Collections.unmodifiableList(new ArrayList<>(keys.values()));
    }

    public int size() {
        return keys.size();
    }

    public boolean isEmpty() {
        return keys.isEmpty();
    }

    /**
     * 키가 이 Props에 같은 타입으로 선언되어 있는지 검증.
     *
     * @param key 필드 키
     * @throws IllegalArgumentException key가 null이거나, 선언되지 않았거나, 타입이 다른 경우
     */
    public void requireDeclared(PropKey<?> key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        PropKey<?> declared = keyOf(key.getName());
        if (!declared.equals(key)) {
            throw new IllegalArgumentException(
                "Field [" + key.getName() + "] is declared as " + declared.getType().getSimpleName()
                    + ", not " + key.getType().getSimpleName()
            );
        }
    }

    private static void requireAccepted(PropKey<?> key, Object value) {
        if (!key.accepts(value)) {
            throw new IllegalArgumentException(
                "Field [" + key.getName() + "] expects " + key.getType().getSimpleName()
                    + " (current: " + value.getClass().getSimpleName() + ")"
            );
        }
    }

    /**
     * 저장용 복사본 생성.
     *
     * <p>배열은 중첩 배열까지 복사합니다. 컬렉션은 필드 타입이 인터페이스({@code List}, {@code Set},
     * {@code Map}, {@code Collection})일 때만 수정 불가 복사본으로 바꿉니다 (구체 타입 필드는 그대로 저장).</p>
     */
    private static Object freeze(PropKey<?> key, Object value) {
        if (value == null) {
            return null;
        }
        if (value.getClass().isArray()) {
            return copyArray(value);
        }
        Class<?> type = key.getType();
        if (type == List.class && value instanceof List) {
            return Collections.unmodifiableList(new ArrayList<>((List<?>) value));
        }
        if (type == Set.class && value instanceof Set) {
            return Collections.unmodifiableSet(new LinkedHashSet<>((Set<?>) value));
        }
        if (type == Map.class && value instanceof Map) {
            return Collections.unmodifiableMap(new LinkedHashMap<>((Map<?, ?>) value));
        }
        if (type == Collection.class && value instanceof Collection) {
            return Collections.unmodifiableList(new ArrayList<>((Collection<?>) value));
        }
        return value;
    }

    private static Object copyIfArray(Object value) {
        return value != null && value.getClass().isArray() ? copyArray(value) : value;
    }

    private static Object copyArray(Object array) {
        int length = Array.getLength(array);
        Object copy = Array.newInstance(array.getClass().getComponentType(), length);
        for (int i = 0; i < length; i++) {
            Array.set(copy, i, copyIfArray(Array.get(array, i)));
        }
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Props other = (Props) o;
        if (!keys.equals(other.keys)) return false;
        for (String name : keys.keySet()) {
            if (!Objects.deepEquals(values.get(name), other.values.get(name))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int result = keys.hashCode();
        for (String name : keys.keySet()) {
            result = 31 * result + Arrays.deepHashCode(new Object[]{values.get(name)});
        }
        return result;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        for (String name : keys.keySet()) {
            if (sb.length() > 1) {
                sb.append(", ");
            }
            Object value = values.get(name);
            sb.append(name).append('=').append(value instanceof Object[] ? Arrays.deepToString((Object[]) value) : value);
        }
        return sb.append('}').toString();
    }

    /**
     * Props 빌더.
     *
     * <p>필드 이름은 중복될 수 없습니다.</p>
     */
    public static final class Builder {

        private final LinkedHashMap<String, PropKey<?>> keys = new LinkedHashMap<>();
        private final LinkedHashMap<String, Object> values = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * 필드 추가.
         *
         * @throws IllegalArgumentException key가 null이거나, 이름이 중복되거나, 값의 타입이 맞지 않는 경우
         */
        public <V> Builder put(PropKey<V> key, V value) {
            if (key == null) {
                throw new IllegalArgumentException("key cannot be null");
            }
            if (keys.containsKey(key.getName())) {
                throw new IllegalArgumentException("Duplicate field [" + key.getName() + "]");
            }
            requireAccepted(key, value);
            keys.put(key.getName(), key);
            values.put(key.getName(), freeze(key, value));
            return this;
        }

        public Props build() {
            return new Props(new LinkedHashMap<>(keys), new LinkedHashMap<>(values));
        }
    }
}
