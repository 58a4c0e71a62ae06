package com.ryuqq.kernel.core.domain;

import com.ryuqq.kernel.core.model.PropKey;
import com.ryuqq.kernel.core.model.Props;
import com.ryuqq.kernel.core.result.Result;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ValueObject 테스트.
 *
 * <p>검증된 생성, 필드 조회, 구조적 동등성을 확인합니다.</p>
 *
 * @author Kernel Team
 * @since 1.0.0
 */
class ValueObjectTest {

    static final class Age extends ValueObject {
        static final PropKey<Integer> VALUE = PropKey.of("value", Integer.class);

        private Age(Props props) {
            super(props);
        }

        static boolean isValidValue(Integer value) {
            return validator().number(value).isBetween(0, 130);
        }

        static Result<Age> create(Integer value) {
            if (!isValidValue(value)) return Result.fail("Invalid value");
            return Result.success(new Age(Props.of(VALUE, value)));
        }
    }

    static final class Height extends ValueObject {
        static final PropKey<Integer> VALUE = PropKey.of("value", Integer.class);

        private Height(Props props) {
            super(props);
        }

        static Result<Height> create(Integer value) {
            return Result.success(new Height(Props.of(VALUE, value)));
        }
    }

    static final class Person extends ValueObject {
        static final PropKey<String> NAME = PropKey.of("name", String.class);
        static final PropKey<Age> AGE = PropKey.of("age", Age.class);

        private Person(Props props) {
            super(props);
        }

        static Result<Person> create(String name, Age age) {
            if (validator().string(name).isEmpty()) return Result.fail("Name is required");
            if (validator().isNull(age)) return Result.fail("Age is required");
            return Result.success(new Person(Props.of(NAME, name, AGE, age)));
        }
    }

    static final class Tags extends ValueObject {
        static final PropKey<String[]> VALUES = PropKey.of("values", String[].class);

        private Tags(Props props) {
            super(props);
        }

        static Result<Tags> create(String[] values) {
            if (validator().isNull(values)) return Result.fail("Tags are required");
            return Result.success(new Tags(Props.of(VALUES, values)));
        }
    }

    // ============================================================
    // 1. 검증된 생성
    // ============================================================

    @Test
    void isValidValue_NegativeValue_ReturnsFalse() {
        assertFalse(Age.isValidValue(-1));
    }

    @Test
    void isValidValue_AboveUpperBound_ReturnsFalse() {
        assertFalse(Age.isValidValue(131));
    }

    @Test
    void isValidValue_InsideRange_ReturnsTrue() {
        assertTrue(Age.isValidValue(0));
        assertTrue(Age.isValidValue(1));
        assertTrue(Age.isValidValue(129));
        assertTrue(Age.isValidValue(130));
    }

    @Test
    void create_ValidValue_ReturnsSuccessWithField() {
        // When
        Result<Age> result = Age.create(21);

        // Then
        assertTrue(result.isSuccess());
        assertEquals(21, result.value().get(Age.VALUE));
        assertEquals(21, result.value().get("value"));
    }

    @Test
    void create_InvalidValue_ReturnsFailure() {
        // When
        Result<Age> result = Age.create(200);

        // Then
        assertTrue(result.isFailure());
        assertEquals("Invalid value", result.error());
        assertThrows(IllegalStateException.class, result::value);
    }

    @Test
    void get_UnknownField_ThrowsException() {
        // Given
        Age age = Age.create(21).value();

        // When & Then
        assertThrows(IllegalArgumentException.class, () -> age.get("years"));
    }

    @Test
    void get_NestedValueObject_CanBeChained() {
        // Given
        Person person = Person.create("Jane Doe", Age.create(21).value()).value();

        // When
        Integer age = person.get(Person.AGE).get(Age.VALUE);

        // Then
        assertEquals(21, age);
    }

    @Test
    void constructor_NullProps_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new Age(null));
    }

    // ============================================================
    // 2. 구조적 동등성
    // ============================================================

    @Test
    void equals_SameProps_ReturnsTrue() {
        // Given
        Age first = Age.create(21).value();
        Age second = Age.create(21).value();

        // When & Then
        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
        assertNotSame(first, second);
    }

    @Test
    void equals_DifferentProps_ReturnsFalse() {
        assertNotEquals(Age.create(21).value(), Age.create(22).value());
    }

    @Test
    void equals_DifferentConcreteType_ReturnsFalse() {
        // Given: 같은 필드, 다른 타입
        Age age = Age.create(21).value();
        Height height = Height.create(21).value();

        // When & Then
        assertEquals(age.props(), height.props());
        assertNotEquals(age, height);
    }

    @Test
    void equals_NestedValueObjects_ComparedRecursively() {
        // Given
        Person first = Person.create("Jane Doe", Age.create(21).value()).value();
        Person second = Person.create("Jane Doe", Age.create(21).value()).value();
        Person older = Person.create("Jane Doe", Age.create(22).value()).value();

        // When & Then
        assertEquals(first, second);
        assertNotEquals(first, older);
    }

    @Test
    void toString_ContainsTypeAndFields() {
        // When
        String result = Age.create(21).value().toString();

        // Then
        assertEquals("Age{value=21}", result);
    }

    // ============================================================
    // 3. 불변성
    // ============================================================

    @Test
    void create_ArrayField_IsIsolatedFromCallerMutation() {
        // Given
        String[] input = {"a", "b"};
        Tags tags = Tags.create(input).value();
        Set<Tags> set = new HashSet<>();
        set.add(tags);

        // When
        input[0] = "zzz";
        tags.get(Tags.VALUES)[1] = "yyy";

        // Then
        assertArrayEquals(new String[]{"a", "b"}, tags.get(Tags.VALUES));
        assertEquals(Tags.create(new String[]{"a", "b"}).value(), tags);
        assertTrue(set.contains(tags));
    }
}
