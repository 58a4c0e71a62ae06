package com.ryuqq.kernel.core.validation;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 숫자 제약 조건 검사.
 *
 * <p>정수 타입끼리는 {@code long}으로, 그 외에는 {@link BigDecimal}로 정확히 비교합니다.
 * 검사 대상이 null 또는 NaN이면 모든 검사가 false를 반환합니다. 경계값이 NaN이면 예외입니다.</p>
 *
 * @author Kernel Team
 * @since 1.0.0
 */
public final class NumberValidator {

    private final Number value;

    NumberValidator(Number value) {
        this.value = value;
    }

    /**
     * 값이 범위 안에 있는지 확인 (양 끝 포함).
     *
     * @param min 최솟값
     * @param max 최댓값
     * @return min &lt;= value &lt;= max 이면 true
     * @throws IllegalArgumentException min 또는 max가 null이거나 min &gt; max인 경우
     */
    public boolean isBetween(Number min, Number max) {
        if (min == null || max == null) {
            throw new IllegalArgumentException("Bounds cannot be null (min: " + min + ", max: " + max + ")");
        }
        requireNotNaN(min);
        requireNotNaN(max);
        if (compare(min, max) > 0) {
            throw new IllegalArgumentException("min cannot be greater than max (min: " + min + ", max: " + max + ")");
        }
        if (!isComparable()) {
            return false;
        }
        return compare(value, min) >= 0 && compare(value, max) <= 0;
    }

    /**
     * 값이 기준보다 큰지 확인.
     *
     * @param bound 기준값
     * @return value &gt; bound 이면 true
     */
    public boolean isGreaterThan(Number bound) {
        requireBound(bound);
        return isComparable() && compare(value, bound) > 0;
    }

    /**
     * 값이 기준보다 작은지 확인.
     *
     * @param bound 기준값
     * @return value &lt; bound 이면 true
     */
    public boolean isLessThan(Number bound) {
        requireBound(bound);
        return isComparable() && compare(value, bound) < 0;
    }

    public boolean isPositive() {
        return isComparable() && compare(value, 0) > 0;
    }

    public boolean isNegative() {
        return isComparable() && compare(value, 0) < 0;
    }

    public boolean isZero() {
        return isComparable() && compare(value, 0) == 0;
    }

    private boolean isComparable() {
        return value != null && !isNaN(value);
    }

    private static void requireBound(Number bound) {
        if (bound == null) {
            throw new IllegalArgumentException("bound cannot be null");
        }
        requireNotNaN(bound);
    }

    private static void requireNotNaN(Number bound) {
        if (isNaN(bound)) {
            throw new IllegalArgumentException("bound cannot be NaN");
        }
    }

    private static boolean isNaN(Number number) {
        return (number instanceof Double || number instanceof Float) && Double.isNaN(number.doubleValue());
    }

    static int compare(Number left, Number right) {
        if (isIntegral(left) && isIntegral(right)) {
            return Long.compare(left.longValue(), right.longValue());
        }
        if (isInfinite(left) || isInfinite(right)) {
            return Double.compare(left.doubleValue(), right.doubleValue());
        }
        return toBigDecimal(left).compareTo(toBigDecimal(right));
    }

    private static boolean isIntegral(Number number) {
        return number instanceof Integer
            || number instanceof Long
            || number instanceof Short
            || number instanceof Byte
            || number instanceof AtomicInteger
            || number instanceof AtomicLong;
    }

    private static boolean isInfinite(Number number) {
        return (number instanceof Double || number instanceof Float) && Double.isInfinite(number.doubleValue());
    }

    private static BigDecimal toBigDecimal(Number number) {
        if (number instanceof BigDecimal) {
            return (BigDecimal) number;
        }
        if (number instanceof BigInteger) {
            return new BigDecimal((BigInteger) number);
        }
        if (isIntegral(number)) {
            return BigDecimal.valueOf(number.longValue());
        }
        if (number instanceof Double) {
            return BigDecimal.valueOf(number.doubleValue());
        }
        if (number instanceof Float) {
            return new BigDecimal(number.toString());
        }
        try {
            return new BigDecimal(number.toString());
        } catch (NumberFormatException e) {
            return BigDecimal.valueOf(number.doubleValue());
        }
    }
}
