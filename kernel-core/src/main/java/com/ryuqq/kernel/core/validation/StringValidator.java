package com.ryuqq.kernel.core.validation;

import java.util.regex.Pattern;

/**
 * 문자열 제약 조건 검사.
 *
 * <p>검사 대상이 null이면 {@link #isEmpty()}만 true, 나머지 검사는 false를 반환합니다.</p>
 *
 * @author Kernel Team
 * @since 1.0.0
 */
public final class StringValidator {

    private final String value;

    StringValidator(String value) {
        this.value = value;
    }

    /**
     * null 또는 빈 문자열인지 확인.
     *
     * @return 비어있으면 true
     */
    public boolean isEmpty() {
        return value == null || value.isEmpty();
    }

    /**
     * 길이가 범위 안에 있는지 확인 (양 끝 포함).
     *
     * @param min 최소 길이
     * @param max 최대 길이
     * @return min &lt;= length &lt;= max 이면 true
     * @throws IllegalArgumentException min이 음수이거나 min &gt; max인 경우
     */
    public boolean hasLengthBetween(int min, int max) {
        if (min < 0) {
            throw new IllegalArgumentException("min must be non-negative (current: " + min + ")");
        }
        if (min > max) {
            throw new IllegalArgumentException("min cannot be greater than max (min: " + min + ", max: " + max + ")");
        }
        return value != null && value.length() >= min && value.length() <= max;
    }

    public boolean hasLengthGreaterThan(int length) {
        return value != null && value.length() > length;
    }

    public boolean hasLengthLessThan(int length) {
        return value != null && value.length() < length;
    }

    /**
     * 정규식 전체 일치 여부 확인.
     *
     * @param pattern 정규식
     * @return 전체 일치하면 true
     * @throws IllegalArgumentException pattern이 null인 경우
     */
    public boolean matches(Pattern pattern) {
        if (pattern == null) {
            throw new IllegalArgumentException("pattern cannot be null");
        }
        return value != null && pattern.matcher(value).matches();
    }

    /**
     * 정규식 전체 일치 여부 확인.
     *
     * @param regex 정규식 문자열
     * @return 전체 일치하면 true
     * @throws IllegalArgumentException regex가 null인 경우
     */
    public boolean matches(String regex) {
        if (regex == null) {
            throw new IllegalArgumentException("regex cannot be null");
        }
        return matches(Pattern.compile(regex));
    }
}
