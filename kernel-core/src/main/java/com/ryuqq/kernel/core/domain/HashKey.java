package com.ryuqq.kernel.core.domain;

/**
 * Entity의 표준 표시 문자열.
 *
 * <p>형식: {@code "[<표시 이름>@]:<식별자>"} (예: {@code [User@]:8b51a5a2-...}).
 * 로깅과 식별 비교용이며 암호학적 다이제스트가 아닙니다.</p>
 *
 * @param value 표시 문자열
 *
 * @author Kernel Team
 * @since 1.0.0
 */
public record HashKey(String value) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException value가 null이거나 빈 문자열인 경우
     */
    public HashKey {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("value cannot be null or blank");
        }
    }

    /**
     * 표시 이름과 식별자로 HashKey 생성.
     *
     * @param displayName 표시 이름 (빈 문자열 허용)
     * @param id 식별자
     * @return HashKey 인스턴스
     */
    public static HashKey of(String displayName, String id) {
        return new HashKey("[" + (displayName == null ? "" : displayName) + "@]:" + id);
    }
}
