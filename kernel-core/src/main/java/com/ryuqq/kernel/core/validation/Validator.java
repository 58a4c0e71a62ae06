package com.ryuqq.kernel.core.validation;

/**
 * 원시 값 제약 조건 검사기.
 *
 * <p>Value Object와 Aggregate의 정적 팩토리 내부에서 불변식을 검사할 때 사용합니다.
 * 각 검사는 {@code boolean}을 반환하며, 검사 결과를 {@code Result.fail(...)}로
 * 변환하는 것은 호출자의 책임입니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Validator.getInstance().number(age).isBetween(0, 130);
 * Validator.getInstance().string(email).hasLengthBetween(3, 254);
 * </pre>
 *
 * <p><strong>무상태:</strong> 인스턴스 상태가 없으므로 스레드 간 공유해도 안전합니다.</p>
 *
 * @author Kernel Team
 * @since 1.0.0
 */
public final class Validator {

    private static final Validator INSTANCE = new Validator();

    private Validator() {
    }

    /**
     * 공유 인스턴스 조회.
     *
     * @return Validator 인스턴스
     */
    public static Validator getInstance() {
        return INSTANCE;
    }

    /**
     * 숫자 검사기 생성.
     *
     * @param value 검사 대상 (null 허용, 이 경우 모든 검사가 false)
     * @return NumberValidator
     */
    public NumberValidator number(Number value) {
        return new NumberValidator(value);
    }

    /**
     * 문자열 검사기 생성.
     *
     * @param value 검사 대상 (null 허용)
     * @return StringValidator
     */
    public StringValidator string(String value) {
        return new StringValidator(value);
    }

    /**
     * 값이 null인지 확인.
     *
     * @param value 검사 대상
     * @return null이면 true
     */
    public boolean isNull(Object value) {
        return value == null;
    }

    /**
     * 값이 존재하는지 확인.
     *
     * @param value 검사 대상
     * @return null이 아니면 true
     */
    public boolean isDefined(Object value) {
        return value != null;
    }
}
