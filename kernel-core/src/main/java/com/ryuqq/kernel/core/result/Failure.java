package com.ryuqq.kernel.core.result;

import java.util.function.Function;

/**
 * 실패 결과.
 *
 * <p>유효성 검증 실패, 비즈니스 규칙 위반 등 도메인 실패를 값으로 나타냅니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>범위를 벗어난 값으로 Value Object 생성 시도</li>
 *   <li>정적 팩토리를 구현하지 않은 Aggregate 생성 시도</li>
 * </ul>
 *
 * @param error 오류 메시지
 * @param <T> payload 타입 (실패에서는 사용되지 않음)
 *
 * @author Kernel Team
 * @since 1.0.0
 */
public record Failure<T>(String error) implements Result<T> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException error가 null이거나 빈 문자열인 경우
     */
    public Failure {
        if (error == null || error.isBlank()) {
            throw new IllegalArgumentException("error message cannot be null or blank");
        }
    }

    /**
     * 실패 결과에는 payload가 없습니다.
     *
     * @throws IllegalStateException 항상
     */
    @Override
    public T value() {
        throw new IllegalStateException("value accessed on a failure result: " + error);
    }

    @Override
    public <U> Result<U> map(Function<? super T, ? extends U> mapper) {
        return new Failure<>(error);
    }

    @Override
    public <U> Result<U> flatMap(Function<? super T, Result<U>> mapper) {
        return new Failure<>(error);
    }
}
