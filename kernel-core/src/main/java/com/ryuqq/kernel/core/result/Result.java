package com.ryuqq.kernel.core.result;

import java.util.function.Function;

/**
 * 실패 가능한 연산의 명시적 결과.
 *
 * <p>Result는 두 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Success}: 성공, payload 보유</li>
 *   <li>{@link Failure}: 실패, 오류 메시지 보유</li>
 * </ul>
 *
 * <p>도메인 규칙 위반(유효하지 않은 생성 입력 등)은 예외가 아니라
 * {@link #fail(String)}로 표현됩니다. 호출자는 {@link #isSuccess()} 또는
 * {@link #isFailure()}로 확인한 뒤에만 {@link #value()} / {@link #error()}를 호출해야 합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Result&lt;Age&gt; result = Age.create(21);
 * if (result.isFailure()) {
 *     return Result.fail(result.error());
 * }
 * Age age = result.value();
 * </pre>
 *
 * @param <T> payload 타입
 *
 * @author Kernel Team
 * @since 1.0.0
 */
public sealed interface Result<T> permits Success, Failure {

    /**
     * 성공 결과 생성.
     *
     * @param value payload (null 허용)
     * @param <T> payload 타입
     * @return Success 인스턴스
     */
    static <T> Result<T> success(T value) {
        return new Success<>(value);
    }

    /**
     * payload 없는 성공 결과 생성.
     *
     * @return Success 인스턴스 (payload null)
     */
    static Result<Void> ok() {
        return new Success<>(null);
    }

    /**
     * 실패 결과 생성.
     *
     * @param message 오류 메시지
     * @param <T> payload 타입
     * @return Failure 인스턴스
     * @throws IllegalArgumentException message가 null이거나 빈 문자열인 경우
     */
    static <T> Result<T> fail(String message) {
        return new Failure<>(message);
    }

    /**
     * 여러 결과를 하나로 결합.
     *
     * <p>첫 번째 실패를 그대로 전달하고, 모두 성공이면 {@link #ok()}를 반환합니다.</p>
     *
     * @param results 결합할 결과들
     * @return 첫 번째 실패 또는 ok
     * @throws IllegalArgumentException results 또는 원소가 null인 경우
     */
    static Result<Void> combine(Result<?>... results) {
        if (results == null) {
            throw new IllegalArgumentException("results cannot be null");
        }
        for (Result<?> result : results) {
            if (result == null) {
                throw new IllegalArgumentException("results cannot contain null");
            }
            if (result.isFailure()) {
                return fail(result.error());
            }
        }
        return ok();
    }

    /**
     * 결과가 성공인지 확인.
     *
     * @return 성공 여부
     */
    default boolean isSuccess() {
        return this instanceof Success;
    }

    /**
     * 결과가 실패인지 확인.
     *
     * @return 실패 여부
     */
    default boolean isFailure() {
        return this instanceof Failure;
    }

    /**
     * 성공 payload 조회.
     *
     * @return payload
     * @throws IllegalStateException 실패 결과에서 호출한 경우
     */
    T value();

    /**
     * 실패 메시지 조회.
     *
     * @return 오류 메시지
     * @throws IllegalStateException 성공 결과에서 호출한 경우
     */
    String error();

    /**
     * 성공 payload 변환. 실패는 그대로 전달됩니다.
     *
     * @param mapper 변환 함수
     * @param <U> 변환 후 타입
     * @return 변환된 결과
     */
    <U> Result<U> map(Function<? super T, ? extends U> mapper);

    /**
     * 성공 payload로 다음 연산을 연결. 실패는 그대로 전달됩니다.
     *
     * @param mapper 다음 연산
     * @param <U> 다음 연산의 payload 타입
     * @return 다음 연산의 결과
     */
    <U> Result<U> flatMap(Function<? super T, Result<U>> mapper);

    /**
     * 성공이면 payload, 실패면 대체값 반환.
     *
     * @param other 대체값
     * @return payload 또는 other
     */
    default T orElse(T other) {
        return isSuccess() ? value() : other;
    }
}
