package com.ryuqq.kernel.core.result;

import java.util.function.Function;

/**
 * 성공 결과.
 *
 * @param value payload (null 허용, {@link Result#ok()} 참조)
 * @param <T> payload 타입
 *
 * @author Kernel Team
 * @since 1.0.0
 */
public record Success<T>(T value) implements Result<T> {

    /**
     * 성공 결과에는 오류 메시지가 없습니다.
     *
     * @throws IllegalStateException 항상
     */
    @Override
    public String error() {
        throw new IllegalStateException("error accessed on a success result");
    }

    @Override
    public <U> Result<U> map(Function<? super T, ? extends U> mapper) {
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        return new Success<>(mapper.apply(value));
    }

    @Override
    public <U> Result<U> flatMap(Function<? super T, Result<U>> mapper) {
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        Result<U> next = mapper.apply(value);
        if (next == null) {
            throw new IllegalStateException("flatMap mapper returned null");
        }
        return next;
    }
}
