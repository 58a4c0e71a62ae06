package com.ryuqq.kernel.core.spi;

/**
 * 엔티티 식별자 생성 SPI.
 *
 * <p>식별자 없이 생성된 Entity/Aggregate에 전역 고유 식별자를 부여합니다.</p>
 *
 * <p><strong>구현 요구사항:</strong></p>
 * <ul>
 *   <li>스레드 안전: 여러 호출 지점에서 동시에 호출될 수 있음</li>
 *   <li>고유성: 반환값은 중복되지 않아야 함</li>
 *   <li>null 또는 빈 문자열 반환 금지</li>
 * </ul>
 *
 * <p><strong>구현 예시:</strong></p>
 * <ul>
 *   <li>{@code UuidIdGenerator}: UUID v4 (기본값)</li>
 *   <li>{@code SequenceIdGenerator}: 테스트용 결정적 시퀀스 (testkit)</li>
 * </ul>
 *
 * @author Kernel Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface IdGenerator {

    /**
     * 새 식별자 생성.
     *
     * @return 고유 식별자 (null 또는 빈 문자열 불가)
     */
    String nextId();
}
