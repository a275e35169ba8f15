package com.ryuqq.chronicle.core.model;

import java.util.UUID;

/**
 * 이벤트 ID 생성기.
 *
 * <p>생성된 ID는 브로커 수준 멱등성 키({@code Nats-Msg-Id})로 사용되므로
 * 전역적으로 고유해야 합니다. UUID, NUID, ULID 등을 권장합니다.</p>
 *
 * <p><strong>구현 책임:</strong></p>
 * <ul>
 *   <li>스레드 안전 (여러 EventStore가 동시에 호출)</li>
 *   <li>호출마다 새로운 값 반환</li>
 * </ul>
 *
 * @author Chronicle Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface IdGenerator {

    /**
     * 새 ID 생성.
     *
     * @return 고유 ID (null 또는 빈 문자열 불가)
     */
    String next();

    /**
     * UUID v4 기반 기본 생성기.
     *
     * @return IdGenerator
     */
    static IdGenerator uuid() {
        return () -> UUID.randomUUID().toString();
    }
}
