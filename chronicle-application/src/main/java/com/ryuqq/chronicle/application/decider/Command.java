package com.ryuqq.chronicle.application.decider;

import java.time.Instant;

/**
 * 도메인 명령.
 *
 * <p>Command는 상태 변경 의도를 나타내며, {@link Decider}가 현재 상태를 기준으로
 * 이를 이벤트 목록으로 변환합니다. Command 자체는 저장되지 않습니다.</p>
 *
 * <p><strong>필드 구성:</strong></p>
 * <ul>
 *   <li><strong>id:</strong> 명령 ID (null 가능, 이벤트 ID 파생에 사용 가능)</li>
 *   <li><strong>type:</strong> 명령 유형 (예: place-order)</li>
 *   <li><strong>time:</strong> 명령 시각 (null 가능)</li>
 *   <li><strong>data:</strong> 명령 데이터</li>
 * </ul>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * Command command = Command.of("ship-order", new ShipOrder("order-1"));
 * </pre>
 *
 * @param id 명령 ID (null 가능)
 * @param type 명령 유형
 * @param time 명령 시각 (null 가능)
 * @param data 명령 데이터
 *
 * @author Chronicle Team
 * @since 1.0.0
 */
public record Command(String id, String type, Instant time, Object data) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException type이 비어 있거나 data가 null인 경우
     */
    public Command {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("type cannot be null or blank");
        }
        if (data == null) {
            throw new IllegalArgumentException("data cannot be null");
        }
    }

    /**
     * type과 data만으로 Command 생성.
     *
     * @param type 명령 유형
     * @param data 명령 데이터
     * @return Command 인스턴스
     */
    public static Command of(String type, Object data) {
        return new Command(null, type, null, data);
    }

    /**
     * data를 지정 타입으로 조회.
     *
     * @param dataType 기대 타입
     * @param <T> 타입
     * @return 캐스팅된 data
     * @throws ClassCastException data가 해당 타입이 아닌 경우
     */
    public <T> T dataAs(Class<T> dataType) {
        return dataType.cast(data);
    }
}
