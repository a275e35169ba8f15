package com.ryuqq.chronicle.core.event;

/**
 * 페이로드 자체 검증 (선택 구현).
 *
 * <p>도메인 이벤트 타입이 구현하면 EventStore가 append 전에 호출합니다.
 * 검증 실패 시 던진 예외는 감싸지 않고 그대로 호출자에게 전달되며,
 * 배치의 어떤 이벤트도 발행되지 않습니다.</p>
 *
 * @author Chronicle Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Validator {

    /**
     * 페이로드 검증.
     *
     * @throws RuntimeException 유효하지 않은 경우
     */
    void validate();
}
