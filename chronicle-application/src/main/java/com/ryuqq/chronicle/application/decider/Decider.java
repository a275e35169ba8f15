package com.ryuqq.chronicle.application.decider;

import com.ryuqq.chronicle.core.event.Event;

import java.util.List;

/**
 * 명령을 이벤트로 변환하는 결정 함수.
 *
 * <p>구현체는 보통 {@link com.ryuqq.chronicle.core.event.Evolver}를 함께 구현한 상태 객체이며,
 * 지금까지 반영된 이벤트를 기준으로 명령의 수락 여부를 판단합니다.</p>
 *
 * <p><strong>구현 책임:</strong></p>
 * <ul>
 *   <li>부수 효과 없음 (같은 상태와 명령이면 같은 결과)</li>
 *   <li>명령 거부 시 예외 발생 (이벤트는 저장되지 않음)</li>
 *   <li>변경이 없으면 빈 목록 반환</li>
 * </ul>
 *
 * @author Chronicle Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Decider {

    /**
     * 명령 처리 결정.
     *
     * @param command 처리할 명령
     * @return 저장할 이벤트 목록 (빈 목록 가능, null 불가)
     */
    List<Event> decide(Command command);
}
