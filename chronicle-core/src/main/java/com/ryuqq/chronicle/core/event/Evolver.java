package com.ryuqq.chronicle.core.event;

/**
 * 이벤트를 상태에 누적하는 프로젝션.
 *
 * <p>Evolver는 호출자가 소유하는 가변 상태이며, EventStore는 로그 순서대로 이벤트를
 * 하나씩 {@link #apply(Event)}에 전달할 뿐 상태를 보관하지 않습니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * class OrderStats implements Evolver {
 *     int placed;
 *
 *     {@literal @}Override
 *     public void apply(Event event) {
 *         if (event.data() instanceof OrderPlaced) {
 *             placed++;
 *         }
 *     }
 * }
 * </pre>
 *
 * @author Chronicle Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Evolver {

    /**
     * 이벤트 하나를 상태에 반영.
     *
     * @param event 적용할 이벤트
     * @throws RuntimeException 이벤트를 적용할 수 없는 경우 (이후 이벤트는 적용되지 않음)
     */
    void apply(Event event);
}
