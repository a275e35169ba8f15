package com.ryuqq.chronicle.application.store;

import com.ryuqq.chronicle.core.event.Event;

import java.util.List;

/**
 * Load 결과.
 *
 * <p>lastSequence는 Load 시작 시점에 조회한 subject의 마지막 시퀀스(스냅샷)이며,
 * 이후 append의 expectedSequence로 그대로 사용할 수 있습니다.</p>
 *
 * @param events 로그 순서의 이벤트 목록 (불변)
 * @param lastSequence 스냅샷 시퀀스 (이벤트 없으면 0)
 *
 * @author Chronicle Team
 * @since 1.0.0
 */
public record LoadResult(List<Event> events, long lastSequence) {

    public LoadResult {
        events = events == null ? List.of() : List.copyOf(events);
        if (lastSequence < 0) {
            throw new IllegalArgumentException("lastSequence must be non-negative (current: " + lastSequence + ")");
        }
    }

    public static LoadResult empty(long lastSequence) {
        return new LoadResult(List.of(), lastSequence);
    }

    public boolean isEmpty() {
        return events.isEmpty();
    }
}
