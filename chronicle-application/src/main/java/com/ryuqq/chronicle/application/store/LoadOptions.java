package com.ryuqq.chronicle.application.store;

import java.time.Duration;

/**
 * Load / Evolve 호출 옵션 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>afterSequence: 이 시퀀스 이후의 이벤트만 조회 (null이면 처음부터)</li>
 *   <li>timeout: 호출 전체 허용 시간 (null이면 런타임 기본값)</li>
 * </ul>
 *
 * <p>이미 일부 이벤트를 반영한 상태에서 최신 이벤트만 가져올 때 사용합니다.</p>
 *
 * @param afterSequence 기준 시퀀스 (null 허용, 0 이상)
 * @param timeout 허용 시간 (null 허용, 양수)
 *
 * @author Chronicle Team
 * @since 1.0.0
 */
public record LoadOptions(Long afterSequence, Duration timeout) {

    private static final LoadOptions ALL = new LoadOptions(null, null);

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException afterSequence가 음수이거나 timeout이 양수가 아닌 경우
     */
    public LoadOptions {
        if (afterSequence != null && afterSequence < 0) {
            throw new IllegalArgumentException(
                "afterSequence must be non-negative (current: " + afterSequence + ")"
            );
        }
        if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
            throw new IllegalArgumentException("timeout must be positive (current: " + timeout + ")");
        }
    }

    /**
     * 처음부터 전체 조회.
     *
     * @return 기본 LoadOptions
     */
    public static LoadOptions all() {
        return ALL;
    }

    /**
     * 지정 시퀀스 이후 조회.
     *
     * @param sequence 마지막으로 반영된 시퀀스
     * @return LoadOptions
     */
    public static LoadOptions afterSequence(long sequence) {
        return new LoadOptions(sequence, null);
    }

    /**
     * timeout만 변경한 새 인스턴스 생성.
     *
     * @param timeout 새로운 허용 시간
     * @return 새 LoadOptions 인스턴스
     */
    public LoadOptions withTimeout(Duration timeout) {
        return new LoadOptions(this.afterSequence, timeout);
    }
}
