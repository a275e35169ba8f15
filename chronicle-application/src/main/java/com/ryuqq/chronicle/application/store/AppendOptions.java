package com.ryuqq.chronicle.application.store;

import java.time.Duration;

/**
 * Append 호출 옵션 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>expectedSequence: subject의 기대 마지막 시퀀스 (null이면 낙관적 동시성 검사 없음, 0은 "아직 이벤트 없음")</li>
 *   <li>timeout: 호출 전체 허용 시간 (null이면 런타임 기본값)</li>
 * </ul>
 *
 * <pre>
 * store.append("orders.1", events, AppendOptions.expectSequence(3));
 * </pre>
 *
 * @param expectedSequence 기대 시퀀스 (null 허용, 0 이상)
 * @param timeout 허용 시간 (null 허용, 양수)
 *
 * @author Chronicle Team
 * @since 1.0.0
 */
public record AppendOptions(Long expectedSequence, Duration timeout) {

    private static final AppendOptions NONE = new AppendOptions(null, null);

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException expectedSequence가 음수이거나 timeout이 양수가 아닌 경우
     */
    public AppendOptions {
        if (expectedSequence != null && expectedSequence < 0) {
            throw new IllegalArgumentException(
                "expectedSequence must be non-negative (current: " + expectedSequence + ")"
            );
        }
        if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
            throw new IllegalArgumentException("timeout must be positive (current: " + timeout + ")");
        }
    }

    /**
     * 옵션 없음.
     *
     * @return 기본 AppendOptions
     */
    public static AppendOptions none() {
        return NONE;
    }

    /**
     * 기대 시퀀스 지정.
     *
     * @param sequence 기대 마지막 시퀀스
     * @return AppendOptions
     */
    public static AppendOptions expectSequence(long sequence) {
        return new AppendOptions(sequence, null);
    }

    /**
     * timeout만 변경한 새 인스턴스 생성.
     *
     * @param timeout 새로운 허용 시간
     * @return 새 AppendOptions 인스턴스
     */
    public AppendOptions withTimeout(Duration timeout) {
        return new AppendOptions(this.expectedSequence, timeout);
    }
}
