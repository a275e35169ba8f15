package com.ryuqq.chronicle.core.model;

import java.time.Duration;

/**
 * 호출 마감 시각.
 *
 * <p>Deadline은 EventStore 호출 하나에 허용된 시간을 나타내며,
 * 해당 호출이 수행하는 모든 브로커 왕복(마지막 시퀀스 조회, 리더 오픈,
 * 메시지 수신, 발행)에 동일하게 전달됩니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * Deadline deadline = Deadline.after(Duration.ofSeconds(5));
 * StoredMessage msg = reader.next(deadline);
 * </pre>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>기준 시계:</strong> {@link System#nanoTime()} (벽시계 변경 영향 없음)</p>
 *
 * @author Chronicle Team
 * @since 1.0.0
 */
public final class Deadline {

    private final long deadlineNanos;
    private final Duration timeout;

    private Deadline(Duration timeout) {
        if (timeout == null) {
            throw new IllegalArgumentException("timeout cannot be null");
        }
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive (current: " + timeout + ")");
        }
        this.timeout = timeout;
        this.deadlineNanos = System.nanoTime() + timeout.toNanos();
    }

    /**
     * 현재 시각 기준 Deadline 생성.
     *
     * @param timeout 허용 시간 (양수)
     * @return Deadline 인스턴스
     * @throws IllegalArgumentException timeout이 null이거나 양수가 아닌 경우
     */
    public static Deadline after(Duration timeout) {
        return new Deadline(timeout);
    }

    /**
     * 남은 시간 조회.
     *
     * @return 남은 시간 (만료된 경우 {@link Duration#ZERO})
     */
    public Duration remaining() {
        long left = deadlineNanos - System.nanoTime();
        return left <= 0 ? Duration.ZERO : Duration.ofNanos(left);
    }

    /**
     * 만료 여부 확인.
     *
     * @return 만료되었으면 true
     */
    public boolean isExpired() {
        return deadlineNanos - System.nanoTime() <= 0;
    }

    /**
     * 생성 시 지정된 전체 허용 시간.
     *
     * @return 전체 허용 시간
     */
    public Duration timeout() {
        return timeout;
    }

    @Override
    public String toString() {
        return "Deadline{timeout=" + timeout + ", remaining=" + remaining() + '}';
    }
}
