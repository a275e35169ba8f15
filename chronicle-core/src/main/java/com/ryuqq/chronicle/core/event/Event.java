package com.ryuqq.chronicle.core.event;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 이벤트 봉투 (Envelope).
 *
 * <p>Event는 도메인 이벤트 값과 그 식별/시각/메타데이터를 묶은 애플리케이션 수준 표현입니다.
 * 호출자가 일부 필드만 채워 생성하면, EventStore가 append 시점에 나머지를 보완합니다.</p>
 *
 * <p><strong>필드 구성:</strong></p>
 * <ul>
 *   <li><strong>id:</strong> 이벤트 ID, 브로커 중복 제거 키로 사용 (미지정 시 자동 생성)</li>
 *   <li><strong>type:</strong> 타입 이름 (TypeRegistry가 있으면 data로부터 결정)</li>
 *   <li><strong>time:</strong> 발생 시각 (미지정 시 현재 시각)</li>
 *   <li><strong>data:</strong> 등록된 도메인 값 또는 byte[] (TypeRegistry 미설정 시)</li>
 *   <li><strong>meta:</strong> 자유 형식 문자열 메타데이터</li>
 *   <li><strong>subject / sequence:</strong> 로드 시 브로커가 부여한 값 (읽기 전용)</li>
 * </ul>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * Event event = Event.builder()
 *     .data(new OrderPlaced("order-1"))
 *     .meta("user", "alice")
 *     .build();
 * </pre>
 *
 * @param id 이벤트 ID (null 허용)
 * @param type 타입 이름 (null 허용)
 * @param time 발생 시각 (null 허용)
 * @param data 페이로드
 * @param meta 메타데이터 (null이면 빈 맵)
 * @param subject 저장된 subject (로드 시에만 설정)
 * @param sequence 저장된 스트림 시퀀스 (로드 시에만 설정, 그 외 0)
 *
 * @author Chronicle Team
 * @since 1.0.0
 */
public record Event(
    String id,
    String type,
    Instant time,
    Object data,
    Map<String, String> meta,
    String subject,
    long sequence
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException sequence가 음수이거나 meta에 null 키/값이 있는 경우
     */
    public Event {
        if (sequence < 0) {
            throw new IllegalArgumentException("sequence must be non-negative (current: " + sequence + ")");
        }
        if (meta == null) {
            meta = Map.of();
        } else {
            for (Map.Entry<String, String> entry : meta.entrySet()) {
                if (entry.getKey() == null || entry.getKey().isBlank() || entry.getValue() == null) {
                    throw new IllegalArgumentException("meta keys must be non-blank and values non-null");
                }
            }
            meta = Collections.unmodifiableMap(new LinkedHashMap<>(meta));
        }
    }

    /**
     * data만으로 Event 생성.
     *
     * @param data 페이로드
     * @return Event 인스턴스
     */
    public static Event of(Object data) {
        return builder().data(data).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 현재 값을 복사한 Builder 반환.
     *
     * @return Builder
     */
    public Builder toBuilder() {
        return new Builder()
            .id(id)
            .type(type)
            .time(time)
            .data(data)
            .meta(meta)
            .subject(subject)
            .sequence(sequence);
    }

    /**
     * data를 지정 타입으로 조회.
     *
     * @param type 기대 타입
     * @param <T> 타입
     * @return 캐스팅된 data
     * @throws ClassCastException data가 해당 타입이 아닌 경우
     */
    public <T> T dataAs(Class<T> type) {
        return type.cast(data);
    }

    /**
     * Event Builder.
     */
    public static final class Builder {

        private String id;
        private String type;
        private Instant time;
        private Object data;
        private final Map<String, String> meta = new LinkedHashMap<>();
        private String subject;
        private long sequence;

        private Builder() {
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder time(Instant time) {
            this.time = time;
            return this;
        }

        public Builder data(Object data) {
            this.data = data;
            return this;
        }

        public Builder meta(String key, String value) {
            this.meta.put(key, value);
            return this;
        }

        public Builder meta(Map<String, String> meta) {
            this.meta.clear();
            if (meta != null) {
                this.meta.putAll(meta);
            }
            return this;
        }

        public Builder subject(String subject) {
            this.subject = subject;
            return this;
        }

        public Builder sequence(long sequence) {
            this.sequence = sequence;
            return this;
        }

        public Event build() {
            return new Event(id, type, time, data, meta, subject, sequence);
        }
    }
}
