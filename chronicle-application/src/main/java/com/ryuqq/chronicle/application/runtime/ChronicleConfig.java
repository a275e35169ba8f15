package com.ryuqq.chronicle.application.runtime;

import com.ryuqq.chronicle.core.codec.Codecs;
import com.ryuqq.chronicle.core.model.IdGenerator;
import com.ryuqq.chronicle.core.type.TypeRegistry;

import java.time.Clock;
import java.time.Duration;

/**
 * Chronicle 런타임 설정 (불변 record).
 *
 * <p>이 record는 런타임이 생성하는 모든 EventStore에 공통으로 적용됩니다.</p>
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>typeRegistry: 타입 레지스트리 (null이면 byte[] 페이로드만 허용, type 명시 필수)</li>
 *   <li>idGenerator: 이벤트 ID 생성기 (기본 UUID, null이면 호출자가 ID를 지정해야 함)</li>
 *   <li>clock: 이벤트 시각 기본값용 시계 (기본 {@link Clock#systemUTC()})</li>
 *   <li>defaultTimeout: 호출별 timeout 미지정 시 적용 (기본 5초)</li>
 *   <li>codecs: 저장된 codec 헤더 해석용 codec 테이블 (기본 {@link Codecs#defaults()})</li>
 * </ul>
 *
 * <p><strong>테스트 가이드:</strong></p>
 * <ul>
 *   <li>결정적 ID: 순차 IdGenerator 주입</li>
 *   <li>결정적 시각: {@link Clock#fixed} 주입</li>
 * </ul>
 *
 * @author Chronicle Team
 * @since 1.0.0
 * @param typeRegistry 타입 레지스트리 (null 허용)
 * @param idGenerator ID 생성기 (null 허용)
 * @param clock 시계 (필수)
 * @param defaultTimeout 기본 허용 시간 (양수여야 함)
 * @param codecs codec 테이블 (필수)
 */
public record ChronicleConfig(
    TypeRegistry typeRegistry,
    IdGenerator idGenerator,
    Clock clock,
    Duration defaultTimeout,
    Codecs codecs
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: typeRegistry 없음, UUID ID, systemUTC 시계, timeout 5초, 기본 codec 테이블</p>
     */
    public ChronicleConfig() {
        this(null, IdGenerator.uuid(), Clock.systemUTC(), Duration.ofSeconds(5), Codecs.defaults());
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public ChronicleConfig {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (defaultTimeout == null || defaultTimeout.isNegative() || defaultTimeout.isZero()) {
            throw new IllegalArgumentException(
                "defaultTimeout must be positive (current: " + defaultTimeout + ")"
            );
        }
        if (codecs == null) {
            throw new IllegalArgumentException("codecs cannot be null");
        }
    }

    /**
     * typeRegistry만 변경한 새 인스턴스 생성.
     *
     * @param typeRegistry 새로운 타입 레지스트리
     * @return 새 ChronicleConfig 인스턴스
     */
    public ChronicleConfig withTypeRegistry(TypeRegistry typeRegistry) {
        return new ChronicleConfig(typeRegistry, idGenerator, clock, defaultTimeout, codecs);
    }

    /**
     * idGenerator만 변경한 새 인스턴스 생성.
     *
     * @param idGenerator 새로운 ID 생성기 (null이면 ID 자동 생성 안 함)
     * @return 새 ChronicleConfig 인스턴스
     */
    public ChronicleConfig withIdGenerator(IdGenerator idGenerator) {
        return new ChronicleConfig(typeRegistry, idGenerator, clock, defaultTimeout, codecs);
    }

    public ChronicleConfig withClock(Clock clock) {
        return new ChronicleConfig(typeRegistry, idGenerator, clock, defaultTimeout, codecs);
    }

    public ChronicleConfig withDefaultTimeout(Duration defaultTimeout) {
        return new ChronicleConfig(typeRegistry, idGenerator, clock, defaultTimeout, codecs);
    }

    public ChronicleConfig withCodecs(Codecs codecs) {
        return new ChronicleConfig(typeRegistry, idGenerator, clock, defaultTimeout, codecs);
    }
}
