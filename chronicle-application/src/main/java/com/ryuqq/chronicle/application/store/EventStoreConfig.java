package com.ryuqq.chronicle.application.store;

import com.ryuqq.chronicle.core.spi.StorageType;
import com.ryuqq.chronicle.core.spi.StreamConfig;

import java.util.List;

/**
 * EventStore 스트림 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>name: 스트림 이름 (필수)</li>
 *   <li>description: 설명 (선택)</li>
 *   <li>subjects: 스트림이 수집할 subject 패턴 (비어 있으면 {@code <name>.>})</li>
 *   <li>storage: 저장 방식 (기본값 FILE)</li>
 *   <li>replicas: 복제 수 (기본값 1)</li>
 *   <li>placementCluster: 배치 클러스터 (선택)</li>
 * </ul>
 *
 * <p>이벤트 로그는 append-only이므로 스트림은 항상 삭제/퍼지 금지로 생성됩니다.</p>
 *
 * @param name 스트림 이름
 * @param description 설명
 * @param subjects subject 패턴 목록
 * @param storage 저장 방식
 * @param replicas 복제 수
 * @param placementCluster 배치 클러스터
 *
 * @author Chronicle Team
 * @since 1.0.0
 */
public record EventStoreConfig(
    String name,
    String description,
    List<String> subjects,
    StorageType storage,
    int replicas,
    String placementCluster
) {

    /**
     * Compact constructor (기본값 보완 및 유효성 검증).
     *
     * @throws IllegalArgumentException name이 비어 있거나 replicas가 양수가 아닌 경우
     */
    public EventStoreConfig {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        subjects = subjects == null || subjects.isEmpty() ? List.of(name + ".>") : List.copyOf(subjects);
        if (storage == null) {
            storage = StorageType.FILE;
        }
        if (replicas <= 0) {
            throw new IllegalArgumentException("replicas must be positive (current: " + replicas + ")");
        }
    }

    /**
     * 이름만 지정한 기본 설정.
     *
     * @param name 스트림 이름
     * @return EventStoreConfig
     */
    public static EventStoreConfig of(String name) {
        return new EventStoreConfig(name, null, null, StorageType.FILE, 1, null);
    }

    public EventStoreConfig withDescription(String description) {
        return new EventStoreConfig(name, description, subjects, storage, replicas, placementCluster);
    }

    public EventStoreConfig withSubjects(List<String> subjects) {
        return new EventStoreConfig(name, description, subjects, storage, replicas, placementCluster);
    }

    public EventStoreConfig withStorage(StorageType storage) {
        return new EventStoreConfig(name, description, subjects, storage, replicas, placementCluster);
    }

    public EventStoreConfig withReplicas(int replicas) {
        return new EventStoreConfig(name, description, subjects, storage, replicas, placementCluster);
    }

    public EventStoreConfig withPlacementCluster(String placementCluster) {
        return new EventStoreConfig(name, description, subjects, storage, replicas, placementCluster);
    }

    /**
     * 브로커 스트림 정의로 변환 (삭제/퍼지 금지 고정).
     *
     * @return StreamConfig
     */
    public StreamConfig toStreamConfig() {
        return new StreamConfig(name, description, subjects, storage, replicas, placementCluster, true, true);
    }
}
