package com.ryuqq.chronicle.application.runtime;

import com.ryuqq.chronicle.application.store.EventStore;
import com.ryuqq.chronicle.application.store.EventStoreConfig;
import com.ryuqq.chronicle.core.spi.LogBroker;
import com.ryuqq.chronicle.core.spi.StorageType;
import com.ryuqq.chronicle.core.spi.StreamConfig;
import com.ryuqq.chronicle.core.spi.StreamNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

/**
 * Chronicle (EventStoreManager) 유닛 테스트.
 *
 * @author Chronicle Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class ChronicleTest {

    @Mock
    private LogBroker broker;

    private Chronicle chronicle;

    @BeforeEach
    void setUp() {
        chronicle = Chronicle.of(broker);
    }

    @Test
    void create_기본_subject와_삭제금지_스트림_생성() {
        // when
        EventStore store = chronicle.create(EventStoreConfig.of("orders"));

        // then
        ArgumentCaptor<StreamConfig> captor = ArgumentCaptor.forClass(StreamConfig.class);
        verify(broker).createStream(captor.capture());
        StreamConfig created = captor.getValue();

        assertThat(store.name()).isEqualTo("orders");
        assertThat(created.subjects()).containsExactly("orders.>");
        assertThat(created.storage()).isEqualTo(StorageType.FILE);
        assertThat(created.replicas()).isEqualTo(1);
        assertThat(created.denyDelete()).isTrue();
        assertThat(created.denyPurge()).isTrue();
    }

    @Test
    void update_설정을_스트림_정의로_전달() {
        // when
        chronicle.update(EventStoreConfig.of("orders")
            .withSubjects(List.of("orders.>", "returns.>"))
            .withReplicas(3)
            .withPlacementCluster("east"));

        // then
        ArgumentCaptor<StreamConfig> captor = ArgumentCaptor.forClass(StreamConfig.class);
        verify(broker).updateStream(captor.capture());
        assertThat(captor.getValue().subjects()).containsExactly("orders.>", "returns.>");
        assertThat(captor.getValue().replicas()).isEqualTo(3);
        assertThat(captor.getValue().placementCluster()).isEqualTo("east");
    }

    @Test
    void get_존재하는_스트림이면_EventStore_반환() {
        when(broker.describeStream("orders")).thenReturn(
            new StreamConfig("orders", null, List.of("orders.>"), StorageType.FILE, 1, null, true, true));

        assertThat(chronicle.get("orders").name()).isEqualTo("orders");
    }

    @Test
    void get_없는_스트림이면_StreamNotFound() {
        when(broker.describeStream("orders")).thenThrow(new StreamNotFoundException("orders"));

        assertThatThrownBy(() -> chronicle.get("orders")).isInstanceOf(StreamNotFoundException.class);
    }

    @Test
    void delete_브로커에_위임() {
        chronicle.delete("orders");

        verify(broker).deleteStream("orders");
    }

    @Test
    void of_null_인자_거부() {
        assertThatThrownBy(() -> Chronicle.of(null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Chronicle.of(broker, null)).isInstanceOf(IllegalArgumentException.class);
    }
}
