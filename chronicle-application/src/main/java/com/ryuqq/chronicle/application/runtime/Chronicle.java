package com.ryuqq.chronicle.application.runtime;

import com.ryuqq.chronicle.application.store.DefaultEventStore;
import com.ryuqq.chronicle.application.store.EventStore;
import com.ryuqq.chronicle.application.store.EventStoreConfig;
import com.ryuqq.chronicle.application.store.EventStoreManager;
import com.ryuqq.chronicle.core.spi.LogBroker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Chronicle 런타임 진입점.
 *
 * <p>하나의 {@link LogBroker}와 {@link ChronicleConfig}를 묶어 EventStore를 생성/관리합니다.
 * 런타임 자체는 상태를 갖지 않으며, 모든 영속 상태는 브로커가 소유합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * TypeRegistry registry = TypeRegistry.create(new JsonCodec(),
 *     TypeDescriptor.of("order-placed", OrderPlaced::new));
 *
 * Chronicle chronicle = Chronicle.of(broker,
 *     new ChronicleConfig().withTypeRegistry(registry));
 *
 * EventStore orders = chronicle.create(EventStoreConfig.of("orders"));
 * orders.append("orders.1", Event.of(new OrderPlaced("order-1")));
 * </pre>
 *
 * <p><strong>스레드 안전성:</strong> 불변 객체이며, 반환된 EventStore도 공유 가능합니다.</p>
 *
 * @author Chronicle Team
 * @since 1.0.0
 */
public final class Chronicle implements EventStoreManager {

    private static final Logger log = LoggerFactory.getLogger(Chronicle.class);

    private final LogBroker broker;
    private final ChronicleConfig config;

    private Chronicle(LogBroker broker, ChronicleConfig config) {
        this.broker = broker;
        this.config = config;
    }

    /**
     * 런타임 생성.
     *
     * @param broker 로그 브로커
     * @param config 런타임 설정
     * @return Chronicle 인스턴스
     * @throws IllegalArgumentException broker 또는 config가 null인 경우
     */
    public static Chronicle of(LogBroker broker, ChronicleConfig config) {
        if (broker == null) {
            throw new IllegalArgumentException("broker cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        return new Chronicle(broker, config);
    }

    /**
     * 기본 설정으로 런타임 생성.
     *
     * @param broker 로그 브로커
     * @return Chronicle 인스턴스
     */
    public static Chronicle of(LogBroker broker) {
        return of(broker, new ChronicleConfig());
    }

    @Override
    public EventStore get(String name) {
        broker.describeStream(name);
        return new DefaultEventStore(broker, name, config);
    }

    @Override
    public EventStore create(EventStoreConfig storeConfig) {
        if (storeConfig == null) {
            throw new IllegalArgumentException("storeConfig cannot be null");
        }
        broker.createStream(storeConfig.toStreamConfig());
        log.info("Event store created: name={}, subjects={}", storeConfig.name(), storeConfig.subjects());
        return new DefaultEventStore(broker, storeConfig.name(), config);
    }

    @Override
    public void update(EventStoreConfig storeConfig) {
        if (storeConfig == null) {
            throw new IllegalArgumentException("storeConfig cannot be null");
        }
        broker.updateStream(storeConfig.toStreamConfig());
        log.info("Event store updated: name={}, subjects={}", storeConfig.name(), storeConfig.subjects());
    }

    @Override
    public void delete(String name) {
        broker.deleteStream(name);
        log.info("Event store deleted: name={}", name);
    }

    public ChronicleConfig config() {
        return config;
    }
}
