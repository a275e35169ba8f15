package com.ryuqq.chronicle.application.store;

/**
 * Lifecycle of event stores (and their backing streams).
 *
 * @author Chronicle Team
 * @since 1.0.0
 */
public interface EventStoreManager {

    /**
     * Binds to an existing stream.
     *
     * @param name stream name
     * @return event store
     * @throws com.ryuqq.chronicle.core.spi.StreamNotFoundException if the stream does not exist
     */
    EventStore get(String name);

    /**
     * Creates the backing stream and returns a store bound to it.
     *
     * @param config stream settings
     * @return event store
     * @throws com.ryuqq.chronicle.core.spi.BrokerException if creation fails
     */
    EventStore create(EventStoreConfig config);

    /**
     * Updates the backing stream of an existing store.
     *
     * @param config new stream settings
     * @throws com.ryuqq.chronicle.core.spi.StreamNotFoundException if the stream does not exist
     */
    void update(EventStoreConfig config);

    /**
     * Deletes the backing stream and every event in it.
     *
     * @param name stream name
     * @throws com.ryuqq.chronicle.core.spi.StreamNotFoundException if the stream does not exist
     */
    void delete(String name);
}
