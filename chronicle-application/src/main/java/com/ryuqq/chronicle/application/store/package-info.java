/**
 * Event store: append with optimistic concurrency, snapshot load and evolve.
 *
 * <p>{@link com.ryuqq.chronicle.application.store.EventStore} is the entry point;
 * {@link com.ryuqq.chronicle.application.store.EventStoreManager} manages the backing streams.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.chronicle.application.store;
