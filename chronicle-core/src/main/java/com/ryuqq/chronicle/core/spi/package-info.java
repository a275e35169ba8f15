/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the boundary to the durable log that backs every event store.
 * Adapter modules provide the implementations.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.chronicle.core.spi.LogBroker} - publish, last-sequence lookup, ordered reads, stream admin</li>
 *   <li>{@link com.ryuqq.chronicle.core.spi.LogReader} - ordered, ephemeral read cursor</li>
 * </ul>
 *
 * <h2>Implementations</h2>
 * <ul>
 *   <li>{@code chronicle-adapter-inmemory} - reference implementation for tests</li>
 *   <li>{@code chronicle-adapter-nats} - NATS JetStream</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Hexagonal Architecture:</strong> Core defines interfaces, adapters provide implementations</li>
 *   <li><strong>Structured conflicts:</strong> a failed precondition is a dedicated exception type, never a message to parse</li>
 *   <li><strong>Contract tests:</strong> every adapter runs the testkit's {@code AbstractLogBrokerContractTest}</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Chronicle Team
 */
package com.ryuqq.chronicle.core.spi;
