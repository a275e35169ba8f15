/**
 * NATS JetStream {@link com.ryuqq.chronicle.core.spi.LogBroker} adapter.
 *
 * @since 1.0.0
 */
package com.ryuqq.chronicle.adapter.nats;
