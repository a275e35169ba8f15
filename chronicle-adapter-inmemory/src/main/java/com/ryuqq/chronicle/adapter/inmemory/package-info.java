/**
 * In-memory {@link com.ryuqq.chronicle.core.spi.LogBroker} for tests and local development.
 *
 * @since 1.0.0
 */
package com.ryuqq.chronicle.adapter.inmemory;
