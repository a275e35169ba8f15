package com.ryuqq.chronicle.core.spi;

import com.ryuqq.chronicle.core.model.Deadline;

/**
 * Ordered, ephemeral reader opened by {@link LogBroker#openReader}.
 *
 * <p>Not thread-safe: a reader belongs to the call that opened it.</p>
 *
 * @author Chronicle Team
 * @since 1.0.0
 */
public interface LogReader extends AutoCloseable {

    /**
     * Blocks until the next message is available.
     *
     * @param deadline call deadline
     * @return next message in stream order
     * @throws BrokerTimeoutException if no message arrives before the deadline
     * @throws BrokerException if the reader was closed or the thread was interrupted
     */
    StoredMessage next(Deadline deadline);

    /**
     * Releases the reader. Idempotent.
     */
    @Override
    void close();
}
