package com.ryuqq.chronicle.core.spi;

import com.ryuqq.chronicle.core.ChronicleException;

/**
 * Transport or server-side failure reported by a {@link LogBroker}.
 *
 * <p>The event store propagates these unchanged; it never retries.</p>
 *
 * @author Chronicle Team
 * @since 1.0.0
 */
public class BrokerException extends ChronicleException {

    public BrokerException(String message) {
        super(message);
    }

    public BrokerException(String message, Throwable cause) {
        super(message, cause);
    }
}
