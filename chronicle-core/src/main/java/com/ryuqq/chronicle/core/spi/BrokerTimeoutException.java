package com.ryuqq.chronicle.core.spi;

import java.time.Duration;

/**
 * Raised when a broker call does not complete before its deadline.
 *
 * @author Chronicle Team
 * @since 1.0.0
 */
public class BrokerTimeoutException extends BrokerException {

    public BrokerTimeoutException(String operation, Duration timeout) {
        super(operation + " did not complete within " + timeout);
    }

    public BrokerTimeoutException(String operation, Duration timeout, Throwable cause) {
        super(operation + " did not complete within " + timeout, cause);
    }
}
