package com.ryuqq.chronicle.core.spi;

/**
 * Raised when an operation names a stream the broker does not have.
 *
 * @author Chronicle Team
 * @since 1.0.0
 */
public class StreamNotFoundException extends BrokerException {

    private final String stream;

    public StreamNotFoundException(String stream) {
        super("stream not found: " + stream);
        this.stream = stream;
    }

    public String stream() {
        return stream;
    }
}
