package com.ryuqq.chronicle.core.spi;

/**
 * Broker acknowledgement of a publish.
 *
 * @param stream stream that stored the message
 * @param sequence assigned stream sequence; for duplicates, the sequence of the original message
 * @param duplicate true when the message id had already been accepted and nothing was stored
 *
 * @author Chronicle Team
 * @since 1.0.0
 */
public record PublishAck(String stream, long sequence, boolean duplicate) {

    public PublishAck {
        if (sequence <= 0) {
            throw new IllegalArgumentException("sequence must be positive (current: " + sequence + ")");
        }
    }
}
