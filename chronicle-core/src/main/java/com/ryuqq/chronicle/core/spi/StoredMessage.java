package com.ryuqq.chronicle.core.spi;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Message as read back from a stream, with the sequence the broker assigned.
 *
 * @param stream stream name
 * @param subject subject the message was published to
 * @param sequence stream sequence (1-based, monotonically increasing per stream)
 * @param headers header map (copied, unmodifiable)
 * @param data encoded payload
 *
 * @author Chronicle Team
 * @since 1.0.0
 */
public record StoredMessage(String stream, String subject, long sequence, Map<String, String> headers, byte[] data) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException if sequence is not positive
     */
    public StoredMessage {
        if (sequence <= 0) {
            throw new IllegalArgumentException("sequence must be positive (current: " + sequence + ")");
        }
        headers = headers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        data = data == null ? new byte[0] : data;
    }

    public String header(String name) {
        return headers.get(name);
    }
}
