package com.ryuqq.chronicle.core.spi;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Message handed to {@link LogBroker#publish}.
 *
 * <p>Headers carry the envelope fields; the body carries the encoded payload only.</p>
 *
 * @param subject concrete subject (no wildcards) the message is published to
 * @param headers header map (copied, unmodifiable)
 * @param data encoded payload (never null, may be empty)
 *
 * @author Chronicle Team
 * @since 1.0.0
 */
public record BrokerMessage(String subject, Map<String, String> headers, byte[] data) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException if subject is blank or contains wildcards
     */
    public BrokerMessage {
        if (subject == null || subject.isBlank()) {
            throw new IllegalArgumentException("subject cannot be null or blank");
        }
        if (subject.contains("*") || subject.contains(">")) {
            throw new IllegalArgumentException("cannot publish to a wildcard subject: " + subject);
        }
        headers = headers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        data = data == null ? new byte[0] : data;
    }

    public String header(String name) {
        return headers.get(name);
    }
}
