package com.ryuqq.chronicle.application.store;

import com.ryuqq.chronicle.core.ChronicleException;

/**
 * Raised when an event without a type name is appended to a store that has no type
 * registry to derive it from.
 *
 * @author Chronicle Team
 * @since 1.0.0
 */
public class EventTypeRequiredException extends ChronicleException {

    public EventTypeRequiredException() {
        super("event type required");
    }
}
