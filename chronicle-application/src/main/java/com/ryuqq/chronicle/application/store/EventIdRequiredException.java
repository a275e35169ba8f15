package com.ryuqq.chronicle.application.store;

import com.ryuqq.chronicle.core.ChronicleException;

/**
 * Raised when an event without an id is appended and the runtime was configured
 * without an id generator.
 *
 * @author Chronicle Team
 * @since 1.0.0
 */
public class EventIdRequiredException extends ChronicleException {

    public EventIdRequiredException() {
        super("event id required");
    }
}
