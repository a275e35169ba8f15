package com.ryuqq.chronicle.application.store;

import com.ryuqq.chronicle.core.ChronicleException;

/**
 * Raised when an event names a type that differs from the registered name of its data.
 *
 * @author Chronicle Team
 * @since 1.0.0
 */
public class EventTypeMismatchException extends ChronicleException {

    private final String declaredType;
    private final String registeredType;

    public EventTypeMismatchException(String declaredType, String registeredType) {
        super("wrong type for event data: declared \"" + declaredType + "\", registered \"" + registeredType + "\"");
        this.declaredType = declaredType;
        this.registeredType = registeredType;
    }

    public String declaredType() {
        return declaredType;
    }

    public String registeredType() {
        return registeredType;
    }
}
