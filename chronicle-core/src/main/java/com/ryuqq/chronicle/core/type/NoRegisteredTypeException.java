package com.ryuqq.chronicle.core.type;

import com.ryuqq.chronicle.core.ChronicleException;

/**
 * Raised when a value's class was never registered under any name.
 *
 * @author Chronicle Team
 * @since 1.0.0
 */
public class NoRegisteredTypeException extends ChronicleException {

    private final Class<?> valueClass;

    public NoRegisteredTypeException(Class<?> valueClass) {
        super("no registered type for " + (valueClass == null ? "null" : valueClass.getName()));
        this.valueClass = valueClass;
    }

    public Class<?> valueClass() {
        return valueClass;
    }
}
