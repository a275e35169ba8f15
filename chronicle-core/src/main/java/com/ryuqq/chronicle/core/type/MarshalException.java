package com.ryuqq.chronicle.core.type;

import com.ryuqq.chronicle.core.ChronicleException;

/**
 * Raised when a registered value cannot be encoded.
 *
 * @author Chronicle Team
 * @since 1.0.0
 */
public class MarshalException extends ChronicleException {

    public MarshalException(Class<?> valueClass, Throwable cause) {
        super(valueClass.getName() + ": marshal error: " + cause.getMessage(), cause);
    }
}
