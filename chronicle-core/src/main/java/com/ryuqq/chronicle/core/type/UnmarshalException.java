package com.ryuqq.chronicle.core.type;

import com.ryuqq.chronicle.core.ChronicleException;

/**
 * Raised when stored bytes cannot be decoded into a registered value,
 * or when an envelope header cannot be parsed.
 *
 * @author Chronicle Team
 * @since 1.0.0
 */
public class UnmarshalException extends ChronicleException {

    public UnmarshalException(String message, Throwable cause) {
        super(message, cause);
    }

    public UnmarshalException(Class<?> valueClass, Throwable cause) {
        super(valueClass.getName() + ": unmarshal error: " + cause.getMessage(), cause);
    }
}
