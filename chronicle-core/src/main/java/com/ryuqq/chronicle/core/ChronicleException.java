package com.ryuqq.chronicle.core;

/**
 * Base type for every failure raised by Chronicle itself.
 *
 * <p>Argument problems (null or malformed parameters) are reported with
 * {@link IllegalArgumentException} instead, as in the rest of the SDK.</p>
 *
 * @author Chronicle Team
 * @since 1.0.0
 */
public class ChronicleException extends RuntimeException {

    public ChronicleException(String message) {
        super(message);
    }

    public ChronicleException(String message, Throwable cause) {
        super(message, cause);
    }
}
