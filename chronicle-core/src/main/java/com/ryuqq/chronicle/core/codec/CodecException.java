package com.ryuqq.chronicle.core.codec;

import com.ryuqq.chronicle.core.ChronicleException;

/**
 * Raised by a {@link Codec} when a value cannot be encoded or decoded.
 *
 * @author Chronicle Team
 * @since 1.0.0
 */
public class CodecException extends ChronicleException {

    public CodecException(String message) {
        super(message);
    }

    public CodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
