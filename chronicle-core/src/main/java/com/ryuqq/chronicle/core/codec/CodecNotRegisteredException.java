package com.ryuqq.chronicle.core.codec;

import com.ryuqq.chronicle.core.ChronicleException;

/**
 * Raised when a codec name is not known, either while building a configuration
 * or when a stored message names a codec the reader was not configured with.
 *
 * @author Chronicle Team
 * @since 1.0.0
 */
public class CodecNotRegisteredException extends ChronicleException {

    private final String codecName;

    public CodecNotRegisteredException(String codecName) {
        super("codec not registered: " + codecName);
        this.codecName = codecName;
    }

    public String codecName() {
        return codecName;
    }
}
