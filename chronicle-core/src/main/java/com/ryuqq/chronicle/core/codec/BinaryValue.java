package com.ryuqq.chronicle.core.codec;

/**
 * Opt-in binary representation for values handled by {@link BinaryCodec}.
 *
 * @author Chronicle Team
 * @since 1.0.0
 */
public interface BinaryValue {

    /**
     * @return the encoded form of this value
     */
    byte[] toBytes();

    /**
     * Replaces the state of this value with the decoded bytes.
     *
     * @param data encoded form
     */
    void fromBytes(byte[] data);
}
