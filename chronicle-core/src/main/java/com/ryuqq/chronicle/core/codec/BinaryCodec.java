package com.ryuqq.chronicle.core.codec;

import java.util.Arrays;

/**
 * Passthrough codec for pre-encoded payloads.
 *
 * <p>Accepts {@code byte[]} values (copied, never shared) and values implementing
 * {@link BinaryValue}. This is the codec used by event stores configured without a
 * type registry.</p>
 *
 * @author Chronicle Team
 * @since 1.0.0
 */
public final class BinaryCodec implements Codec {

    public static final String NAME = "binary";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String contentType() {
        return "application/octet-stream";
    }

    @Override
    public byte[] marshal(Object value) {
        if (value instanceof BinaryValue binary) {
            return binary.toBytes();
        }
        if (value instanceof byte[] bytes) {
            return Arrays.copyOf(bytes, bytes.length);
        }
        throw new CodecException("binary: value must be byte[] or BinaryValue, got "
                + (value == null ? "null" : value.getClass().getName()));
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> T unmarshal(byte[] data, T target) {
        byte[] source = data == null ? new byte[0] : data;
        if (target instanceof BinaryValue binary) {
            binary.fromBytes(Arrays.copyOf(source, source.length));
            return target;
        }
        if (target instanceof byte[]) {
            return (T) Arrays.copyOf(source, source.length);
        }
        throw new CodecException("binary: target must be byte[] or BinaryValue, got "
                + (target == null ? "null" : target.getClass().getName()));
    }
}
