package com.ryuqq.chronicle.core.codec;

import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.Message;

/**
 * Protocol Buffers codec for generated {@link Message} types.
 *
 * <p>Messages are immutable, so decoding merges the bytes into a builder derived from
 * the target and returns the built message instead of mutating the target.</p>
 *
 * @author Chronicle Team
 * @since 1.0.0
 */
public final class ProtobufCodec implements Codec {

    public static final String NAME = "protobuf";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String contentType() {
        return "application/protobuf";
    }

    @Override
    public byte[] marshal(Object value) {
        if (!(value instanceof Message message)) {
            throw new CodecException("protobuf: value must be a protobuf Message, got "
                    + (value == null ? "null" : value.getClass().getName()));
        }
        return message.toByteArray();
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> T unmarshal(byte[] data, T target) {
        if (!(target instanceof Message message)) {
            throw new CodecException("protobuf: target must be a protobuf Message, got "
                    + (target == null ? "null" : target.getClass().getName()));
        }
        try {
            return (T) message.toBuilder()
                    .mergeFrom(data == null ? new byte[0] : data)
                    .build();
        } catch (InvalidProtocolBufferException e) {
            throw new CodecException("protobuf: cannot decode into " + target.getClass().getName(), e);
        }
    }
}
