package com.ryuqq.chronicle.core.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.msgpack.jackson.dataformat.MessagePackFactory;

import java.io.IOException;

/**
 * MessagePack codec backed by Jackson's {@link MessagePackFactory}.
 *
 * <p>Binds values the same way as {@link JsonCodec} (bean properties, JSR-310 types,
 * unknown properties ignored, in-place decoding), only the wire format differs.</p>
 *
 * @author Chronicle Team
 * @since 1.0.0
 */
public final class MsgPackCodec implements Codec {

    public static final String NAME = "msgpack";

    private final ObjectMapper objectMapper;

    public MsgPackCodec() {
        this(JsonCodec.configure(new ObjectMapper(new MessagePackFactory())));
    }

    /**
     * @param objectMapper mapper built on a {@link MessagePackFactory}
     * @throws IllegalArgumentException if objectMapper is null
     */
    public MsgPackCodec(ObjectMapper objectMapper) {
        if (objectMapper == null) {
            throw new IllegalArgumentException("objectMapper cannot be null");
        }
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String contentType() {
        return "application/msgpack";
    }

    @Override
    public byte[] marshal(Object value) {
        try {
            return objectMapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new CodecException("msgpack: cannot encode " + typeOf(value), e);
        }
    }

    @Override
    public <T> T unmarshal(byte[] data, T target) {
        if (target == null) {
            throw new IllegalArgumentException("target cannot be null");
        }
        if (data == null || data.length == 0) {
            return target;
        }
        try {
            return objectMapper.readerForUpdating(target).readValue(data);
        } catch (IOException e) {
            throw new CodecException("msgpack: cannot decode into " + typeOf(target), e);
        }
    }

    private static String typeOf(Object value) {
        return value == null ? "null" : value.getClass().getName();
    }
}
