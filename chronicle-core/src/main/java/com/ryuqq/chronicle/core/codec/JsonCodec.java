package com.ryuqq.chronicle.core.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;

/**
 * JSON codec backed by Jackson.
 *
 * <p>Decoding uses {@link ObjectMapper#readerForUpdating(Object)}, binding the document
 * into the factory-produced instance: properties missing from the document keep the
 * defaults the factory applied. An empty payload leaves the target untouched.</p>
 *
 * @author Chronicle Team
 * @since 1.0.0
 */
public final class JsonCodec implements Codec {

    public static final String NAME = "json";

    private final ObjectMapper objectMapper;

    /**
     * Creates a codec with the default mapper (JSR-310 support, ISO dates,
     * unknown properties ignored).
     */
    public JsonCodec() {
        this(createDefaultObjectMapper());
    }

    /**
     * Creates a codec with a caller-configured mapper.
     *
     * @param objectMapper mapper to use
     * @throws IllegalArgumentException if objectMapper is null
     */
    public JsonCodec(ObjectMapper objectMapper) {
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
        return "application/json";
    }

    @Override
    public byte[] marshal(Object value) {
        try {
            return objectMapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new CodecException("json: cannot encode " + typeOf(value), e);
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
            throw new CodecException("json: cannot decode into " + typeOf(target), e);
        }
    }

    private static String typeOf(Object value) {
        return value == null ? "null" : value.getClass().getName();
    }

    private static ObjectMapper createDefaultObjectMapper() {
        return configure(new ObjectMapper());
    }

    /**
     * Applies the default mapper settings shared by the Jackson-backed codecs.
     */
    static ObjectMapper configure(ObjectMapper mapper) {
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }
}
