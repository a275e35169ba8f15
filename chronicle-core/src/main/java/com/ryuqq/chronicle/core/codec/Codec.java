package com.ryuqq.chronicle.core.codec;

/**
 * Byte-level serialization strategy for event payloads.
 *
 * <p>A codec is a leaf dependency of the type registry and the event store.
 * Implementations must be stateless or thread-safe: a single instance is shared
 * by every event store created from the same runtime.</p>
 *
 * <p><strong>Unmarshal contract:</strong></p>
 * <ul>
 *   <li>{@code target} is a freshly allocated value produced by a type factory</li>
 *   <li>Formats that can bind into an existing object populate {@code target} in place
 *       and return it, so defaults set by the factory survive absent fields</li>
 *   <li>Formats built on immutable values return a new populated value of the same class</li>
 * </ul>
 *
 * @author Chronicle Team
 * @since 1.0.0
 */
public interface Codec {

    /**
     * Identifier written to the {@code chronicle-event-codec} header.
     *
     * @return codec name (e.g. {@code json})
     */
    String name();

    /**
     * MIME type of the encoded payload.
     *
     * @return content type (e.g. {@code application/json})
     */
    String contentType();

    /**
     * Encodes a value.
     *
     * @param value value to encode
     * @return encoded bytes
     * @throws CodecException if the value cannot be encoded
     */
    byte[] marshal(Object value);

    /**
     * Decodes bytes into the target value.
     *
     * @param data encoded bytes
     * @param target value to populate
     * @param <T> value type
     * @return the populated value ({@code target} itself or a new instance of the same class)
     * @throws CodecException if the bytes cannot be decoded into the target
     */
    <T> T unmarshal(byte[] data, T target);
}
