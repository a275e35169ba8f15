package com.ryuqq.chronicle.core.codec;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Immutable table of codecs keyed by {@link Codec#name()}.
 *
 * <p>The table is built explicitly by the caller and handed to whoever needs to
 * resolve a codec by name; there is no process-wide registry.</p>
 *
 * <pre>
 * Codecs codecs = Codecs.defaults();
 * TypeRegistry registry = TypeRegistry.create(codecs.get("json"), descriptors);
 * </pre>
 *
 * @author Chronicle Team
 * @since 1.0.0
 */
public final class Codecs {

    private final Map<String, Codec> byName;

    private Codecs(Map<String, Codec> byName) {
        this.byName = Collections.unmodifiableMap(byName);
    }

    /**
     * Builds a table from the given codecs.
     *
     * @param codecs codecs to index
     * @return codec table
     * @throws IllegalArgumentException if a codec is null or two codecs share a name
     */
    public static Codecs of(Codec... codecs) {
        Map<String, Codec> byName = new LinkedHashMap<>();
        for (Codec codec : codecs) {
            if (codec == null) {
                throw new IllegalArgumentException("codec cannot be null");
            }
            if (byName.putIfAbsent(codec.name(), codec) != null) {
                throw new IllegalArgumentException("duplicate codec name: " + codec.name());
            }
        }
        return new Codecs(byName);
    }

    /**
     * JSON, MessagePack, binary and protobuf codecs with default settings.
     *
     * @return codec table
     */
    public static Codecs defaults() {
        return of(new JsonCodec(), new MsgPackCodec(), new BinaryCodec(), new ProtobufCodec());
    }

    /**
     * Resolves a codec by name.
     *
     * @param name codec name
     * @return the codec
     * @throws CodecNotRegisteredException if no codec has this name
     */
    public Codec get(String name) {
        Codec codec = byName.get(name);
        if (codec == null) {
            throw new CodecNotRegisteredException(name);
        }
        return codec;
    }

    public boolean contains(String name) {
        return byName.containsKey(name);
    }

    public Set<String> names() {
        return byName.keySet();
    }
}
