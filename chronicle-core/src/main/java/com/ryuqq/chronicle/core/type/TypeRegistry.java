package com.ryuqq.chronicle.core.type;

import com.ryuqq.chronicle.core.codec.Codec;
import com.ryuqq.chronicle.core.codec.CodecException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Maps symbolic type names to domain value types and back.
 *
 * <p>The registry is what lets the event store resolve a type name from a typed payload
 * on append, and rebuild a typed payload from a type name on load, using one source of
 * truth for the mapping.</p>
 *
 * <p><strong>Indexes:</strong></p>
 * <ul>
 *   <li><strong>byName:</strong> name → factory (O(1), used by {@link #init(String)})</li>
 *   <li><strong>byClass:</strong> concrete class produced by the factory → name
 *       (O(1), used by {@link #lookup(Object)})</li>
 * </ul>
 *
 * <p><strong>Registration rules</strong> (checked in {@link #create}):</p>
 * <ul>
 *   <li>Name is not blank and matches {@code ^[\w-]+(\.[\w-]+)*$}</li>
 *   <li>Factory is present and returns a non-null, object-shaped, mutable value</li>
 *   <li>Every call to the factory allocates a new instance</li>
 *   <li>The zero value survives a marshal → unmarshal round trip through the codec</li>
 *   <li>Names are unique and no class is bound to two names</li>
 * </ul>
 *
 * <p>Construction is all-or-nothing and the registry is immutable afterwards, so one
 * instance can be shared by any number of threads and event stores.</p>
 *
 * @author Chronicle Team
 * @since 1.0.0
 */
public final class TypeRegistry {

    private static final Logger log = LoggerFactory.getLogger(TypeRegistry.class);

    private static final Pattern NAME_PATTERN = Pattern.compile("^[\\w-]+(\\.[\\w-]+)*$");

    private static final Set<Class<?>> VALUE_KINDS = Set.of(
        Number.class, Boolean.class, Character.class, CharSequence.class,
        Collection.class, Map.class, Class.class, Optional.class, Enum.class
    );

    private final Codec codec;
    private final Map<String, Supplier<?>> byName;
    private final Map<Class<?>, String> byClass;

    private TypeRegistry(Codec codec, Map<String, Supplier<?>> byName, Map<Class<?>, String> byClass) {
        this.codec = codec;
        this.byName = Collections.unmodifiableMap(byName);
        this.byClass = Collections.unmodifiableMap(byClass);
    }

    /**
     * Builds a registry from the given descriptors.
     *
     * @param codec codec used for round-trip validation and all (un)marshaling
     * @param descriptors descriptors to register
     * @return the registry
     * @throws IllegalArgumentException if codec or descriptors is null
     * @throws TypeInvalidException on the first descriptor that breaks a registration rule
     */
    public static TypeRegistry create(Codec codec, Collection<TypeDescriptor> descriptors) {
        if (codec == null) {
            throw new IllegalArgumentException("codec cannot be null");
        }
        if (descriptors == null) {
            throw new IllegalArgumentException("descriptors cannot be null");
        }

        Map<String, Supplier<?>> byName = new LinkedHashMap<>();
        Map<Class<?>, String> byClass = new HashMap<>();

        for (TypeDescriptor descriptor : descriptors) {
            if (descriptor == null) {
                throw new TypeInvalidException(null, "descriptor is null");
            }
            String name = descriptor.name();
            Class<?> valueClass = validate(codec, descriptor);

            if (byName.containsKey(name)) {
                throw new TypeInvalidException(name, "duplicate type name");
            }
            String existing = byClass.get(valueClass);
            if (existing != null) {
                throw new TypeInvalidException(name,
                    valueClass.getName() + " is already registered as \"" + existing + "\"");
            }

            byName.put(name, descriptor.factory());
            byClass.put(valueClass, name);
        }

        log.debug("Type registry created with {} types using codec {}", byName.size(), codec.name());
        return new TypeRegistry(codec, byName, byClass);
    }

    /**
     * Varargs form of {@link #create(Codec, Collection)}.
     */
    public static TypeRegistry create(Codec codec, TypeDescriptor... descriptors) {
        if (descriptors == null) {
            throw new IllegalArgumentException("descriptors cannot be null");
        }
        return create(codec, Arrays.asList(descriptors));
    }

    private static Class<?> validate(Codec codec, TypeDescriptor descriptor) {
        String name = descriptor.name();
        if (name == null || name.isBlank()) {
            throw new TypeInvalidException(name, "missing name");
        }
        if (!NAME_PATTERN.matcher(name).matches()) {
            throw new TypeInvalidException(name, "name has invalid characters");
        }

        Supplier<?> factory = descriptor.factory();
        if (factory == null) {
            throw new TypeInvalidException(name, "factory is null");
        }

        Object first;
        Object second;
        try {
            first = factory.get();
            second = factory.get();
        } catch (RuntimeException e) {
            throw new TypeInvalidException(name, "factory failed: " + e.getMessage(), e);
        }
        if (first == null || second == null) {
            throw new TypeInvalidException(name, "factory returns null");
        }

        Class<?> valueClass = first.getClass();
        if (!isObjectShaped(valueClass)) {
            throw new TypeInvalidException(name, "value type must be a mutable object, got " + valueClass.getName());
        }
        if (first == second) {
            throw new TypeInvalidException(name, "factory must allocate a new instance per call");
        }
        if (second.getClass() != valueClass) {
            throw new TypeInvalidException(name, "factory returns values of different classes");
        }

        byte[] data;
        try {
            data = codec.marshal(first);
        } catch (CodecException e) {
            throw new TypeInvalidException(name, "failed to marshal with codec " + codec.name() + ": " + e.getMessage(), e);
        }
        Object decoded;
        try {
            decoded = codec.unmarshal(data, second);
        } catch (CodecException e) {
            throw new TypeInvalidException(name, "failed to unmarshal with codec " + codec.name() + ": " + e.getMessage(), e);
        }
        if (decoded == null || decoded.getClass() != valueClass) {
            throw new TypeInvalidException(name, "codec " + codec.name() + " did not round-trip to " + valueClass.getName());
        }

        return valueClass;
    }

    private static boolean isObjectShaped(Class<?> valueClass) {
        if (valueClass.isArray() || valueClass.isEnum() || valueClass.isPrimitive()) {
            return false;
        }
        for (Class<?> kind : VALUE_KINDS) {
            if (kind.isAssignableFrom(valueClass)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Allocates a fresh, defaulted value for a registered name.
     *
     * @param name registered type name
     * @return new value
     * @throws TypeNotRegisteredException if the name is unknown
     */
    public Object init(String name) {
        Supplier<?> factory = byName.get(name);
        if (factory == null) {
            throw new TypeNotRegisteredException(name);
        }
        return factory.get();
    }

    /**
     * Resolves the registered name of a value by its concrete class.
     *
     * @param value value to resolve
     * @return registered name
     * @throws NoRegisteredTypeException if the value's class was never registered
     */
    public String lookup(Object value) {
        Class<?> valueClass = value == null ? null : value.getClass();
        String name = valueClass == null ? null : byClass.get(valueClass);
        if (name == null) {
            throw new NoRegisteredTypeException(valueClass);
        }
        return name;
    }

    /**
     * Checks whether a value's class has a registered name.
     *
     * @param value value to check
     * @return true if {@link #lookup(Object)} would succeed
     */
    public boolean isRegistered(Object value) {
        return value != null && byClass.containsKey(value.getClass());
    }

    /**
     * Encodes a registered value with the registry's codec.
     *
     * @param value value to encode
     * @return encoded bytes
     * @throws NoRegisteredTypeException if the value's class is not registered
     * @throws MarshalException if the codec fails
     */
    public byte[] marshal(Object value) {
        lookup(value);
        try {
            return codec.marshal(value);
        } catch (CodecException e) {
            throw new MarshalException(value.getClass(), e);
        }
    }

    /**
     * Decodes bytes into a registered value with the registry's codec.
     *
     * @param data encoded bytes
     * @param target registered value to populate
     * @param <T> value type
     * @return the populated value
     * @throws NoRegisteredTypeException if the target's class is not registered
     * @throws UnmarshalException if the codec fails
     */
    public <T> T unmarshal(byte[] data, T target) {
        return unmarshal(data, target, codec);
    }

    /**
     * Decodes bytes into a registered value with an explicit codec, for payloads
     * written under a different codec than the registry's.
     */
    public <T> T unmarshal(byte[] data, T target, Codec with) {
        if (with == null) {
            throw new IllegalArgumentException("codec cannot be null");
        }
        lookup(target);
        try {
            return with.unmarshal(data, target);
        } catch (CodecException e) {
            throw new UnmarshalException(target.getClass(), e);
        }
    }

    /**
     * Allocates a value for the name and decodes the bytes into it.
     *
     * @param data encoded bytes
     * @param name registered type name
     * @return the decoded value
     * @throws TypeNotRegisteredException if the name is unknown
     * @throws UnmarshalException if the codec fails
     */
    public Object unmarshalType(byte[] data, String name) {
        return unmarshal(data, init(name));
    }

    /**
     * {@link #unmarshalType(byte[], String)} with an explicit codec.
     */
    public Object unmarshalType(byte[] data, String name, Codec with) {
        return unmarshal(data, init(name), with);
    }

    public Codec codec() {
        return codec;
    }

    /**
     * @return registered names in registration order
     */
    public Set<String> names() {
        return byName.keySet();
    }
}
