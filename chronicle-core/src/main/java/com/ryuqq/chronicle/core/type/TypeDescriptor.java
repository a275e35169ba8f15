package com.ryuqq.chronicle.core.type;

import java.util.function.Supplier;

/**
 * Binds a symbolic type name to the factory that produces a fresh, defaulted
 * instance of the domain value.
 *
 * <p>Descriptors are only validated when handed to {@link TypeRegistry#create}; the
 * record itself accepts anything so that all problems surface through
 * {@link TypeInvalidException} with the offending name.</p>
 *
 * <pre>
 * TypeDescriptor.of("order-placed", OrderPlaced::new)
 * </pre>
 *
 * @param name symbolic name (e.g. {@code order-placed}, {@code orders.v2.placed})
 * @param factory zero-value factory; must allocate a new mutable instance per call
 *
 * @author Chronicle Team
 * @since 1.0.0
 */
public record TypeDescriptor(String name, Supplier<?> factory) {

    public static TypeDescriptor of(String name, Supplier<?> factory) {
        return new TypeDescriptor(name, factory);
    }
}
