package com.ryuqq.chronicle.testkit.fixture;

import com.ryuqq.chronicle.core.codec.JsonCodec;
import com.ryuqq.chronicle.core.type.TypeDescriptor;
import com.ryuqq.chronicle.core.type.TypeRegistry;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

/**
 * Shared test fixtures.
 */
public final class Fixtures {

    /** Fixed instant used by {@link #fixedClock()}. */
    public static final Instant NOW = Instant.parse("2024-05-01T12:00:00.123456789Z");

    private Fixtures() {
    }

    /**
     * Registry with {@link OrderPlaced} and {@link OrderShipped} on the JSON codec.
     */
    public static TypeRegistry orderRegistry() {
        return TypeRegistry.create(new JsonCodec(),
            TypeDescriptor.of(OrderPlaced.TYPE, OrderPlaced::new),
            TypeDescriptor.of(OrderShipped.TYPE, OrderShipped::new));
    }

    public static Clock fixedClock() {
        return Clock.fixed(NOW, ZoneOffset.UTC);
    }
}
