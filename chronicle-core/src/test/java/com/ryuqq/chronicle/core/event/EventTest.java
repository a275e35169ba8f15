package com.ryuqq.chronicle.core.event;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Event Record 테스트.
 *
 * @author Chronicle Team
 * @since 1.0.0
 */
class EventTest {

    @Test
    void of_DataOnly_LeavesEnvelopeFieldsEmpty() {
        // When
        Event event = Event.of("payload");

        // Then
        assertNull(event.id());
        assertNull(event.type());
        assertNull(event.time());
        assertEquals("payload", event.data());
        assertTrue(event.meta().isEmpty());
        assertEquals(0, event.sequence());
    }

    @Test
    void builder_AllFields_CreatesEvent() {
        Instant now = Instant.parse("2024-05-01T12:00:00Z");

        Event event = Event.builder()
            .id("evt-1")
            .type("order-placed")
            .time(now)
            .data("payload")
            .meta("user", "alice")
            .meta("tenant", "acme")
            .build();

        assertEquals("evt-1", event.id());
        assertEquals("order-placed", event.type());
        assertEquals(now, event.time());
        assertEquals(Map.of("user", "alice", "tenant", "acme"), event.meta());
    }

    @Test
    void toBuilder_CopiesAndOverrides() {
        Event original = Event.builder().id("evt-1").data("payload").meta("user", "alice").build();

        Event copy = original.toBuilder().type("order-placed").build();

        assertEquals("evt-1", copy.id());
        assertEquals("order-placed", copy.type());
        assertEquals(original.meta(), copy.meta());
        assertNull(original.type());
    }

    @Test
    void constructor_MetaIsDefensivelyCopied() {
        Map<String, String> meta = new HashMap<>();
        meta.put("user", "alice");

        Event event = new Event(null, null, null, "payload", meta, null, 0);
        meta.put("user", "bob");

        assertEquals("alice", event.meta().get("user"));
        assertThrows(UnsupportedOperationException.class, () -> event.meta().put("x", "y"));
    }

    @Test
    void constructor_NullMetaValue_ThrowsException() {
        Map<String, String> meta = new HashMap<>();
        meta.put("user", null);

        assertThrows(IllegalArgumentException.class,
            () -> new Event(null, null, null, "payload", meta, null, 0));
    }

    @Test
    void constructor_NegativeSequence_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> new Event(null, null, null, "payload", null, null, -1)
        );
        assertTrue(exception.getMessage().contains("sequence"));
    }

    @Test
    void dataAs_WrongType_ThrowsClassCastException() {
        Event event = Event.of("payload");

        assertEquals("payload", event.dataAs(String.class));
        assertThrows(ClassCastException.class, () -> event.dataAs(Integer.class));
    }
}
