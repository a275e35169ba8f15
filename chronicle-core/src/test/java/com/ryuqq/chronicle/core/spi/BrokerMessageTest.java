package com.ryuqq.chronicle.core.spi;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BrokerMessageTest {

    @Test
    void constructor_WildcardSubject_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new BrokerMessage("orders.*", Map.of(), new byte[0]));
        assertThrows(IllegalArgumentException.class, () -> new BrokerMessage("orders.>", Map.of(), new byte[0]));
    }

    @Test
    void constructor_NullHeadersAndData_DefaultToEmpty() {
        BrokerMessage message = new BrokerMessage("orders.1", null, null);

        assertTrue(message.headers().isEmpty());
        assertEquals(0, message.data().length);
        assertNull(message.header("missing"));
    }

    @Test
    void preconditionFailed_MessageNamesWrongLastSequence() {
        PreconditionFailedException exception = new PreconditionFailedException("orders.1", 2, 5);

        assertTrue(exception.getMessage().startsWith("wrong last sequence"));
        assertEquals(5, exception.actualSequence());
    }
}
