package com.ryuqq.chronicle.application.store;

import com.ryuqq.chronicle.core.codec.BinaryCodec;
import com.ryuqq.chronicle.core.codec.Codec;
import com.ryuqq.chronicle.core.codec.CodecException;
import com.ryuqq.chronicle.core.codec.Codecs;
import com.ryuqq.chronicle.core.event.EnvelopeHeaders;
import com.ryuqq.chronicle.core.event.Event;
import com.ryuqq.chronicle.core.spi.BrokerMessage;
import com.ryuqq.chronicle.core.spi.StoredMessage;
import com.ryuqq.chronicle.core.type.MarshalException;
import com.ryuqq.chronicle.core.type.TypeRegistry;
import com.ryuqq.chronicle.core.type.UnmarshalException;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Converts between {@link Event} and the broker message envelope.
 *
 * <p>Expects fully completed events on {@link #pack}: id, type and time already set.</p>
 */
final class EnvelopePacker {

    private static final Codec BINARY = new BinaryCodec();

    private final TypeRegistry registry;
    private final Codecs codecs;

    EnvelopePacker(TypeRegistry registry, Codecs codecs) {
        this.registry = registry;
        this.codecs = codecs;
    }

    String codecName() {
        return registry == null ? BINARY.name() : registry.codec().name();
    }

    /**
     * @throws IllegalArgumentException if the id or type cannot travel as a header value
     */
    BrokerMessage pack(String subject, Event event) {
        requireHeaderSafe("event id", event.id());
        requireHeaderSafe("event type", event.type());

        byte[] data;
        if (registry != null) {
            data = registry.marshal(event.data());
        } else {
            try {
                data = BINARY.marshal(event.data());
            } catch (CodecException e) {
                throw new MarshalException(event.data().getClass(), e);
            }
        }

        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(EnvelopeHeaders.MSG_ID, event.id());
        headers.put(EnvelopeHeaders.EVENT_TYPE, event.type());
        headers.put(EnvelopeHeaders.EVENT_TIME, EnvelopeHeaders.formatTime(event.time()));
        headers.put(EnvelopeHeaders.EVENT_CODEC, codecName());
        for (Map.Entry<String, String> entry : event.meta().entrySet()) {
            headers.put(EnvelopeHeaders.metaHeader(entry.getKey()), EnvelopeHeaders.encodeMetaValue(entry.getValue()));
        }

        return new BrokerMessage(subject, headers, data);
    }

    Event unpack(StoredMessage message) {
        String type = message.header(EnvelopeHeaders.EVENT_TYPE);
        String timeValue = message.header(EnvelopeHeaders.EVENT_TIME);

        Instant time;
        try {
            time = timeValue == null ? null : EnvelopeHeaders.parseTime(timeValue);
        } catch (DateTimeParseException e) {
            throw new UnmarshalException("invalid event time header \"" + timeValue + "\" at sequence "
                    + message.sequence(), e);
        }

        Object data;
        if (registry == null) {
            byte[] raw = message.data();
            data = raw == null ? new byte[0] : Arrays.copyOf(raw, raw.length);
        } else {
            if (type == null || type.isBlank()) {
                throw new UnmarshalException("missing event type header at sequence " + message.sequence(), null);
            }
            data = registry.unmarshalType(message.data(), type, codecFor(message.header(EnvelopeHeaders.EVENT_CODEC)));
        }

        Map<String, String> meta = new HashMap<>();
        for (Map.Entry<String, String> header : message.headers().entrySet()) {
            if (EnvelopeHeaders.isMetaHeader(header.getKey())) {
                try {
                    meta.put(EnvelopeHeaders.metaKey(header.getKey()),
                        EnvelopeHeaders.decodeMetaValue(header.getValue()));
                } catch (IllegalArgumentException e) {
                    throw new UnmarshalException("malformed metadata header \"" + header.getKey()
                        + "\" at sequence " + message.sequence(), e);
                }
            }
        }

        return new Event(
            message.header(EnvelopeHeaders.MSG_ID),
            type,
            time,
            data,
            meta,
            message.subject(),
            message.sequence()
        );
    }

    private static void requireHeaderSafe(String field, String value) {
        if (!EnvelopeHeaders.isHeaderSafe(value)) {
            throw new IllegalArgumentException(field + " must be printable ASCII (current: " + value + ")");
        }
    }

    private Codec codecFor(String name) {
        if (name == null || name.equals(registry.codec().name())) {
            return registry.codec();
        }
        return codecs.get(name);
    }
}
