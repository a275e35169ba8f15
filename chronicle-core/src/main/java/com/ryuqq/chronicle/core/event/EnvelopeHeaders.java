package com.ryuqq.chronicle.core.event;

import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Header names and time format of the wire envelope.
 *
 * <p>Envelope fields travel as message headers, never in the body, so a broker can
 * deliver headers-only views of the log. Arbitrary metadata entries are multiplexed
 * onto the header namespace under {@link #META_PREFIX}; the prefix is stripped again
 * when an event is unpacked.</p>
 *
 * <p>Broker headers only carry printable ASCII, and keys cannot hold spaces or {@code ':'}.
 * Metadata keys and values are therefore form-encoded as UTF-8 on the wire
 * ({@code "홍길동"} travels as {@code "%ED%99%8D%EA%B8%B8%EB%8F%99"}); plain
 * alphanumeric entries are unchanged. Ids and type names are written verbatim and must
 * pass {@link #isHeaderSafe(String)}.</p>
 *
 * <p>Times are written as fixed-width UTC with nanosecond precision
 * ({@code 2024-05-01T12:00:00.000000000Z}), so header values sort lexically in time order.</p>
 *
 * @author Chronicle Team
 * @since 1.0.0
 */
public final class EnvelopeHeaders {

    /** Broker idempotency key; NATS JetStream deduplicates on this header natively. */
    public static final String MSG_ID = "Nats-Msg-Id";
    public static final String EVENT_TYPE = "chronicle-event-type";
    public static final String EVENT_TIME = "chronicle-event-time";
    public static final String EVENT_CODEC = "chronicle-event-codec";
    public static final String META_PREFIX = "chronicle-meta-";

    private static final DateTimeFormatter TIME_FORMAT =
        DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSSSSSSS'Z'").withZone(ZoneOffset.UTC);

    private EnvelopeHeaders() {
    }

    public static String formatTime(Instant time) {
        return TIME_FORMAT.format(time);
    }

    /**
     * @throws DateTimeParseException if the value is not in the envelope time format
     */
    public static Instant parseTime(String value) {
        return TIME_FORMAT.parse(value, Instant::from);
    }

    public static String metaHeader(String key) {
        return META_PREFIX + encode(key);
    }

    public static boolean isMetaHeader(String header) {
        return header.startsWith(META_PREFIX) && header.length() > META_PREFIX.length();
    }

    /**
     * @throws IllegalArgumentException if the encoded key is malformed
     */
    public static String metaKey(String header) {
        return decode(header.substring(META_PREFIX.length()));
    }

    public static String encodeMetaValue(String value) {
        return encode(value);
    }

    /**
     * @throws IllegalArgumentException if the value is not validly encoded
     */
    public static String decodeMetaValue(String value) {
        return decode(value);
    }

    /**
     * Whether a value can be written verbatim as a header value (printable ASCII or space).
     */
    public static boolean isHeaderSafe(String value) {
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c < 0x20 || c > 0x7E) {
                return false;
            }
        }
        return true;
    }

    private static String encode(String raw) {
        return URLEncoder.encode(raw, StandardCharsets.UTF_8);
    }

    private static String decode(String encoded) {
        return URLDecoder.decode(encoded, StandardCharsets.UTF_8);
    }
}
