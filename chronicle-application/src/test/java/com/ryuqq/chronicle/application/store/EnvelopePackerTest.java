package com.ryuqq.chronicle.application.store;

import com.ryuqq.chronicle.core.codec.BinaryValue;
import com.ryuqq.chronicle.core.codec.CodecNotRegisteredException;
import com.ryuqq.chronicle.core.codec.Codecs;
import com.ryuqq.chronicle.core.codec.JsonCodec;
import com.ryuqq.chronicle.core.event.EnvelopeHeaders;
import com.ryuqq.chronicle.core.event.Event;
import com.ryuqq.chronicle.core.spi.BrokerMessage;
import com.ryuqq.chronicle.core.spi.StoredMessage;
import com.ryuqq.chronicle.core.type.MarshalException;
import com.ryuqq.chronicle.core.type.TypeDescriptor;
import com.ryuqq.chronicle.core.type.TypeRegistry;
import com.ryuqq.chronicle.core.type.UnmarshalException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * EnvelopePacker 테스트.
 *
 * @author Chronicle Team
 * @since 1.0.0
 */
class EnvelopePackerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00.5Z");

    /**
     * JSON과 binary 양쪽으로 인코딩 가능한 타입.
     */
    public static class Note implements BinaryValue {
        private String text;

        public String getText() {
            return text;
        }

        public void setText(String text) {
            this.text = text;
        }

        @Override
        public byte[] toBytes() {
            return text == null ? new byte[0] : text.getBytes(StandardCharsets.UTF_8);
        }

        @Override
        public void fromBytes(byte[] data) {
            this.text = new String(data, StandardCharsets.UTF_8);
        }
    }

    private final TypeRegistry registry = TypeRegistry.create(new JsonCodec(), TypeDescriptor.of("note", Note::new));
    private final EnvelopePacker packer = new EnvelopePacker(registry, Codecs.defaults());
    private final EnvelopePacker rawPacker = new EnvelopePacker(null, Codecs.defaults());

    private static StoredMessage stored(Map<String, String> headers, String body) {
        return new StoredMessage("notes", "notes.1", 7, headers, body.getBytes(StandardCharsets.UTF_8));
    }

    private static Map<String, String> headers(String codec) {
        Map<String, String> headers = new HashMap<>();
        headers.put(EnvelopeHeaders.MSG_ID, "id-7");
        headers.put(EnvelopeHeaders.EVENT_TYPE, "note");
        headers.put(EnvelopeHeaders.EVENT_TIME, EnvelopeHeaders.formatTime(NOW));
        if (codec != null) {
            headers.put(EnvelopeHeaders.EVENT_CODEC, codec);
        }
        return headers;
    }

    @Test
    void unpack_RestoresEnvelopeAndStripsMetaPrefix() {
        Map<String, String> headers = headers("json");
        headers.put("chronicle-meta-user", "alice");
        headers.put("Unrelated-Header", "ignored");

        Event event = packer.unpack(stored(headers, "{\"text\":\"hi\"}"));

        assertThat(event.id()).isEqualTo("id-7");
        assertThat(event.type()).isEqualTo("note");
        assertThat(event.time()).isEqualTo(NOW);
        assertThat(event.subject()).isEqualTo("notes.1");
        assertThat(event.sequence()).isEqualTo(7);
        assertThat(event.meta()).containsExactly(Map.entry("user", "alice"));
        assertThat(event.dataAs(Note.class).getText()).isEqualTo("hi");
    }

    @Test
    void unpack_MissingCodecHeader_UsesRegistryCodec() {
        Event event = packer.unpack(stored(headers(null), "{\"text\":\"hi\"}"));

        assertThat(event.dataAs(Note.class).getText()).isEqualTo("hi");
    }

    @Test
    void unpack_OtherKnownCodec_DecodesWithThatCodec() {
        Event event = packer.unpack(stored(headers("binary"), "raw text"));

        assertThat(event.dataAs(Note.class).getText()).isEqualTo("raw text");
    }

    @Test
    void unpack_UnknownCodec_ThrowsCodecNotRegistered() {
        assertThatThrownBy(() -> packer.unpack(stored(headers("avro"), "x")))
            .isInstanceOf(CodecNotRegisteredException.class);
    }

    @Test
    void unpack_InvalidTimeHeader_ThrowsUnmarshal() {
        Map<String, String> headers = headers("json");
        headers.put(EnvelopeHeaders.EVENT_TIME, "not-a-time");

        assertThatThrownBy(() -> packer.unpack(stored(headers, "{}")))
            .isInstanceOf(UnmarshalException.class)
            .hasMessageContaining("not-a-time");
    }

    @Test
    void unpack_MissingTypeHeaderWithRegistry_ThrowsUnmarshal() {
        Map<String, String> headers = headers("json");
        headers.remove(EnvelopeHeaders.EVENT_TYPE);

        assertThatThrownBy(() -> packer.unpack(stored(headers, "{}")))
            .isInstanceOf(UnmarshalException.class)
            .hasMessageContaining("type");
    }

    @Test
    void unpack_WithoutRegistry_ReturnsRawBytes() {
        Event event = rawPacker.unpack(stored(headers("binary"), "raw"));

        assertThat(event.data()).isEqualTo("raw".getBytes(StandardCharsets.UTF_8));
        assertThat(event.type()).isEqualTo("note");
    }

    @Test
    void pack_WithoutRegistry_RequiresBytes() {
        Event event = Event.builder().id("id-1").type("note").time(NOW).data("text").build();

        assertThatThrownBy(() -> rawPacker.pack("notes.1", event))
            .isInstanceOf(MarshalException.class);
    }

    @Test
    void pack_WithoutRegistry_WritesBinaryCodecHeader() {
        Event event = Event.builder().id("id-1").type("note").time(NOW).data(new byte[] {1, 2}).build();

        BrokerMessage message = rawPacker.pack("notes.1", event);

        assertThat(message.header(EnvelopeHeaders.EVENT_CODEC)).isEqualTo("binary");
        assertThat(message.data()).containsExactly(1, 2);
    }

    @Test
    void pack_NonAsciiMeta_EncodesKeysAndValuesForHeaders() {
        Event event = Event.builder().id("id-1").type("note").time(NOW).data(new byte[] {1})
            .meta("user name", "홍길동")
            .meta("a:b", "x")
            .build();

        BrokerMessage message = rawPacker.pack("notes.1", event);

        assertThat(message.headers().keySet())
            .contains("chronicle-meta-user+name", "chronicle-meta-a%3Ab")
            .allMatch(EnvelopeHeaders::isHeaderSafe);
        assertThat(message.headers().values()).allMatch(EnvelopeHeaders::isHeaderSafe);
        assertThat(message.header("chronicle-meta-user+name")).isEqualTo("%ED%99%8D%EA%B8%B8%EB%8F%99");
    }

    @Test
    void unpack_EncodedMeta_RestoresOriginalEntries() {
        Event event = Event.builder().id("id-1").type("note").time(NOW).data(new Note())
            .meta("user name", "홍길동")
            .meta("a:b", "50% off")
            .build();
        BrokerMessage packed = packer.pack("notes.1", event);

        Event unpacked = packer.unpack(new StoredMessage("notes", "notes.1", 1, packed.headers(), packed.data()));

        assertThat(unpacked.meta())
            .containsEntry("user name", "홍길동")
            .containsEntry("a:b", "50% off")
            .hasSize(2);
    }

    @Test
    void unpack_MalformedMetaEncoding_ThrowsUnmarshal() {
        Map<String, String> headers = headers("json");
        headers.put("chronicle-meta-user", "%zz");

        assertThatThrownBy(() -> packer.unpack(stored(headers, "{}")))
            .isInstanceOf(UnmarshalException.class)
            .hasMessageContaining("chronicle-meta-user");
    }

    @Test
    void pack_NonAsciiIdOrType_RejectedBeforePublish() {
        Event badId = Event.builder().id("이벤트-1").type("note").time(NOW).data(new byte[] {1}).build();
        Event badType = Event.builder().id("id-1").type("주문\n").time(NOW).data(new byte[] {1}).build();

        assertThatThrownBy(() -> rawPacker.pack("notes.1", badId))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("event id");
        assertThatThrownBy(() -> rawPacker.pack("notes.1", badType))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("event type");
    }
}
