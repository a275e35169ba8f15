package com.ryuqq.chronicle.core.type;

import com.google.protobuf.StringValue;
import com.ryuqq.chronicle.core.codec.BinaryCodec;
import com.ryuqq.chronicle.core.codec.JsonCodec;
import com.ryuqq.chronicle.core.codec.ProtobufCodec;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * TypeRegistry 등록 규칙 및 조회 테스트.
 *
 * @author Chronicle Team
 * @since 1.0.0
 */
class TypeRegistryTest {

    public static class Placed {
        private String orderId;

        public Placed() {
        }

        public Placed(String orderId) {
            this.orderId = orderId;
        }

        public String getOrderId() {
            return orderId;
        }

        public void setOrderId(String orderId) {
            this.orderId = orderId;
        }
    }

    public static class Shipped {
        private String carrier;

        public String getCarrier() {
            return carrier;
        }

        public void setCarrier(String carrier) {
            this.carrier = carrier;
        }
    }

    private static final Placed SHARED = new Placed();

    @Test
    void create_ValidDescriptors_RegistersInOrder() {
        // When
        TypeRegistry registry = TypeRegistry.create(new JsonCodec(),
            TypeDescriptor.of("order-placed", Placed::new),
            TypeDescriptor.of("order.shipped_v2", Shipped::new));

        // Then
        assertEquals(List.of("order-placed", "order.shipped_v2"), new ArrayList<>(registry.names()));
        assertEquals("json", registry.codec().name());
    }

    @Test
    void create_BlankName_ThrowsTypeInvalid() {
        TypeInvalidException exception = assertThrows(
            TypeInvalidException.class,
            () -> TypeRegistry.create(new JsonCodec(), TypeDescriptor.of(" ", Placed::new))
        );
        assertTrue(exception.getMessage().contains("missing name"));
    }

    @Test
    void create_NameWithInvalidCharacters_ThrowsTypeInvalid() {
        for (String name : List.of("order placed", "order..placed", ".order", "order.", "order*", "order>")) {
            TypeInvalidException exception = assertThrows(
                TypeInvalidException.class,
                () -> TypeRegistry.create(new JsonCodec(), TypeDescriptor.of(name, Placed::new)),
                name
            );
            assertEquals(name, exception.typeName());
        }
    }

    @Test
    void create_NullFactory_ThrowsTypeInvalid() {
        assertThrows(
            TypeInvalidException.class,
            () -> TypeRegistry.create(new JsonCodec(), TypeDescriptor.of("order-placed", null))
        );
    }

    @Test
    void create_FactoryReturnsNull_ThrowsTypeInvalid() {
        TypeInvalidException exception = assertThrows(
            TypeInvalidException.class,
            () -> TypeRegistry.create(new JsonCodec(), TypeDescriptor.of("order-placed", () -> null))
        );
        assertTrue(exception.getMessage().contains("returns null"));
    }

    @Test
    void create_FactoryReturnsSharedInstance_ThrowsTypeInvalid() {
        TypeInvalidException exception = assertThrows(
            TypeInvalidException.class,
            () -> TypeRegistry.create(new JsonCodec(), TypeDescriptor.of("order-placed", () -> SHARED))
        );
        assertTrue(exception.getMessage().contains("new instance"));
    }

    @Test
    void create_ValueKindFactories_ThrowTypeInvalid() {
        List<TypeDescriptor> invalid = List.of(
            TypeDescriptor.of("string", () -> new String("x")),
            TypeDescriptor.of("number", () -> Integer.valueOf(1000)),
            TypeDescriptor.of("list", ArrayList::new),
            TypeDescriptor.of("array", () -> new int[0])
        );
        for (TypeDescriptor descriptor : invalid) {
            TypeInvalidException exception = assertThrows(
                TypeInvalidException.class,
                () -> TypeRegistry.create(new JsonCodec(), descriptor),
                descriptor.name()
            );
            assertTrue(exception.getMessage().contains("mutable object"), descriptor.name());
        }
    }

    @Test
    void create_CodecCannotRoundTrip_ThrowsTypeInvalid() {
        TypeInvalidException exception = assertThrows(
            TypeInvalidException.class,
            () -> TypeRegistry.create(new BinaryCodec(), TypeDescriptor.of("order-placed", Placed::new))
        );
        assertTrue(exception.getMessage().contains("marshal"));
    }

    @Test
    void create_DuplicateName_ThrowsTypeInvalid() {
        TypeInvalidException exception = assertThrows(
            TypeInvalidException.class,
            () -> TypeRegistry.create(new JsonCodec(),
                TypeDescriptor.of("order-placed", Placed::new),
                TypeDescriptor.of("order-placed", Shipped::new))
        );
        assertTrue(exception.getMessage().contains("duplicate"));
    }

    @Test
    void create_SameClassUnderTwoNames_ThrowsTypeInvalid() {
        TypeInvalidException exception = assertThrows(
            TypeInvalidException.class,
            () -> TypeRegistry.create(new JsonCodec(),
                TypeDescriptor.of("order-placed", Placed::new),
                TypeDescriptor.of("order-created", Placed::new))
        );
        assertEquals("order-created", exception.typeName());
        assertTrue(exception.getMessage().contains("order-placed"));
    }

    @Test
    void create_ProtobufMessages_Registers() {
        TypeRegistry registry = TypeRegistry.create(new ProtobufCodec(),
            TypeDescriptor.of("note", () -> StringValue.newBuilder().build()));

        Object decoded = registry.unmarshalType(
            registry.marshal(StringValue.of("hello")), "note");

        assertEquals(StringValue.of("hello"), decoded);
    }

    @Test
    void lookup_RegisteredValue_ReturnsName() {
        TypeRegistry registry = TypeRegistry.create(new JsonCodec(), TypeDescriptor.of("order-placed", Placed::new));

        assertEquals("order-placed", registry.lookup(new Placed("o-1")));
        assertTrue(registry.isRegistered(new Placed()));
        assertFalse(registry.isRegistered(new Shipped()));
    }

    @Test
    void lookup_UnregisteredValue_ThrowsNoRegisteredType() {
        TypeRegistry registry = TypeRegistry.create(new JsonCodec(), TypeDescriptor.of("order-placed", Placed::new));

        NoRegisteredTypeException exception = assertThrows(
            NoRegisteredTypeException.class,
            () -> registry.lookup(new Shipped())
        );
        assertEquals(Shipped.class, exception.valueClass());
    }

    @Test
    void init_ReturnsFreshInstances() {
        TypeRegistry registry = TypeRegistry.create(new JsonCodec(), TypeDescriptor.of("order-placed", Placed::new));

        Object first = registry.init("order-placed");
        Object second = registry.init("order-placed");

        assertInstanceOf(Placed.class, first);
        assertNotSame(first, second);
    }

    @Test
    void init_UnknownName_ThrowsTypeNotRegistered() {
        TypeRegistry registry = TypeRegistry.create(new JsonCodec(), TypeDescriptor.of("order-placed", Placed::new));

        assertThrows(TypeNotRegisteredException.class, () -> registry.init("order-cancelled"));
    }

    @Test
    void unmarshalType_DecodesIntoNewValue() {
        TypeRegistry registry = TypeRegistry.create(new JsonCodec(), TypeDescriptor.of("order-placed", Placed::new));
        byte[] data = registry.marshal(new Placed("o-1"));

        Placed decoded = (Placed) registry.unmarshalType(data, "order-placed");

        assertEquals("o-1", decoded.getOrderId());
    }

    @Test
    void unmarshalType_CorruptData_ThrowsUnmarshal() {
        TypeRegistry registry = TypeRegistry.create(new JsonCodec(), TypeDescriptor.of("order-placed", Placed::new));

        assertThrows(UnmarshalException.class,
            () -> registry.unmarshalType("{not json".getBytes(), "order-placed"));
    }

    @Test
    void marshal_UnregisteredValue_ThrowsNoRegisteredType() {
        TypeRegistry registry = TypeRegistry.create(new JsonCodec(), TypeDescriptor.of("order-placed", Placed::new));

        assertThrows(NoRegisteredTypeException.class, () -> registry.marshal(new Shipped()));
    }

    @Test
    void names_IsUnmodifiable() {
        TypeRegistry registry = TypeRegistry.create(new JsonCodec(), TypeDescriptor.of("order-placed", Placed::new));
        Set<String> names = registry.names();

        assertThrows(UnsupportedOperationException.class, () -> names.add("other"));
    }
}
