/**
 * Payload codecs.
 *
 * <ul>
 *   <li>{@link com.ryuqq.chronicle.core.codec.JsonCodec} - Jackson JSON, binds into factory-made instances</li>
 *   <li>{@link com.ryuqq.chronicle.core.codec.BinaryCodec} - {@code byte[]} passthrough</li>
 *   <li>{@link com.ryuqq.chronicle.core.codec.ProtobufCodec} - generated protobuf messages</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.ryuqq.chronicle.core.codec;
