/**
 * Chronicle 런타임 및 설정.
 *
 * <p><strong>핵심 컴포넌트:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.chronicle.application.runtime.Chronicle} - EventStore 생성/관리 진입점</li>
 *   <li>{@link com.ryuqq.chronicle.application.runtime.ChronicleConfig} - 공통 설정 (타입 레지스트리, ID, 시계, timeout)</li>
 * </ul>
 *
 * <p><strong>브로커 구현체:</strong></p>
 * <p>adapter-inmemory 모듈의 {@code InMemoryLogBroker}, adapter-nats 모듈의 {@code JetStreamLogBroker}에서 제공됩니다.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.chronicle.application.runtime;
