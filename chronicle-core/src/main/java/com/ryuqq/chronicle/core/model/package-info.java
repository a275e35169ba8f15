/**
 * Chronicle 공통 값 객체 패키지.
 *
 * <p>EventStore 호출 전반에서 공유되는 작은 값 객체와 전략 인터페이스를 정의합니다.</p>
 *
 * <ul>
 *   <li>{@link com.ryuqq.chronicle.core.model.Deadline} - 호출 마감 시각</li>
 *   <li>{@link com.ryuqq.chronicle.core.model.IdGenerator} - 이벤트 ID 생성 전략</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Chronicle Team
 */
package com.ryuqq.chronicle.core.model;
