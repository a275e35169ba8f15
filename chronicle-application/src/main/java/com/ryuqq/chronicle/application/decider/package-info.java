/**
 * 명령 결정 (Decider) 패턴 지원.
 *
 * <p><strong>핵심 컴포넌트:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.chronicle.application.decider.Command} - 상태 변경 의도</li>
 *   <li>{@link com.ryuqq.chronicle.application.decider.Decider} - 명령 → 이벤트 결정 함수</li>
 *   <li>{@link com.ryuqq.chronicle.application.decider.CommandHandler} - 재구성/결정/낙관적 append 실행기</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.ryuqq.chronicle.application.decider;
