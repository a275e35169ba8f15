package com.ryuqq.chronicle.application.decider;

import com.ryuqq.chronicle.application.store.AppendOptions;
import com.ryuqq.chronicle.application.store.EventStore;
import com.ryuqq.chronicle.application.store.LoadResult;
import com.ryuqq.chronicle.application.store.SequenceConflictException;
import com.ryuqq.chronicle.core.event.Event;
import com.ryuqq.chronicle.core.event.Evolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.Supplier;

/**
 * Load → evolve → decide → append 흐름 실행기.
 *
 * <p>subject의 이벤트로 새 상태를 재구성하고, 그 상태로 명령을 결정한 뒤,
 * 로드 시점의 시퀀스를 기대값으로 append합니다. 다른 writer가 먼저 append하여
 * {@link SequenceConflictException}이 발생하면 상태를 새로 재구성하여 재시도합니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * CommandHandler&lt;Order&gt; handler = new CommandHandler&lt;&gt;(store, Order::new, 3);
 * long seq = handler.handle("orders.1", Command.of("ship-order", new ShipOrder()));
 * </pre>
 *
 * @param <S> 상태 타입 (Evolver이자 Decider)
 *
 * @author Chronicle Team
 * @since 1.0.0
 */
public final class CommandHandler<S extends Evolver & Decider> {

    private static final Logger log = LoggerFactory.getLogger(CommandHandler.class);

    private final EventStore store;
    private final Supplier<S> stateFactory;
    private final int maxAttempts;

    /**
     * @param store 이벤트 저장소
     * @param stateFactory 빈 상태 생성기 (시도마다 호출)
     * @param maxAttempts 최대 시도 횟수 (1 이상)
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public CommandHandler(EventStore store, Supplier<S> stateFactory, int maxAttempts) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (stateFactory == null) {
            throw new IllegalArgumentException("stateFactory cannot be null");
        }
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive (current: " + maxAttempts + ")");
        }
        this.store = store;
        this.stateFactory = stateFactory;
        this.maxAttempts = maxAttempts;
    }

    /**
     * 명령 처리.
     *
     * @param subject 대상 subject
     * @param command 명령
     * @return 마지막 저장 이벤트의 시퀀스 (저장할 이벤트가 없으면 로드 시점 시퀀스)
     * @throws SequenceConflictException 최대 시도 횟수 동안 충돌이 계속된 경우
     */
    public long handle(String subject, Command command) {
        if (command == null) {
            throw new IllegalArgumentException("command cannot be null");
        }
        for (int attempt = 1; ; attempt++) {
            S state = stateFactory.get();
            LoadResult loaded = store.load(subject);
            for (Event event : loaded.events()) {
                state.apply(event);
            }

            List<Event> events = state.decide(command);
            if (events == null || events.isEmpty()) {
                return loaded.lastSequence();
            }

            try {
                return store.append(subject, events, AppendOptions.expectSequence(loaded.lastSequence()));
            } catch (SequenceConflictException e) {
                if (attempt >= maxAttempts) {
                    throw e;
                }
                log.debug("Retrying command {} on {} after conflict (attempt {}/{})",
                    command.type(), subject, attempt, maxAttempts);
            }
        }
    }
}
