package com.ryuqq.chronicle.application.decider;

import com.ryuqq.chronicle.application.store.AppendOptions;
import com.ryuqq.chronicle.application.store.EventStore;
import com.ryuqq.chronicle.application.store.LoadResult;
import com.ryuqq.chronicle.application.store.SequenceConflictException;
import com.ryuqq.chronicle.core.event.Event;
import com.ryuqq.chronicle.core.event.Evolver;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * CommandHandler 유닛 테스트.
 *
 * @author Chronicle Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class CommandHandlerTest {

    private static final String SUBJECT = "counters.1";

    @Mock
    private EventStore store;

    /**
     * 최대 3까지 증가하는 카운터.
     */
    static class Counter implements Evolver, Decider {
        int value;

        @Override
        public void apply(Event event) {
            value++;
        }

        @Override
        public List<Event> decide(Command command) {
            if (value >= 3) {
                throw new IllegalStateException("limit reached");
            }
            List<Event> events = new ArrayList<>();
            events.add(Event.of(new byte[] {1}));
            return events;
        }
    }

    private static Event stored(long sequence) {
        return Event.builder().data(new byte[] {1}).sequence(sequence).build();
    }

    @Test
    void handle_로드한_시퀀스를_기대값으로_append() {
        // given
        when(store.load(SUBJECT)).thenReturn(new LoadResult(List.of(stored(1), stored(2)), 2));
        when(store.append(eq(SUBJECT), anyList(), eq(AppendOptions.expectSequence(2)))).thenReturn(3L);
        CommandHandler<Counter> handler = new CommandHandler<>(store, Counter::new, 1);

        // when
        long sequence = handler.handle(SUBJECT, Command.of("increment", "x"));

        // then
        assertThat(sequence).isEqualTo(3);
    }

    @Test
    void handle_충돌시_새_상태로_재시도() {
        // given
        when(store.load(SUBJECT)).thenReturn(
            new LoadResult(List.of(stored(1)), 1),
            new LoadResult(List.of(stored(1), stored(2)), 2));
        when(store.append(eq(SUBJECT), anyList(), any(AppendOptions.class)))
            .thenThrow(new SequenceConflictException("counters", SUBJECT, 1, 2, null))
            .thenReturn(3L);
        CommandHandler<Counter> handler = new CommandHandler<>(store, Counter::new, 2);

        // when
        long sequence = handler.handle(SUBJECT, Command.of("increment", "x"));

        // then
        assertThat(sequence).isEqualTo(3);
        verify(store, times(2)).load(SUBJECT);
        verify(store).append(eq(SUBJECT), anyList(), eq(AppendOptions.expectSequence(2)));
    }

    @Test
    void handle_최대_시도_초과시_충돌_전파() {
        when(store.load(SUBJECT)).thenReturn(new LoadResult(List.of(), 0));
        when(store.append(eq(SUBJECT), anyList(), any(AppendOptions.class)))
            .thenThrow(new SequenceConflictException("counters", SUBJECT, 0, 1, null));
        CommandHandler<Counter> handler = new CommandHandler<>(store, Counter::new, 2);

        assertThatThrownBy(() -> handler.handle(SUBJECT, Command.of("increment", "x")))
            .isInstanceOf(SequenceConflictException.class);
        verify(store, times(2)).append(eq(SUBJECT), anyList(), any(AppendOptions.class));
    }

    @Test
    void handle_결정_거부시_append_없음() {
        when(store.load(SUBJECT)).thenReturn(new LoadResult(List.of(stored(1), stored(2), stored(3)), 3));
        CommandHandler<Counter> handler = new CommandHandler<>(store, Counter::new, 1);

        assertThatThrownBy(() -> handler.handle(SUBJECT, Command.of("increment", "x")))
            .hasMessage("limit reached");
        verify(store, never()).append(anyString(), anyList(), any(AppendOptions.class));
    }

    @Test
    void command_type과_data_필수() {
        assertThatThrownBy(() -> Command.of(" ", "x")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Command.of("increment", null)).isInstanceOf(IllegalArgumentException.class);
    }
}
