package com.ryuqq.chronicle.application.store;

import com.ryuqq.chronicle.core.event.Event;
import com.ryuqq.chronicle.core.event.Evolver;

import java.util.List;

/**
 * Append-only event log bound to one broker stream.
 *
 * <p>An EventStore frames domain events into broker messages, enforces optimistic
 * concurrency per subject and rebuilds typed events on read. Subjects are the unit of
 * consistency: one aggregate or entity usually maps to one subject
 * ({@code orders.42}).</p>
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Completing events before they are written (id, type, time)</li>
 *   <li>Running {@link com.ryuqq.chronicle.core.event.Validator} hooks before any network call</li>
 *   <li>Translating a failed sequence precondition into {@link SequenceConflictException}</li>
 *   <li>Reading a consistent snapshot of a subject (or wildcard pattern)</li>
 *   <li>Folding events into a caller-owned projection</li>
 * </ul>
 *
 * <p><strong>Flow (load → decide → append):</strong></p>
 * <pre>
 * 1. load(subject)            → events + lastSequence
 * 2. evolve state / decide    → new events
 * 3. append(subject, events, AppendOptions.expectSequence(lastSequence))
 * 4. SequenceConflictException → reload and retry, or reject the command
 * </pre>
 *
 * <p><strong>Thread-safety:</strong> implementations are stateless apart from their
 * configuration and may be shared freely.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * EventStore store = chronicle.get("orders");
 *
 * long seq = store.append("orders.1", Event.of(new OrderPlaced("order-1")));
 *
 * OrderStats stats = new OrderStats();
 * long applied = store.evolve("orders.*", stats, LoadOptions.all());
 * </pre>
 *
 * @author Chronicle Team
 * @since 1.0.0
 */
public interface EventStore {

    /**
     * @return name of the backing stream
     */
    String name();

    /**
     * Appends events to a subject.
     *
     * <p>All events are completed and validated before the first publish, so a validation or
     * marshal failure never leaves a partial batch in the log. When an expected sequence is
     * given it guards the first event only; the rest of the batch follows it.</p>
     *
     * @param subject concrete subject (no wildcards)
     * @param events events to append, in order
     * @param options append options
     * @return sequence of the last appended event
     * @throws IllegalArgumentException if subject is invalid or events is empty
     * @throws EventTypeRequiredException if no type can be determined for an event
     * @throws EventIdRequiredException if an event has no id and no id generator is configured
     * @throws SequenceConflictException if the expected sequence does not match
     * @throws com.ryuqq.chronicle.core.spi.BrokerException on any broker failure
     */
    long append(String subject, List<Event> events, AppendOptions options);

    default long append(String subject, List<Event> events) {
        return append(subject, events, AppendOptions.none());
    }

    default long append(String subject, Event event, AppendOptions options) {
        return append(subject, List.of(event), options);
    }

    default long append(String subject, Event event) {
        return append(subject, List.of(event), AppendOptions.none());
    }

    /**
     * Loads the events of a subject or wildcard pattern.
     *
     * <p>The result covers a snapshot: the last sequence is read first and loading stops once
     * it is reached, so events appended concurrently are never included.</p>
     *
     * @param subject subject or wildcard pattern
     * @param options load options
     * @return events in log order and the snapshot sequence
     * @throws com.ryuqq.chronicle.core.type.UnmarshalException if a stored message cannot be decoded
     * @throws com.ryuqq.chronicle.core.spi.BrokerException on any broker failure
     */
    LoadResult load(String subject, LoadOptions options);

    default LoadResult load(String subject) {
        return load(subject, LoadOptions.all());
    }

    /**
     * Loads events and applies each to a projection in log order.
     *
     * @param subject subject or wildcard pattern
     * @param evolver projection
     * @param options load options
     * @return sequence of the last applied event (the starting position if there was nothing to apply)
     * @throws EvolutionException if the projection rejects an event
     */
    long evolve(String subject, Evolver evolver, LoadOptions options);

    default long evolve(String subject, Evolver evolver) {
        return evolve(subject, evolver, LoadOptions.all());
    }
}
