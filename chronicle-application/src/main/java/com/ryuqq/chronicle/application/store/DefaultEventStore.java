package com.ryuqq.chronicle.application.store;

import com.ryuqq.chronicle.application.runtime.ChronicleConfig;
import com.ryuqq.chronicle.core.event.Event;
import com.ryuqq.chronicle.core.event.Evolver;
import com.ryuqq.chronicle.core.event.Validator;
import com.ryuqq.chronicle.core.model.Deadline;
import com.ryuqq.chronicle.core.model.IdGenerator;
import com.ryuqq.chronicle.core.spi.BrokerMessage;
import com.ryuqq.chronicle.core.spi.LogBroker;
import com.ryuqq.chronicle.core.spi.LogReader;
import com.ryuqq.chronicle.core.spi.PreconditionFailedException;
import com.ryuqq.chronicle.core.spi.PublishAck;
import com.ryuqq.chronicle.core.spi.StoredMessage;
import com.ryuqq.chronicle.core.type.TypeRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link EventStore} implementation over a {@link LogBroker}.
 *
 * <p>Holds no mutable state; the broker owns the log.</p>
 *
 * @author Chronicle Team
 * @since 1.0.0
 */
public final class DefaultEventStore implements EventStore {

    private static final Logger log = LoggerFactory.getLogger(DefaultEventStore.class);

    private final LogBroker broker;
    private final String name;
    private final TypeRegistry registry;
    private final IdGenerator idGenerator;
    private final Clock clock;
    private final Duration defaultTimeout;
    private final EnvelopePacker packer;

    public DefaultEventStore(LogBroker broker, String name, ChronicleConfig config) {
        if (broker == null) {
            throw new IllegalArgumentException("broker cannot be null");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.broker = broker;
        this.name = name;
        this.registry = config.typeRegistry();
        this.idGenerator = config.idGenerator();
        this.clock = config.clock();
        this.defaultTimeout = config.defaultTimeout();
        this.packer = new EnvelopePacker(registry, config.codecs());
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public long append(String subject, List<Event> events, AppendOptions options) {
        requireSubject(subject, false);
        if (events == null || events.isEmpty()) {
            throw new IllegalArgumentException("events cannot be null or empty");
        }
        AppendOptions opts = options == null ? AppendOptions.none() : options;

        List<BrokerMessage> messages = new ArrayList<>(events.size());
        for (Event event : events) {
            messages.add(packer.pack(subject, complete(event)));
        }

        Deadline deadline = Deadline.after(opts.timeout() == null ? defaultTimeout : opts.timeout());
        long lastSequence = 0;
        for (int i = 0; i < messages.size(); i++) {
            Long expected = i == 0 ? opts.expectedSequence() : null;
            PublishAck ack;
            try {
                ack = broker.publish(name, messages.get(i), expected, deadline);
            } catch (PreconditionFailedException e) {
                log.warn("Sequence conflict on {}/{}: expected={}, actual={}",
                    name, subject, e.expectedSequence(), e.actualSequence());
                throw new SequenceConflictException(name, subject, e.expectedSequence(), e.actualSequence(), e);
            }
            if (ack.duplicate()) {
                log.debug("Duplicate event ignored by broker: stream={}, subject={}, sequence={}",
                    name, subject, ack.sequence());
            }
            lastSequence = ack.sequence();
        }

        log.debug("Appended {} events to {}/{} (last sequence {})", messages.size(), name, subject, lastSequence);
        return lastSequence;
    }

    private Event complete(Event event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        Object data = event.data();
        if (data == null) {
            throw new IllegalArgumentException("event data cannot be null");
        }

        String type = event.type();
        if (registry != null) {
            String registered = registry.lookup(data);
            if (type != null && !type.isBlank() && !type.equals(registered)) {
                throw new EventTypeMismatchException(type, registered);
            }
            type = registered;
        } else if (type == null || type.isBlank()) {
            throw new EventTypeRequiredException();
        }

        if (data instanceof Validator validator) {
            validator.validate();
        }

        String id = event.id();
        if (id == null || id.isBlank()) {
            if (idGenerator == null) {
                throw new EventIdRequiredException();
            }
            id = idGenerator.next();
        }

        Instant time = event.time() == null ? Instant.now(clock) : event.time();

        return event.toBuilder()
            .id(id)
            .type(type)
            .time(time)
            .build();
    }

    @Override
    public LoadResult load(String subject, LoadOptions options) {
        requireSubject(subject, true);
        LoadOptions opts = options == null ? LoadOptions.all() : options;
        Deadline deadline = Deadline.after(opts.timeout() == null ? defaultTimeout : opts.timeout());

        long lastSequence = broker.lastSequence(name, subject, deadline);
        if (lastSequence == 0) {
            return LoadResult.empty(0);
        }
        Long after = opts.afterSequence();
        if (after != null && after >= lastSequence) {
            return LoadResult.empty(lastSequence);
        }

        long start = after == null ? 1 : after + 1;
        List<Event> events = new ArrayList<>();
        try (LogReader reader = broker.openReader(name, subject, start, deadline)) {
            while (true) {
                StoredMessage message = reader.next(deadline);
                if (message.sequence() > lastSequence) {
                    break;
                }
                events.add(packer.unpack(message));
                if (message.sequence() == lastSequence) {
                    break;
                }
            }
        }

        log.debug("Loaded {} events from {}/{} (snapshot sequence {})", events.size(), name, subject, lastSequence);
        return new LoadResult(events, lastSequence);
    }

    @Override
    public long evolve(String subject, Evolver evolver, LoadOptions options) {
        if (evolver == null) {
            throw new IllegalArgumentException("evolver cannot be null");
        }
        LoadOptions opts = options == null ? LoadOptions.all() : options;
        LoadResult result = load(subject, opts);

        long applied = opts.afterSequence() == null ? 0 : opts.afterSequence();
        for (Event event : result.events()) {
            try {
                evolver.apply(event);
            } catch (RuntimeException e) {
                log.warn("Evolve stopped on {}/{} at sequence {}: {}", name, subject, event.sequence(), e.getMessage());
                throw new EvolutionException(applied, event.sequence(), e);
            }
            applied = event.sequence();
        }
        return applied;
    }

    private static void requireSubject(String subject, boolean allowWildcards) {
        if (subject == null || subject.isBlank()) {
            throw new IllegalArgumentException("subject cannot be null or blank");
        }
        if (!allowWildcards && (subject.contains("*") || subject.contains(">"))) {
            throw new IllegalArgumentException("subject must not contain wildcards: " + subject);
        }
    }
}
