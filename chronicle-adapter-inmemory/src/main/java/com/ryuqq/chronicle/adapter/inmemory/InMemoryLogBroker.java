package com.ryuqq.chronicle.adapter.inmemory;

import com.ryuqq.chronicle.core.event.EnvelopeHeaders;
import com.ryuqq.chronicle.core.model.Deadline;
import com.ryuqq.chronicle.core.spi.BrokerException;
import com.ryuqq.chronicle.core.spi.BrokerMessage;
import com.ryuqq.chronicle.core.spi.BrokerTimeoutException;
import com.ryuqq.chronicle.core.spi.LogBroker;
import com.ryuqq.chronicle.core.spi.LogReader;
import com.ryuqq.chronicle.core.spi.PreconditionFailedException;
import com.ryuqq.chronicle.core.spi.PublishAck;
import com.ryuqq.chronicle.core.spi.StoredMessage;
import com.ryuqq.chronicle.core.spi.StreamConfig;
import com.ryuqq.chronicle.core.spi.StreamNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory implementation of {@link LogBroker} SPI for testing and reference purposes.
 *
 * <p>Mirrors the JetStream semantics the event store relies on, without a server.</p>
 *
 * <p><strong>Architecture:</strong></p>
 * <ul>
 *   <li><strong>Streams:</strong> ConcurrentHashMap&lt;String, StreamLog&gt; keyed by stream name</li>
 *   <li><strong>Per-stream log:</strong> ArrayList&lt;StoredMessage&gt; where index = sequence - 1</li>
 *   <li><strong>Dedup index:</strong> HashMap&lt;msgId, sequence&gt; per stream</li>
 *   <li><strong>Last-by-subject index:</strong> HashMap&lt;subject, sequence&gt; per stream</li>
 * </ul>
 *
 * <p><strong>Features:</strong></p>
 * <ul>
 *   <li>Stream-wide monotonically increasing sequences starting at 1</li>
 *   <li>Deduplication on {@code Nats-Msg-Id}, checked before the sequence precondition</li>
 *   <li>Expected-last-subject-sequence precondition</li>
 *   <li>Wildcard subjects ({@code *}, {@code >}) for reads and last-sequence queries</li>
 *   <li>Blocking ordered readers that wake up on new messages and honour their deadline</li>
 * </ul>
 *
 * <p><strong>Thread-safety:</strong> every stream is guarded by its own lock; readers wait on
 * that lock's condition. Different streams never contend.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryLogBroker broker = new InMemoryLogBroker();
 * Chronicle chronicle = Chronicle.of(broker, new ChronicleConfig());
 * EventStore store = chronicle.create(EventStoreConfig.of("orders"));
 * </pre>
 *
 * @author Chronicle Team
 * @since 1.0.0
 */
public class InMemoryLogBroker implements LogBroker {

    private static final Logger log = LoggerFactory.getLogger(InMemoryLogBroker.class);

    private final ConcurrentHashMap<String, StreamLog> streams;
    private final ReentrantLock adminLock = new ReentrantLock();

    /**
     * Creates an empty broker with no streams.
     */
    public InMemoryLogBroker() {
        this.streams = new ConcurrentHashMap<>();
    }

    @Override
    public PublishAck publish(String stream, BrokerMessage message, Long expectedLastSubjectSequence, Deadline deadline) {
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }
        checkDeadline("publish", deadline);
        StreamLog streamLog = streamLog(stream);
        return streamLog.append(message, expectedLastSubjectSequence);
    }

    @Override
    public long lastSequence(String stream, String subject, Deadline deadline) {
        requireSubject(subject);
        checkDeadline("lastSequence", deadline);
        return streamLog(stream).lastSequence(subject);
    }

    @Override
    public LogReader openReader(String stream, String subject, long startSequence, Deadline deadline) {
        requireSubject(subject);
        if (startSequence <= 0) {
            throw new IllegalArgumentException("startSequence must be positive, but was: " + startSequence);
        }
        checkDeadline("openReader", deadline);
        return new InMemoryLogReader(streamLog(stream), subject, startSequence);
    }

    @Override
    public void createStream(StreamConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        adminLock.lock();
        try {
            StreamLog existing = streams.get(config.name());
            if (existing != null) {
                if (existing.config().equals(config)) {
                    return;
                }
                throw new BrokerException("stream name already in use with a different configuration: " + config.name());
            }
            checkSubjectOverlap(config);
            streams.put(config.name(), new StreamLog(config));
        } finally {
            adminLock.unlock();
        }
        log.debug("Stream created: name={}, subjects={}", config.name(), config.subjects());
    }

    @Override
    public void updateStream(StreamConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        adminLock.lock();
        try {
            StreamLog streamLog = streamLog(config.name());
            checkSubjectOverlap(config);
            streamLog.updateConfig(config);
        } finally {
            adminLock.unlock();
        }
        log.debug("Stream updated: name={}, subjects={}", config.name(), config.subjects());
    }

    @Override
    public void deleteStream(String name) {
        StreamLog removed = streams.remove(name);
        if (removed == null) {
            throw new StreamNotFoundException(name);
        }
        removed.close();
        log.debug("Stream deleted: name={}", name);
    }

    @Override
    public StreamConfig describeStream(String name) {
        return streamLog(name).config();
    }

    /**
     * Removes every stream (for testing).
     */
    public void clear() {
        for (StreamLog streamLog : streams.values()) {
            streamLog.close();
        }
        streams.clear();
    }

    /**
     * Returns the number of messages stored in a stream (for testing).
     *
     * @param stream stream name
     * @return message count
     * @throws StreamNotFoundException if the stream does not exist
     */
    public int messageCount(String stream) {
        return streamLog(stream).size();
    }

    private StreamLog streamLog(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("stream cannot be null or blank");
        }
        StreamLog streamLog = streams.get(name);
        if (streamLog == null) {
            throw new StreamNotFoundException(name);
        }
        return streamLog;
    }

    private void checkSubjectOverlap(StreamConfig config) {
        for (StreamLog other : streams.values()) {
            if (other.config().name().equals(config.name())) {
                continue;
            }
            for (String subject : config.subjects()) {
                for (String taken : other.config().subjects()) {
                    if (SubjectPattern.overlaps(subject, taken)) {
                        throw new BrokerException("subject " + subject + " overlaps " + taken
                            + " of stream " + other.config().name());
                    }
                }
            }
        }
    }

    private static void requireSubject(String subject) {
        if (subject == null || subject.isBlank()) {
            throw new IllegalArgumentException("subject cannot be null or blank");
        }
    }

    private static void checkDeadline(String operation, Deadline deadline) {
        if (deadline == null) {
            throw new IllegalArgumentException("deadline cannot be null");
        }
        if (deadline.isExpired()) {
            throw new BrokerTimeoutException(operation, deadline.timeout());
        }
    }

    /**
     * Messages and indexes of one stream, guarded by a single lock.
     */
    private static final class StreamLog {

        private final ReentrantLock lock = new ReentrantLock();
        private final Condition appended = lock.newCondition();
        private final List<StoredMessage> messages = new ArrayList<>();
        private final Map<String, Long> sequenceByMsgId = new HashMap<>();
        private final Map<String, Long> lastBySubject = new HashMap<>();
        private volatile StreamConfig config;
        private volatile boolean closed;

        StreamLog(StreamConfig config) {
            this.config = config;
        }

        StreamConfig config() {
            return config;
        }

        void updateConfig(StreamConfig config) {
            this.config = config;
        }

        PublishAck append(BrokerMessage message, Long expectedLastSubjectSequence) {
            if (!accepts(message.subject())) {
                throw new BrokerException("no subject in stream " + config.name() + " matches " + message.subject());
            }
            lock.lock();
            try {
                if (closed) {
                    throw new StreamNotFoundException(config.name());
                }
                String msgId = message.header(EnvelopeHeaders.MSG_ID);
                if (msgId != null) {
                    Long original = sequenceByMsgId.get(msgId);
                    if (original != null) {
                        return new PublishAck(config.name(), original, true);
                    }
                }

                long actual = lastBySubject.getOrDefault(message.subject(), 0L);
                if (expectedLastSubjectSequence != null && expectedLastSubjectSequence != actual) {
                    throw new PreconditionFailedException(message.subject(), expectedLastSubjectSequence, actual);
                }

                long sequence = messages.size() + 1L;
                messages.add(new StoredMessage(config.name(), message.subject(), sequence, message.headers(), message.data()));
                lastBySubject.put(message.subject(), sequence);
                if (msgId != null) {
                    sequenceByMsgId.put(msgId, sequence);
                }
                appended.signalAll();
                return new PublishAck(config.name(), sequence, false);
            } finally {
                lock.unlock();
            }
        }

        long lastSequence(String subject) {
            lock.lock();
            try {
                if (!SubjectPattern.isWildcard(subject)) {
                    return lastBySubject.getOrDefault(subject, 0L);
                }
                long last = 0;
                for (Map.Entry<String, Long> entry : lastBySubject.entrySet()) {
                    if (entry.getValue() > last && SubjectPattern.matches(subject, entry.getKey())) {
                        last = entry.getValue();
                    }
                }
                return last;
            } finally {
                lock.unlock();
            }
        }

        /**
         * Returns the first matching message at or after the index, waiting until the deadline.
         */
        StoredMessage next(String subject, int fromIndex, Deadline deadline) throws InterruptedException {
            lock.lock();
            try {
                int index = fromIndex;
                while (true) {
                    while (index < messages.size()) {
                        StoredMessage candidate = messages.get(index);
                        if (SubjectPattern.matches(subject, candidate.subject())) {
                            return candidate;
                        }
                        index++;
                    }
                    if (closed) {
                        throw new StreamNotFoundException(config.name());
                    }
                    long remaining = deadline.remaining().toNanos();
                    if (remaining <= 0) {
                        return null;
                    }
                    appended.await(remaining, TimeUnit.NANOSECONDS);
                }
            } finally {
                lock.unlock();
            }
        }

        int size() {
            lock.lock();
            try {
                return messages.size();
            } finally {
                lock.unlock();
            }
        }

        void close() {
            lock.lock();
            try {
                closed = true;
                appended.signalAll();
            } finally {
                lock.unlock();
            }
        }

        private boolean accepts(String subject) {
            for (String pattern : config.subjects()) {
                if (SubjectPattern.matches(pattern, subject)) {
                    return true;
                }
            }
            return false;
        }
    }

    /**
     * Ordered cursor over one stream.
     */
    private static final class InMemoryLogReader implements LogReader {

        private final StreamLog streamLog;
        private final String subject;
        private int index;
        private boolean closed;

        InMemoryLogReader(StreamLog streamLog, String subject, long startSequence) {
            this.streamLog = streamLog;
            this.subject = subject;
            this.index = (int) Math.min(Integer.MAX_VALUE, startSequence - 1);
        }

        @Override
        public StoredMessage next(Deadline deadline) {
            if (closed) {
                throw new BrokerException("reader is closed");
            }
            if (deadline == null) {
                throw new IllegalArgumentException("deadline cannot be null");
            }
            StoredMessage message;
            try {
                message = streamLog.next(subject, index, deadline);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new BrokerException("interrupted while reading " + subject, e);
            }
            if (message == null) {
                throw new BrokerTimeoutException("next", deadline.timeout());
            }
            index = (int) message.sequence();
            return message;
        }

        @Override
        public void close() {
            closed = true;
        }
    }
}
