package com.ryuqq.chronicle.core.spi;

import com.ryuqq.chronicle.core.model.Deadline;

/**
 * Durable log SPI used by the event store.
 *
 * <p>This interface abstracts the broker that owns the event log: it assigns sequences,
 * stores messages durably and serves ordered reads. Chronicle adds framing and
 * optimistic concurrency on top; everything stateful lives behind this interface.</p>
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Assigning a monotonically increasing sequence to every message of a stream</li>
 *   <li>Deduplicating publishes on the {@code Nats-Msg-Id} header</li>
 *   <li>Conditional publish on the last sequence stored for the message subject</li>
 *   <li>Answering "last sequence for this subject (or wildcard pattern)"</li>
 *   <li>Serving ephemeral, strictly ordered reads from a start sequence</li>
 *   <li>Creating, updating and deleting streams</li>
 * </ul>
 *
 * <p><strong>Subjects:</strong> dot-separated tokens ({@code orders.42}); reads and
 * last-sequence queries accept {@code *} (exactly one token) and {@code >} (one or more
 * trailing tokens).</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: one broker instance is shared by every event store of a runtime</li>
 *   <li>Deduplication is checked before the sequence precondition, so a retried publish
 *       returns its original acknowledgement even if the log has moved on</li>
 *   <li>A failed precondition must surface as {@link PreconditionFailedException}</li>
 *   <li>Every blocking call honours its {@link Deadline} and raises
 *       {@link BrokerTimeoutException} once it expires</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * long last = broker.lastSequence("orders", "orders.42", deadline);
 * try (LogReader reader = broker.openReader("orders", "orders.42", 1, deadline)) {
 *     StoredMessage msg;
 *     do {
 *         msg = reader.next(deadline);
 *     } while (msg.sequence() &lt; last);
 * }
 * </pre>
 *
 * @author Chronicle Team
 * @since 1.0.0
 */
public interface LogBroker {

    /**
     * Publishes a message to a stream.
     *
     * <p><strong>Deduplication:</strong> when the {@code Nats-Msg-Id} header names a message
     * already stored in the stream, nothing is stored and the original sequence is returned
     * with {@link PublishAck#duplicate()} set.</p>
     *
     * <p><strong>Precondition:</strong> when {@code expectedLastSubjectSequence} is not null,
     * the publish only succeeds if the last sequence stored for {@code message.subject()}
     * equals it ({@code 0} meaning "no message on this subject yet").</p>
     *
     * @param stream stream name
     * @param message message to store
     * @param expectedLastSubjectSequence expected last sequence for the subject, or null for none
     * @param deadline call deadline
     * @return acknowledgement with the assigned (or original) sequence
     * @throws PreconditionFailedException if the expected sequence does not match
     * @throws StreamNotFoundException if the stream does not exist
     * @throws BrokerException on any other failure
     */
    PublishAck publish(String stream, BrokerMessage message, Long expectedLastSubjectSequence, Deadline deadline);

    /**
     * Returns the sequence of the most recent message matching a subject.
     *
     * @param stream stream name
     * @param subject subject or wildcard pattern
     * @param deadline call deadline
     * @return last matching sequence, {@code 0} if no message matches
     * @throws StreamNotFoundException if the stream does not exist
     * @throws BrokerException on any other failure
     */
    long lastSequence(String stream, String subject, Deadline deadline);

    /**
     * Opens an ordered, read-only view of the messages matching a subject.
     *
     * <p>Messages are delivered in stream order starting at the first matching message whose
     * sequence is greater than or equal to {@code startSequence}. The reader is ephemeral:
     * nothing about it survives {@link LogReader#close()}.</p>
     *
     * @param stream stream name
     * @param subject subject or wildcard pattern
     * @param startSequence first sequence to consider ({@code 1} reads from the beginning)
     * @param deadline deadline for opening the reader
     * @return an open reader
     * @throws IllegalArgumentException if startSequence is not positive
     * @throws StreamNotFoundException if the stream does not exist
     * @throws BrokerException on any other failure
     */
    LogReader openReader(String stream, String subject, long startSequence, Deadline deadline);

    /**
     * Creates a stream.
     *
     * @param config stream definition
     * @throws BrokerException if a different stream with this name exists or creation fails
     */
    void createStream(StreamConfig config);

    /**
     * Replaces the definition of an existing stream.
     *
     * @param config new stream definition
     * @throws StreamNotFoundException if the stream does not exist
     * @throws BrokerException if the update is rejected
     */
    void updateStream(StreamConfig config);

    /**
     * Deletes a stream and all of its messages.
     *
     * @param name stream name
     * @throws StreamNotFoundException if the stream does not exist
     */
    void deleteStream(String name);

    /**
     * Returns the current definition of a stream.
     *
     * @param name stream name
     * @return stream definition
     * @throws StreamNotFoundException if the stream does not exist
     */
    StreamConfig describeStream(String name);
}
